package tenantdb.timeout;

/**
 * Work guarded by {@link TimeoutController#withCancellableDeadline} that observes a
 * {@link CancellationSignal}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CancellableOperation<T> {

  T run(CancellationSignal signal) throws Exception;
}
