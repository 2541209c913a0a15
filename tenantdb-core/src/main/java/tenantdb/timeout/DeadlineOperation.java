package tenantdb.timeout;

/**
 * Work guarded by {@link TimeoutController#withDeadline}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface DeadlineOperation<T> {

  T run() throws Exception;
}
