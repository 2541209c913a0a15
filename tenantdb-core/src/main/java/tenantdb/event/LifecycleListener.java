package tenantdb.event;

/**
 * Receives {@link LifecycleEvent}s. Exceptions thrown here are logged by the publisher and
 * never reach the code that published the event.
 */
@FunctionalInterface
public interface LifecycleListener {

  void onEvent(LifecycleEvent event);
}
