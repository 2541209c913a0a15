package tenantdb.event;

/**
 * Capability of publishing {@link LifecycleEvent}s to registered listeners.
 */
public interface EventSource {

  /**
   * Wildcard type matching every event.
   */
  String ALL_EVENTS = "*";

  /**
   * Registers a listener for one event type, or {@link #ALL_EVENTS}.
   */
  void addListener(String eventType, LifecycleListener listener);

  /**
   * Registers a listener for every event type.
   */
  default void addListener(LifecycleListener listener) {
    addListener(ALL_EVENTS, listener);
  }

  /**
   * Removes a listener from every type it was registered for.
   */
  void removeListener(LifecycleListener listener);
}
