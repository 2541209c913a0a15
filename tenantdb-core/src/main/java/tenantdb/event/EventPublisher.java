package tenantdb.event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link EventSource} implementation that components own and publish through.
 *
 * <p>Listeners for the exact type run first, then wildcard listeners, each group in
 * registration order. Delivery is synchronous on the publishing thread.
 */
public final class EventPublisher implements EventSource {
  private static final Logger logger = Logger.getLogger(EventPublisher.class.getName());

  private final String source;
  private final Map<String, CopyOnWriteArrayList<LifecycleListener>> listeners = new ConcurrentHashMap<>();

  public EventPublisher(String source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  @Override
  public void addListener(String eventType, LifecycleListener listener) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(listener, "listener");
    listeners.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(listener);
  }

  @Override
  public void removeListener(LifecycleListener listener) {
    for (CopyOnWriteArrayList<LifecycleListener> list : listeners.values()) {
      list.remove(listener);
    }
  }

  /**
   * Publishes an event with the given payload.
   */
  public void publish(String eventType, Map<String, Object> attributes) {
    List<LifecycleListener> targets = listenersFor(eventType);
    if (targets.isEmpty()) {
      return;
    }
    LifecycleEvent event = new LifecycleEvent(eventType, source, attributes, Instant.now());
    for (LifecycleListener listener : targets) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener failed for event '" + eventType + "' from " + source, e);
      }
    }
  }

  public void publish(String eventType) {
    publish(eventType, Map.of());
  }

  /**
   * Publishes an {@code error} event carrying {@code phase}, {@code message} and {@code timestamp}.
   */
  public void error(String phase, Throwable error, Map<String, Object> extra) {
    publish("error", notification(phase, error == null ? "unknown error" : String.valueOf(error.getMessage()), extra));
  }

  /**
   * Publishes a {@code warning} event carrying {@code phase}, {@code message} and {@code timestamp}.
   */
  public void warning(String phase, String message, Map<String, Object> extra) {
    publish("warning", notification(phase, message, extra));
  }

  public String source() {
    return source;
  }

  private List<LifecycleListener> listenersFor(String eventType) {
    List<LifecycleListener> result = new ArrayList<>();
    CopyOnWriteArrayList<LifecycleListener> specific = listeners.get(eventType);
    if (specific != null) {
      result.addAll(specific);
    }
    CopyOnWriteArrayList<LifecycleListener> wildcard = listeners.get(ALL_EVENTS);
    if (wildcard != null) {
      result.addAll(wildcard);
    }
    return result;
  }

  private static Map<String, Object> notification(String phase, String message, Map<String, Object> extra) {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (extra != null) {
      payload.putAll(extra);
    }
    payload.put("phase", phase);
    payload.put("message", message);
    payload.put("timestamp", Instant.now());
    return payload;
  }
}
