package tenantdb.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A notification published by a registry, supervisor or sub-component.
 *
 * @param type       stable event name, e.g. {@code transaction-started}
 * @param source     name of the publishing component
 * @param attributes event payload, unmodifiable; values may be {@code null}
 * @param timestamp  when the event was published
 */
public record LifecycleEvent(String type, String source, Map<String, Object> attributes, Instant timestamp) {

  public LifecycleEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Returns a payload value, or {@code null} if absent.
   */
  public Object attribute(String key) {
    return attributes.get(key);
  }

  /**
   * Builds a payload map from alternating keys and values. Values may be {@code null}.
   */
  public static Map<String, Object> payload(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("keysAndValues must have an even length");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
    }
    return map;
  }
}
