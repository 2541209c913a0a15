package tenantdb.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a component's state as reported by {@link LifecycleComponent#status()}.
 *
 * @param name        component name
 * @param initialized whether {@code initialize()} completed
 * @param healthy     whether the component considers itself usable
 * @param details     component-specific values
 */
public record ComponentStatus(String name, boolean initialized, boolean healthy, Map<String, Object> details) {

  public ComponentStatus {
    details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }
}
