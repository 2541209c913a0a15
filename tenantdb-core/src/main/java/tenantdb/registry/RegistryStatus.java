package tenantdb.registry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot returned by {@link TenantRegistry#status()}.
 *
 * @param state            registry lifecycle state
 * @param tenants          registered tenant names in registration order
 * @param sharedReferences tenants per shared-handle fingerprint
 * @param latestHealth     most recent health sample per tenant
 * @param healthMonitoring whether the periodic health loop is running
 * @param timestamp        when the snapshot was taken
 */
public record RegistryStatus(
    RegistryState state,
    List<String> tenants,
    Map<String, Set<String>> sharedReferences,
    Map<String, HealthSample> latestHealth,
    boolean healthMonitoring,
    Instant timestamp) {

  public RegistryStatus {
    tenants = List.copyOf(tenants);
    sharedReferences = Map.copyOf(sharedReferences);
    latestHealth = Map.copyOf(latestHealth);
  }
}
