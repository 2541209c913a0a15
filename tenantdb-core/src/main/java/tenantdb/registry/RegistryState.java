package tenantdb.registry;

/**
 * Lifecycle of a {@link TenantRegistry}.
 */
public enum RegistryState {
  CREATED,
  INITIALIZED,
  SHUTTING_DOWN,
  SHUTDOWN
}
