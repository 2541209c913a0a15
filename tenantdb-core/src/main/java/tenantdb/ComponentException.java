package tenantdb;

import tenantdb.spi.ComponentSlot;

/**
 * Thrown when a sub-component (security, migration, seed, model, transaction) fails.
 */
public final class ComponentException extends TenantDbException {
  private final ComponentSlot slot;

  public ComponentException(ComponentSlot slot, String phase, String tenantName, Throwable cause) {
    super(slot.componentName() + " failed during " + phase + " for '" + tenantName + "': "
        + (cause == null ? "unknown error" : cause.getMessage()), phase, tenantName, cause);
    this.slot = slot;
  }

  public ComponentSlot slot() {
    return slot;
  }
}
