package tenantdb.spi;

/**
 * The sub-component slots of a connection supervisor, in initialization order.
 */
public enum ComponentSlot {
  SECURITY("security", "securityManager"),
  MIGRATION("migrations", "migrationManager"),
  SEED("seeds", "seedManager"),
  MODEL("models", "modelManager"),
  TRANSACTION("transactions", "transactionManager");

  private final String configKey;
  private final String componentName;

  ComponentSlot(String configKey, String componentName) {
    this.configKey = configKey;
    this.componentName = componentName;
  }

  /** Settings section holding this slot's configuration, with an {@code enabled} flag. */
  public String configKey() {
    return configKey;
  }

  /** Name used in status reports and events. */
  public String componentName() {
    return componentName;
  }
}
