package tenantdb.supervisor;

import tenantdb.ConfigurationException;
import tenantdb.config.Settings;
import tenantdb.spi.ComponentContext;
import tenantdb.spi.ComponentFactory;
import tenantdb.spi.ComponentSlot;
import tenantdb.spi.LifecycleComponent;
import tenantdb.spi.MigrationComponent;
import tenantdb.spi.ModelComponent;
import tenantdb.spi.SecurityComponent;
import tenantdb.spi.SeedComponent;
import tenantdb.tx.TransactionComponent;
import tenantdb.tx.TransactionCoordinator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One factory per sub-component slot, fixed when the registry is built.
 *
 * <p>The typed builder methods make a factory for the wrong slot a compile error. Security and
 * transactions have defaults; migrations, seeds and models must be supplied before a tenant can
 * enable them.
 *
 * <pre>{@code
 * ComponentFactories factories = ComponentFactories.builder()
 *     .migrations(ctx -> new FlywayMigrations(ctx.settings()))
 *     .build();
 * }</pre>
 */
public final class ComponentFactories {
  private final Map<ComponentSlot, ComponentFactory<? extends LifecycleComponent>> factories;

  private ComponentFactories(Map<ComponentSlot, ComponentFactory<? extends LifecycleComponent>> factories) {
    this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
  }

  /**
   * Default security and transaction factories, nothing else.
   */
  public static ComponentFactories defaults() {
    return builder().build();
  }

  /**
   * Builder pre-populated with the defaults.
   */
  public static Builder builder() {
    return new Builder()
        .security(DefaultSecurityComponent.factory())
        .transactions(TransactionCoordinator.factory());
  }

  public boolean has(ComponentSlot slot) {
    return factories.containsKey(slot);
  }

  public Set<ComponentSlot> slots() {
    return factories.keySet();
  }

  /**
   * Creates the component for {@code slot}.
   *
   * @throws ConfigurationException if the slot has no factory or the factory returned null
   */
  public LifecycleComponent create(ComponentSlot slot, ComponentContext context) {
    ComponentFactory<? extends LifecycleComponent> factory = factories.get(slot);
    if (factory == null) {
      throw new ConfigurationException("No factory registered for component '" + slot.configKey()
          + "' but it is enabled", "component-initialization", context.tenantName());
    }
    LifecycleComponent component = factory.create(context);
    if (component == null) {
      throw new ConfigurationException("Factory for component '" + slot.configKey() + "' returned null",
          "component-initialization", context.tenantName());
    }
    return component;
  }

  /**
   * Checks that every slot enabled in {@code defaults} has a factory.
   */
  public void validateAgainst(Settings defaults) {
    for (ComponentSlot slot : ComponentSlot.values()) {
      if (defaults.getBoolean(slot.configKey() + ".enabled", false) && !has(slot)) {
        throw new ConfigurationException("Component '" + slot.configKey()
            + "' is enabled by default but has no factory", "registry-build", null);
      }
    }
  }

  public static final class Builder {
    private final Map<ComponentSlot, ComponentFactory<? extends LifecycleComponent>> factories =
        new EnumMap<>(ComponentSlot.class);

    private Builder() {
    }

    public Builder security(ComponentFactory<? extends SecurityComponent> factory) {
      return put(ComponentSlot.SECURITY, factory);
    }

    public Builder migrations(ComponentFactory<? extends MigrationComponent> factory) {
      return put(ComponentSlot.MIGRATION, factory);
    }

    public Builder seeds(ComponentFactory<? extends SeedComponent> factory) {
      return put(ComponentSlot.SEED, factory);
    }

    public Builder models(ComponentFactory<? extends ModelComponent> factory) {
      return put(ComponentSlot.MODEL, factory);
    }

    public Builder transactions(ComponentFactory<? extends TransactionComponent> factory) {
      return put(ComponentSlot.TRANSACTION, factory);
    }

    /**
     * Removes a slot's factory, e.g. to forbid security delegation altogether.
     */
    public Builder without(ComponentSlot slot) {
      factories.remove(slot);
      return this;
    }

    public ComponentFactories build() {
      return new ComponentFactories(factories);
    }

    private Builder put(ComponentSlot slot, ComponentFactory<? extends LifecycleComponent> factory) {
      factories.put(slot, Objects.requireNonNull(factory, slot.configKey() + " factory"));
      return this;
    }
  }
}
