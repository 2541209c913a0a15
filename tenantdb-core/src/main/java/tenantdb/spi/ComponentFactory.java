package tenantdb.spi;

/**
 * Creates the sub-component for one slot of one tenant.
 *
 * @param <C> component type of the slot
 */
@FunctionalInterface
public interface ComponentFactory<C extends LifecycleComponent> {

  C create(ComponentContext context);
}
