package tenantdb.spi;

import tenantdb.event.EventPublisher;
import tenantdb.event.LifecycleListener;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Base class handling listener bookkeeping and the initialized flag, so implementations only
 * supply their own start and stop logic.
 */
public abstract class AbstractLifecycleComponent implements LifecycleComponent {
  protected final EventPublisher events;
  private volatile boolean initialized;

  protected AbstractLifecycleComponent(String name) {
    this.events = new EventPublisher(Objects.requireNonNull(name, "name"));
  }

  @Override
  public final ComponentResult initialize() {
    if (initialized) {
      return ComponentResult.ok("already initialized");
    }
    try {
      doInitialize();
    } catch (RuntimeException e) {
      events.error("initialize", e, Map.of());
      throw e;
    }
    initialized = true;
    return ComponentResult.ok("initialized");
  }

  @Override
  public final ComponentResult shutdown(Duration timeout) {
    if (!initialized) {
      return ComponentResult.ok("not initialized");
    }
    try {
      doShutdown(timeout);
    } catch (RuntimeException e) {
      events.error("shutdown", e, Map.of());
      throw e;
    }
    initialized = false;
    return ComponentResult.ok("shut down");
  }

  @Override
  public ComponentStatus status() {
    return new ComponentStatus(events.source(), initialized, initialized, Map.of());
  }

  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public void addListener(String eventType, LifecycleListener listener) {
    events.addListener(eventType, listener);
  }

  @Override
  public void removeListener(LifecycleListener listener) {
    events.removeListener(listener);
  }

  protected abstract void doInitialize();

  protected abstract void doShutdown(Duration timeout);
}
