package tenantdb.testing;

import tenantdb.spi.AbstractLifecycleComponent;
import tenantdb.spi.Handle;
import tenantdb.spi.ModelComponent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps model definitions in memory.
 */
public final class StubModels extends AbstractLifecycleComponent implements ModelComponent {
  private final Journal journal;
  private final Map<String, Object> models = new LinkedHashMap<>();
  private volatile boolean failRegister;

  public StubModels(Journal journal) {
    super("modelManager");
    this.journal = journal;
  }

  @Override
  public synchronized List<String> registerModels(Handle handle, Map<String, Object> definitions) {
    journal.add("models.register");
    if (failRegister) {
      throw new IllegalStateException("model registration exploded");
    }
    models.putAll(definitions);
    return new ArrayList<>(definitions.keySet());
  }

  @Override
  public synchronized int clearModels() {
    journal.add("models.clear");
    int cleared = models.size();
    models.clear();
    return cleared;
  }

  @Override
  public synchronized Set<String> modelNames() {
    return Set.copyOf(models.keySet());
  }

  @Override
  public synchronized Optional<Object> model(String name) {
    return Optional.ofNullable(models.get(name));
  }

  public void setFailRegister(boolean failRegister) {
    this.failRegister = failRegister;
  }

  @Override
  protected void doInitialize() {
    journal.add("models.initialize");
  }

  @Override
  protected void doShutdown(Duration timeout) {
    journal.add("models.shutdown");
  }
}
