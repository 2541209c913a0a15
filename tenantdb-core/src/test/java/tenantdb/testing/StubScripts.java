package tenantdb.testing;

import tenantdb.config.Settings;
import tenantdb.spi.AbstractLifecycleComponent;
import tenantdb.spi.Handle;
import tenantdb.spi.MigrationComponent;
import tenantdb.spi.MigrationResult;
import tenantdb.spi.RollbackResult;
import tenantdb.spi.SeedComponent;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Script components that record calls into a shared {@link Journal} instead of touching the
 * database.
 */
public abstract class StubScripts extends AbstractLifecycleComponent {
  private final String label;
  private final Journal journal;
  private final List<String> scripts;
  private final List<Settings> migrateOptions = new CopyOnWriteArrayList<>();
  private final List<Settings> rollbackOptions = new CopyOnWriteArrayList<>();
  private volatile boolean failMigrate;
  private volatile boolean throwOnMigrate;
  private volatile boolean failRollback;

  protected StubScripts(String name, String label, Journal journal, List<String> scripts) {
    super(name);
    this.label = label;
    this.journal = journal;
    this.scripts = List.copyOf(scripts);
  }

  public MigrationResult migrate(Handle handle, Settings options) {
    journal.add(label + ".migrate");
    migrateOptions.add(options);
    if (throwOnMigrate) {
      throw new IllegalStateException(label + " migrate exploded");
    }
    if (failMigrate) {
      return new MigrationResult(false, scripts.subList(0, Math.min(1, scripts.size())), false);
    }
    return MigrationResult.applied(scripts);
  }

  public RollbackResult rollback(Handle handle, Settings options) {
    journal.add(label + ".rollback");
    rollbackOptions.add(options);
    if (failRollback) {
      throw new IllegalStateException(label + " rollback exploded");
    }
    return RollbackResult.reverted(scripts);
  }

  public List<Settings> migrateOptions() {
    return List.copyOf(migrateOptions);
  }

  public List<Settings> rollbackOptions() {
    return List.copyOf(rollbackOptions);
  }

  public void setFailMigrate(boolean failMigrate) {
    this.failMigrate = failMigrate;
  }

  public void setThrowOnMigrate(boolean throwOnMigrate) {
    this.throwOnMigrate = throwOnMigrate;
  }

  public void setFailRollback(boolean failRollback) {
    this.failRollback = failRollback;
  }

  @Override
  protected void doInitialize() {
    journal.add(label + ".initialize");
  }

  @Override
  protected void doShutdown(Duration timeout) {
    journal.add(label + ".shutdown");
  }

  public static final class Migrations extends StubScripts implements MigrationComponent {
    public Migrations(Journal journal, List<String> scripts) {
      super("migrationManager", "migrations", journal, scripts);
    }
  }

  public static final class Seeds extends StubScripts implements SeedComponent {
    public Seeds(Journal journal, List<String> scripts) {
      super("seedManager", "seeds", journal, scripts);
    }
  }
}
