package tenantdb.spi;

import tenantdb.config.Settings;

/**
 * Applies and reverts versioned scripts against a handle. Bookkeeping (batches, executed
 * names, owning tenant) is the implementation's concern.
 */
public interface ScriptComponent extends LifecycleComponent {

  MigrationResult migrate(Handle handle, Settings options);

  RollbackResult rollback(Handle handle, Settings options);
}
