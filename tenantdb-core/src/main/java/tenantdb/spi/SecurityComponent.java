package tenantdb.spi;

import tenantdb.config.DatabaseConfig;

import java.sql.SQLException;

/**
 * Security collaborator that owns creation and destruction of the tenant's handle.
 */
public interface SecurityComponent extends LifecycleComponent {

  Handle createHandle(DatabaseConfig config) throws SQLException;

  /**
   * Closes the handle created by {@link #createHandle}, if any.
   */
  void destroyHandle();
}
