package tenantdb.spi;

import tenantdb.config.DatabaseConfig;

import java.sql.SQLException;

/**
 * Builds {@link Handle}s from database configuration.
 */
@FunctionalInterface
public interface HandleFactory {

  Handle create(DatabaseConfig config) throws SQLException;
}
