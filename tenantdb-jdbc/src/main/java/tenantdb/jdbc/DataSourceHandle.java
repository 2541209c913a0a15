package tenantdb.jdbc;

import tenantdb.jdbc.dialect.Dialects;
import tenantdb.spi.DatabaseTarget;
import tenantdb.spi.EngineDialect;
import tenantdb.spi.Handle;
import tenantdb.spi.PoolStats;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Handle} over an application-managed {@link DataSource}.
 *
 * <p>Delegates directly to {@link DataSource#getConnection()}. {@link #close()} marks the handle
 * closed and closes the data source only if it is {@link AutoCloseable}.
 */
public final class DataSourceHandle implements Handle {
  private static final Logger logger = Logger.getLogger(DataSourceHandle.class.getName());

  private final DataSource dataSource;
  private final DatabaseTarget target;
  private final EngineDialect dialect;
  private final PoolStats stats;
  private volatile boolean closed;

  public DataSourceHandle(DataSource dataSource, DatabaseTarget target, EngineDialect dialect) {
    this(dataSource, target, dialect, PoolStats.unpooled(0, 0));
  }

  public DataSourceHandle(DataSource dataSource, DatabaseTarget target, EngineDialect dialect, PoolStats stats) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.target = Objects.requireNonNull(target, "target");
    this.dialect = dialect != null ? dialect : EngineDialect.GENERIC;
    this.stats = Objects.requireNonNull(stats, "stats");
  }

  /**
   * Wraps {@code dataSource}, detecting the dialect from {@code jdbcUrl}.
   */
  public static DataSourceHandle of(DataSource dataSource, String jdbcUrl, DatabaseTarget target) {
    return new DataSourceHandle(dataSource, target, Dialects.detect(jdbcUrl));
  }

  @Override
  public Connection getConnection() throws SQLException {
    if (closed) {
      throw new SQLException("Handle for " + target.fingerprint() + " is closed");
    }
    return dataSource.getConnection();
  }

  @Override
  public DatabaseTarget target() {
    return target;
  }

  @Override
  public EngineDialect dialect() {
    return dialect;
  }

  @Override
  public PoolStats poolStats() {
    return stats;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Closing data source for " + target.fingerprint() + " failed", e);
      }
    }
  }

  public DataSource dataSource() {
    return dataSource;
  }
}
