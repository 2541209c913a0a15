package tenantdb.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import tenantdb.spi.DatabaseTarget;
import tenantdb.spi.EngineDialect;
import tenantdb.spi.Handle;
import tenantdb.spi.PoolStats;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link Handle} owning a HikariCP pool. Pool statistics come from the pool's MXBean.
 */
public final class HikariHandle implements Handle {
  private final HikariDataSource dataSource;
  private final DatabaseTarget target;
  private final EngineDialect dialect;

  HikariHandle(HikariDataSource dataSource, DatabaseTarget target, EngineDialect dialect) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.target = Objects.requireNonNull(target, "target");
    this.dialect = dialect != null ? dialect : EngineDialect.GENERIC;
  }

  @Override
  public Connection getConnection() throws SQLException {
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
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    if (pool == null) {
      return PoolStats.unpooled(dataSource.getMinimumIdle(), dataSource.getMaximumPoolSize());
    }
    return new PoolStats(
        dataSource.getMinimumIdle(),
        dataSource.getMaximumPoolSize(),
        pool.getActiveConnections(),
        pool.getIdleConnections(),
        pool.getThreadsAwaitingConnection());
  }

  @Override
  public boolean isClosed() {
    return dataSource.isClosed();
  }

  @Override
  public void close() {
    if (!dataSource.isClosed()) {
      dataSource.close();
    }
  }

  public HikariDataSource dataSource() {
    return dataSource;
  }

  @Override
  public String toString() {
    return "HikariHandle[" + dataSource.getPoolName() + ", " + target.fingerprint() + "]";
  }
}
