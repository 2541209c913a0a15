package tenantdb.testing;

import org.h2.jdbcx.JdbcDataSource;
import tenantdb.spi.DatabaseTarget;
import tenantdb.spi.EngineDialect;
import tenantdb.spi.Handle;
import tenantdb.spi.PoolStats;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unpooled handle over an in-memory H2 database. Can be told to fail or slow down connection
 * requests, and counts how often it was closed.
 */
public final class TestHandle implements Handle {
  private final JdbcDataSource dataSource = new JdbcDataSource();
  private final DatabaseTarget target;
  private final AtomicInteger closeCount = new AtomicInteger();
  private final AtomicInteger connectionCount = new AtomicInteger();
  private final AtomicBoolean failing = new AtomicBoolean();
  private volatile long connectDelayMs;

  public TestHandle(String jdbcUrl, DatabaseTarget target) {
    dataSource.setURL(jdbcUrl);
    dataSource.setUser("sa");
    this.target = target;
  }

  /** Handle over a fresh, uniquely named in-memory database. */
  public static TestHandle inMemory() {
    String name = "t_" + UUID.randomUUID().toString().replace('-', '_');
    return new TestHandle(url(name), new DatabaseTarget("h2", null, null, "mem:" + name));
  }

  public static String url(String databaseName) {
    return "jdbc:h2:mem:" + databaseName + ";DB_CLOSE_DELAY=-1";
  }

  @Override
  public Connection getConnection() throws SQLException {
    if (closeCount.get() > 0) {
      throw new SQLException("handle is closed");
    }
    if (failing.get()) {
      throw new SQLException("Connection refused (ECONNREFUSED)", "08001");
    }
    long delay = connectDelayMs;
    if (delay > 0) {
      try {
        Thread.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SQLException("interrupted while connecting", e);
      }
    }
    connectionCount.incrementAndGet();
    return dataSource.getConnection();
  }

  @Override
  public DatabaseTarget target() {
    return target;
  }

  @Override
  public EngineDialect dialect() {
    return EngineDialect.GENERIC;
  }

  @Override
  public PoolStats poolStats() {
    return PoolStats.unpooled(0, 1);
  }

  @Override
  public boolean isClosed() {
    return closeCount.get() > 0;
  }

  @Override
  public void close() {
    closeCount.incrementAndGet();
  }

  public int closeCount() {
    return closeCount.get();
  }

  public int connectionCount() {
    return connectionCount.get();
  }

  public void setFailing(boolean failing) {
    this.failing.set(failing);
  }

  public void setConnectDelayMs(long connectDelayMs) {
    this.connectDelayMs = connectDelayMs;
  }

  public void execute(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute(sql);
    }
  }

  public long count(String table) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         var rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getLong(1);
    }
  }
}
