package tenantdb.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import tenantdb.config.DatabaseConfig;
import tenantdb.jdbc.dialect.Dialects;
import tenantdb.spi.DatabaseTarget;
import tenantdb.spi.EngineDialect;
import tenantdb.spi.Handle;
import tenantdb.spi.HandleFactory;

import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link HandleFactory} that opens one HikariCP pool per handle.
 *
 * <p>{@code database.pool.min} and {@code database.pool.max} become Hikari's minimum idle and
 * maximum pool size; {@code database.properties.*} are passed to the driver as data source
 * properties.
 *
 * <pre>{@code
 * HandleFactory factory = HikariHandleFactory.builder()
 *     .connectionTimeoutMs(5_000)
 *     .customizer(config -> config.setLeakDetectionThreshold(60_000))
 *     .build();
 * }</pre>
 */
public final class HikariHandleFactory implements HandleFactory {
  private static final Logger logger = Logger.getLogger(HikariHandleFactory.class.getName());

  private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

  private final long connectionTimeoutMs;
  private final String poolNamePrefix;
  private final Consumer<HikariConfig> customizer;

  public HikariHandleFactory() {
    this(builder());
  }

  private HikariHandleFactory(Builder builder) {
    if (builder.connectionTimeoutMs < 250L) {
      throw new IllegalArgumentException("connectionTimeoutMs must be >= 250");
    }
    this.connectionTimeoutMs = builder.connectionTimeoutMs;
    this.poolNamePrefix = builder.poolNamePrefix;
    this.customizer = builder.customizer;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Handle create(DatabaseConfig config) throws SQLException {
    DatabaseTarget target = config.target();
    EngineDialect dialect = Dialects.detect(config.jdbcUrl());

    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.jdbcUrl());
    if (config.username() != null) {
      hikari.setUsername(config.username());
    }
    if (config.password() != null) {
      hikari.setPassword(config.password());
    }
    hikari.setMinimumIdle(config.poolMin());
    hikari.setMaximumPoolSize(Math.max(1, config.poolMax()));
    hikari.setConnectionTimeout(connectionTimeoutMs);
    hikari.setPoolName(poolNamePrefix + POOL_COUNTER.incrementAndGet());
    for (Map.Entry<String, String> property : config.properties().entrySet()) {
      hikari.addDataSourceProperty(property.getKey(), property.getValue());
    }
    if (customizer != null) {
      customizer.accept(hikari);
    }

    try {
      HikariDataSource dataSource = new HikariDataSource(hikari);
      logger.log(Level.FINE, "Opened pool {0} for {1} ({2})",
          new Object[] {hikari.getPoolName(), target.fingerprint(), dialect.name()});
      return new HikariHandle(dataSource, target, dialect);
    } catch (HikariPool.PoolInitializationException e) {
      if (e.getCause() instanceof SQLException sql) {
        throw sql;
      }
      throw new SQLException("Failed to open pool for " + target.fingerprint() + ": " + e.getMessage(), e);
    }
  }

  public static final class Builder {
    private long connectionTimeoutMs = 30_000L;
    private String poolNamePrefix = "tenantdb-pool-";
    private Consumer<HikariConfig> customizer;

    private Builder() {
    }

    /**
     * How long a borrower waits for a connection. Defaults to 30000, at least 250.
     */
    public Builder connectionTimeoutMs(long connectionTimeoutMs) {
      this.connectionTimeoutMs = connectionTimeoutMs;
      return this;
    }

    public Builder poolNamePrefix(String poolNamePrefix) {
      this.poolNamePrefix = poolNamePrefix;
      return this;
    }

    /**
     * Last-word adjustments to each pool's configuration.
     */
    public Builder customizer(Consumer<HikariConfig> customizer) {
      this.customizer = customizer;
      return this;
    }

    public HikariHandleFactory build() {
      return new HikariHandleFactory(this);
    }
  }
}
