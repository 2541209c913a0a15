package tenantdb.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bottom configuration layer applied beneath registry and tenant settings.
 */
public final class Defaults {

  private static final Settings SETTINGS;

  static {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("registry.enableHealthMonitoring", false);
    map.put("registry.healthCheckInterval", 30_000L);
    map.put("registry.healthPerformanceThreshold", 2_000L);
    map.put("registry.shutdownTimeout", 30_000L);

    map.put("database.shared", false);
    map.put("database.pool.min", 2);
    map.put("database.pool.max", 10);
    map.put("database.validation.attempts", 3);
    map.put("database.validation.retryDelay", 1_000L);

    map.put("security.enabled", true);
    map.put("migrations.enabled", false);
    map.put("seeds.enabled", false);
    map.put("models.enabled", false);

    map.put("transactions.enabled", true);
    map.put("transactions.timeout", 30_000L);
    map.put("transactions.maxRetries", 3);
    map.put("transactions.retryDelay", 1_000L);
    map.put("transactions.maxConcurrentTransactions", 50);
    map.put("transactions.maxTransactionTime", 300_000L);
    map.put("transactions.cleanupInterval", 60_000L);
    map.put("transactions.longTransactionThreshold", 30_000L);
    map.put("transactions.warnLongTransactions", true);
    map.put("transactions.maxHistorySize", 1_000);
    map.put("transactions.maxHistoryAge", 3_600_000L);
    map.put("transactions.shutdownTimeout", 10_000L);
    SETTINGS = Settings.of(map);
  }

  private Defaults() {
  }

  public static Settings settings() {
    return SETTINGS;
  }
}
