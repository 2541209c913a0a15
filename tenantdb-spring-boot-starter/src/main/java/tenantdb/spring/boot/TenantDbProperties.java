package tenantdb.spring.boot;

import tenantdb.config.Settings;
import tenantdb.config.TenantConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the tenant registry.
 *
 * <pre>
 * tenantdb.registry.enable-health-monitoring=true
 * tenantdb.tenants.billing.url=jdbc:postgresql://db/billing
 * tenantdb.tenants.billing.shared=true
 * tenantdb.tenants.reports.use-connection=billing
 * tenantdb.tenants.reports.settings.migrations.enabled=true
 * </pre>
 *
 * @see TenantDbAutoConfiguration
 */
@ConfigurationProperties(prefix = "tenantdb")
public class TenantDbProperties {

  private final Registry registry = new Registry();
  private final Transactions transactions = new Transactions();
  private final Metrics metrics = new Metrics();

  /**
   * Tenants registered at startup, keyed by tenant name, in declaration order.
   */
  private Map<String, Tenant> tenants = new LinkedHashMap<>();

  public Registry getRegistry() {
    return registry;
  }

  public Transactions getTransactions() {
    return transactions;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Map<String, Tenant> getTenants() {
    return tenants;
  }

  public void setTenants(Map<String, Tenant> tenants) {
    this.tenants = tenants;
  }

  /**
   * Registry-level settings layer: the {@code registry} and {@code transactions} sections.
   */
  public Settings toSettings() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("registry.enableHealthMonitoring", registry.isEnableHealthMonitoring());
    map.put("registry.healthCheckInterval", registry.getHealthCheckInterval().toMillis());
    map.put("registry.healthPerformanceThreshold", registry.getHealthPerformanceThreshold().toMillis());
    map.put("registry.shutdownTimeout", registry.getShutdownTimeout().toMillis());

    map.put("transactions.enabled", transactions.isEnabled());
    map.put("transactions.timeout", transactions.getTimeout().toMillis());
    map.put("transactions.maxRetries", transactions.getMaxRetries());
    map.put("transactions.retryDelay", transactions.getRetryDelay().toMillis());
    map.put("transactions.maxConcurrentTransactions", transactions.getMaxConcurrentTransactions());
    map.put("transactions.maxTransactionTime", transactions.getMaxTransactionTime().toMillis());
    map.put("transactions.isolationLevel", transactions.getIsolationLevel());
    return Settings.of(map);
  }

  public static class Registry {
    private boolean enableHealthMonitoring;
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration healthPerformanceThreshold = Duration.ofSeconds(2);
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public boolean isEnableHealthMonitoring() {
      return enableHealthMonitoring;
    }

    public void setEnableHealthMonitoring(boolean enableHealthMonitoring) {
      this.enableHealthMonitoring = enableHealthMonitoring;
    }

    public Duration getHealthCheckInterval() {
      return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
      this.healthCheckInterval = healthCheckInterval;
    }

    public Duration getHealthPerformanceThreshold() {
      return healthPerformanceThreshold;
    }

    public void setHealthPerformanceThreshold(Duration healthPerformanceThreshold) {
      this.healthPerformanceThreshold = healthPerformanceThreshold;
    }

    public Duration getShutdownTimeout() {
      return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
    }
  }

  public static class Transactions {
    private boolean enabled = true;
    private Duration timeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    private int maxConcurrentTransactions = 50;
    private Duration maxTransactionTime = Duration.ofMinutes(5);

    /**
     * Default isolation level name, e.g. {@code READ_COMMITTED}. Unset keeps the driver default.
     */
    private String isolationLevel;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }

    public int getMaxConcurrentTransactions() {
      return maxConcurrentTransactions;
    }

    public void setMaxConcurrentTransactions(int maxConcurrentTransactions) {
      this.maxConcurrentTransactions = maxConcurrentTransactions;
    }

    public Duration getMaxTransactionTime() {
      return maxTransactionTime;
    }

    public void setMaxTransactionTime(Duration maxTransactionTime) {
      this.maxTransactionTime = maxTransactionTime;
    }

    public String getIsolationLevel() {
      return isolationLevel;
    }

    public void setIsolationLevel(String isolationLevel) {
      this.isolationLevel = isolationLevel;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "tenantdb";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  /**
   * One tenant's connection details. Anything not covered by a dedicated property goes under
   * {@code settings}, using the same section names as programmatic configuration.
   */
  public static class Tenant {
    private String url;
    private String username;
    private String password;
    private Boolean shared;
    private Integer poolMin;
    private Integer poolMax;

    /**
     * Name of an already registered shared tenant to reuse, or {@code *} for any compatible one.
     */
    private String useConnection;
    private String cwd;
    private Map<String, String> properties = new LinkedHashMap<>();
    private Map<String, Object> settings = new LinkedHashMap<>();

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public Boolean getShared() {
      return shared;
    }

    public void setShared(Boolean shared) {
      this.shared = shared;
    }

    public Integer getPoolMin() {
      return poolMin;
    }

    public void setPoolMin(Integer poolMin) {
      this.poolMin = poolMin;
    }

    public Integer getPoolMax() {
      return poolMax;
    }

    public void setPoolMax(Integer poolMax) {
      this.poolMax = poolMax;
    }

    public String getUseConnection() {
      return useConnection;
    }

    public void setUseConnection(String useConnection) {
      this.useConnection = useConnection;
    }

    public String getCwd() {
      return cwd;
    }

    public void setCwd(String cwd) {
      this.cwd = cwd;
    }

    public Map<String, String> getProperties() {
      return properties;
    }

    public void setProperties(Map<String, String> properties) {
      this.properties = properties;
    }

    public Map<String, Object> getSettings() {
      return settings;
    }

    public void setSettings(Map<String, Object> settings) {
      this.settings = settings;
    }

    /**
     * Dedicated properties win over the same keys given under {@code settings}.
     */
    public TenantConfig toConfig() {
      Map<String, Object> explicit = new LinkedHashMap<>();
      explicit.put("database.jdbcUrl", url);
      explicit.put("database.username", username);
      explicit.put("database.password", password);
      explicit.put("database.shared", shared);
      explicit.put("database.pool.min", poolMin);
      explicit.put("database.pool.max", poolMax);
      if (!properties.isEmpty()) {
        explicit.put("database.properties", new LinkedHashMap<>(properties));
      }
      explicit.put("useConnection", useConnection);
      explicit.put("cwd", cwd);
      return TenantConfig.of(Settings.of(settings).merge(Settings.of(explicit)));
    }
  }
}
