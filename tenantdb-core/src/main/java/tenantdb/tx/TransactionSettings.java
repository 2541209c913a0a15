package tenantdb.tx;

import tenantdb.ConfigurationException;
import tenantdb.config.Defaults;
import tenantdb.config.Settings;

/**
 * Tuning of a {@link TransactionCoordinator}, read from a {@code transactions} settings section.
 *
 * @param timeoutMs                  deadline of one attempt
 * @param maxRetries                 retries after the first attempt for transient failures
 * @param retryDelayMs               base delay; attempt {@code n} waits {@code retryDelayMs × n}
 * @param isolationLevel             default isolation level, or {@code null} for the driver default
 * @param maxConcurrentTransactions  ceiling of simultaneously active transactions
 * @param maxTransactionTimeMs       age after which the sweep force-rolls-back a transaction
 * @param cleanupIntervalMs          delay between sweeps
 * @param longTransactionThresholdMs duration above which a committed transaction is reported
 * @param warnLongTransactions       whether long transactions are reported
 * @param maxHistorySize             finished transactions kept
 * @param maxHistoryAgeMs            age after which finished transactions are dropped
 * @param shutdownTimeoutMs          wait for active transactions on shutdown
 */
public record TransactionSettings(
    long timeoutMs,
    int maxRetries,
    long retryDelayMs,
    IsolationLevel isolationLevel,
    int maxConcurrentTransactions,
    long maxTransactionTimeMs,
    long cleanupIntervalMs,
    long longTransactionThresholdMs,
    boolean warnLongTransactions,
    int maxHistorySize,
    long maxHistoryAgeMs,
    long shutdownTimeoutMs) {

  public TransactionSettings {
    requirePositive("timeout", timeoutMs);
    if (maxRetries < 0) {
      throw invalid("maxRetries must be >= 0");
    }
    if (retryDelayMs < 0) {
      throw invalid("retryDelay must be >= 0");
    }
    requirePositive("maxConcurrentTransactions", maxConcurrentTransactions);
    requirePositive("maxTransactionTime", maxTransactionTimeMs);
    requirePositive("cleanupInterval", cleanupIntervalMs);
    requirePositive("longTransactionThreshold", longTransactionThresholdMs);
    requirePositive("maxHistorySize", maxHistorySize);
    requirePositive("maxHistoryAge", maxHistoryAgeMs);
    requirePositive("shutdownTimeout", shutdownTimeoutMs);
  }

  public static TransactionSettings defaults() {
    return from(Defaults.settings().section("transactions"));
  }

  /**
   * Reads a {@code transactions} section; missing keys fall back to {@link Defaults}.
   */
  public static TransactionSettings from(Settings section) {
    Settings s = Defaults.settings().section("transactions").merge(section);
    String isolation = s.getString("isolationLevel", null);
    IsolationLevel level;
    try {
      level = isolation == null ? null : IsolationLevel.parse(isolation);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), "configuration", null, e);
    }
    return new TransactionSettings(
        s.getLong("timeout", 30_000L),
        s.getInt("maxRetries", 3),
        s.getLong("retryDelay", 1_000L),
        level,
        s.getInt("maxConcurrentTransactions", 50),
        s.getLong("maxTransactionTime", 300_000L),
        s.getLong("cleanupInterval", 60_000L),
        s.getLong("longTransactionThreshold", 30_000L),
        s.getBoolean("warnLongTransactions", true),
        s.getInt("maxHistorySize", 1_000),
        s.getLong("maxHistoryAge", 3_600_000L),
        s.getLong("shutdownTimeout", 10_000L));
  }

  private static void requirePositive(String name, long value) {
    if (value <= 0) {
      throw invalid(name + " must be > 0, got: " + value);
    }
  }

  private static ConfigurationException invalid(String message) {
    return new ConfigurationException("transactions." + message, "configuration", null);
  }
}
