package tenantdb.tx;

import java.sql.Connection;
import java.util.Locale;

/**
 * Transaction isolation levels accepted by the coordinator.
 */
public enum IsolationLevel {
  READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED),
  READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
  REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
  SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

  private final int jdbcLevel;

  IsolationLevel(int jdbcLevel) {
    this.jdbcLevel = jdbcLevel;
  }

  /** The matching {@code java.sql.Connection.TRANSACTION_*} constant. */
  public int jdbcLevel() {
    return jdbcLevel;
  }

  /** SQL spelling, e.g. {@code READ COMMITTED}. */
  public String sqlName() {
    return name().replace('_', ' ');
  }

  /**
   * Parses {@code read committed}, {@code READ_COMMITTED} or {@code read-committed}.
   *
   * @throws IllegalArgumentException for anything else
   */
  public static IsolationLevel parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Isolation level must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    for (IsolationLevel level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Invalid isolation level: " + value
        + ". Must be one of: READ UNCOMMITTED, READ COMMITTED, REPEATABLE READ, SERIALIZABLE");
  }
}
