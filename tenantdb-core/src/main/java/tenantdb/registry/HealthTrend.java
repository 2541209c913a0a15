package tenantdb.registry;

import java.util.List;

/**
 * Direction of a tenant's score over its last three samples.
 */
public enum HealthTrend {
  STABLE,
  RISING,
  FALLING,
  VOLATILE;

  private static final int WINDOW = 3;

  /**
   * Fewer than three samples count as stable. Otherwise the change from the first to the last
   * of the final three decides: below 5 stable, above 10 rising, below -10 falling.
   */
  public static HealthTrend of(List<HealthSample> history) {
    if (history.size() < WINDOW) {
      return STABLE;
    }
    int first = history.get(history.size() - WINDOW).score();
    int last = history.get(history.size() - 1).score();
    int delta = last - first;
    if (Math.abs(delta) < 5) {
      return STABLE;
    }
    if (delta > 10) {
      return RISING;
    }
    if (delta < -10) {
      return FALLING;
    }
    return VOLATILE;
  }
}
