package tenantdb.registry;

/**
 * Weighted 0 to 100 health score.
 *
 * <ul>
 *   <li>30 points when the supervisor is initialized</li>
 *   <li>25 points when its handle is connected</li>
 *   <li>up to 25 points for the fraction of healthy sub-components (all 25 without any)</li>
 *   <li>20, 15, 10 or 5 points for probe latency within 0.5x, 1x, 1.5x of the threshold, or above</li>
 * </ul>
 */
public final class HealthScorer {
  private static final int INITIALIZED_POINTS = 30;
  private static final int CONNECTED_POINTS = 25;
  private static final int COMPONENT_POINTS = 25;

  private HealthScorer() {
  }

  public static int score(boolean initialized, boolean connected, int healthyComponents, int totalComponents,
      long latencyMs, long thresholdMs) {
    if (thresholdMs <= 0) {
      throw new IllegalArgumentException("thresholdMs must be > 0");
    }
    if (totalComponents < 0 || healthyComponents < 0 || healthyComponents > totalComponents) {
      throw new IllegalArgumentException("healthyComponents must be within 0.." + totalComponents);
    }
    int score = 0;
    if (initialized) {
      score += INITIALIZED_POINTS;
    }
    if (connected) {
      score += CONNECTED_POINTS;
    }
    score += totalComponents == 0
        ? COMPONENT_POINTS
        : (int) Math.round(healthyComponents * (double) COMPONENT_POINTS / totalComponents);
    score += performancePoints(latencyMs, thresholdMs);
    return Math.min(100, Math.max(0, score));
  }

  static int performancePoints(long latencyMs, long thresholdMs) {
    if (latencyMs * 2 <= thresholdMs) {
      return 20;
    }
    if (latencyMs <= thresholdMs) {
      return 15;
    }
    if (latencyMs * 2 <= thresholdMs * 3) {
      return 10;
    }
    return 5;
  }
}
