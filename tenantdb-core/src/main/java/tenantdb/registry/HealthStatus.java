package tenantdb.registry;

/**
 * Category of one health sample.
 */
public enum HealthStatus {
  /** Score of at least 80. */
  HEALTHY,
  /** Score of at least 50. */
  DEGRADED,
  UNHEALTHY,
  /** The probe did not finish within the probe timeout. */
  TIMEOUT;

  static HealthStatus fromScore(int score) {
    if (score >= 80) {
      return HEALTHY;
    }
    if (score >= 50) {
      return DEGRADED;
    }
    return UNHEALTHY;
  }
}
