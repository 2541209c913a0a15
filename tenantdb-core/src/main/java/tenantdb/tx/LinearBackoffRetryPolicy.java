package tenantdb.tx;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Linear backoff: {@code baseDelay × attempts}, optionally spread by a jitter ratio.
 *
 * <p>With {@code jitterRatio = 0.2} a computed delay of 1000ms becomes a value in [800, 1200).
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final double jitterRatio;

  public LinearBackoffRetryPolicy(long baseDelayMs) {
    this(baseDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs delay after the first attempt (milliseconds)
   * @param jitterRatio relative spread in [0, 1)
   */
  public LinearBackoffRetryPolicy(long baseDelayMs, double jitterRatio) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
      throw new IllegalArgumentException("jitterRatio must be in [0, 1), got: " + jitterRatio);
    }
    this.baseDelayMs = baseDelayMs;
    this.jitterRatio = jitterRatio;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long linear = baseDelayMs > Long.MAX_VALUE / attempts ? Long.MAX_VALUE : baseDelayMs * attempts;
    if (jitterRatio == 0.0) {
      return linear;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitterRatio, 1.0 + jitterRatio);
    return Math.max(0L, (long) (linear * factor));
  }
}
