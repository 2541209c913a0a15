package tenantdb.tx;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearBackoffRetryPolicyTest {

  @Test
  void delayGrowsLinearlyWithAttempts() {
    LinearBackoffRetryPolicy policy = new LinearBackoffRetryPolicy(100);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(200, policy.computeDelayMs(2));
    assertEquals(500, policy.computeDelayMs(5));
  }

  @Test
  void zeroBaseDelayNeverWaits() {
    assertEquals(0, new LinearBackoffRetryPolicy(0).computeDelayMs(7));
  }

  @Test
  void nonPositiveAttemptsNeverWait() {
    assertEquals(0, new LinearBackoffRetryPolicy(100).computeDelayMs(0));
  }

  @Test
  void jitterStaysWithinRatio() {
    LinearBackoffRetryPolicy policy = new LinearBackoffRetryPolicy(1000, 0.2);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 800 && delay < 1200, "delay out of range: " + delay);
    }
  }

  @Test
  void hugeAttemptCountDoesNotOverflow() {
    long delay = new LinearBackoffRetryPolicy(Long.MAX_VALUE / 2).computeDelayMs(10);

    assertEquals(Long.MAX_VALUE, delay);
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new LinearBackoffRetryPolicy(-1));
    assertThrows(IllegalArgumentException.class, () -> new LinearBackoffRetryPolicy(100, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new LinearBackoffRetryPolicy(100, -0.1));
  }
}
