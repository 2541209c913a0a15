package tenantdb.supervisor;

import java.time.Instant;
import java.util.List;

/**
 * Progress of the most recent {@link ConnectionSupervisor#warmPool()} call.
 */
public record PoolWarmingStatus(
    Phase phase,
    Instant startTime,
    Instant endTime,
    int target,
    int completed,
    int failed,
    List<String> errors) {

  public enum Phase {
    IDLE,
    WARMING,
    COMPLETED,
    FAILED
  }

  public PoolWarmingStatus {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static PoolWarmingStatus idle() {
    return new PoolWarmingStatus(Phase.IDLE, null, null, 0, 0, 0, List.of());
  }

  static PoolWarmingStatus started(int target) {
    return new PoolWarmingStatus(Phase.WARMING, Instant.now(), null, target, 0, 0, List.of());
  }

  PoolWarmingStatus finished(int completed, int failed, List<String> errors) {
    return new PoolWarmingStatus(completed > 0 ? Phase.COMPLETED : Phase.FAILED,
        startTime, Instant.now(), target, completed, failed, errors);
  }

  public boolean inProgress() {
    return phase == Phase.WARMING;
  }
}
