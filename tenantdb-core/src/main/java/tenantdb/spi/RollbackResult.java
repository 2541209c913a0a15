package tenantdb.spi;

import java.util.List;

/**
 * Outcome of rolling back migrations or seeds.
 *
 * @param success    whether the rollback succeeded
 * @param rolledBack names of the scripts reverted, in order
 * @param disabled   true when the component is not enabled and nothing ran
 */
public record RollbackResult(boolean success, List<String> rolledBack, boolean disabled) {

  public RollbackResult {
    rolledBack = rolledBack == null ? List.of() : List.copyOf(rolledBack);
  }

  public static RollbackResult reverted(List<String> rolledBack) {
    return new RollbackResult(true, rolledBack, false);
  }

  public static RollbackResult disabledResult() {
    return new RollbackResult(true, List.of(), true);
  }
}
