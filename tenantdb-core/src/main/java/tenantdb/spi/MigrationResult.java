package tenantdb.spi;

import java.util.List;

/**
 * Outcome of applying migrations or seeds.
 *
 * @param success    whether the run succeeded
 * @param migrations names of the scripts applied, in order
 * @param disabled   true when the component is not enabled and nothing ran
 */
public record MigrationResult(boolean success, List<String> migrations, boolean disabled) {

  public MigrationResult {
    migrations = migrations == null ? List.of() : List.copyOf(migrations);
  }

  public static MigrationResult applied(List<String> migrations) {
    return new MigrationResult(true, migrations, false);
  }

  public static MigrationResult disabledResult() {
    return new MigrationResult(true, List.of(), true);
  }
}
