package tenantdb.registry;

import java.util.List;

/**
 * What a best-effort rollback (clear models, roll back seeds, roll back migrations) achieved.
 *
 * @param skipped              rollback was not requested
 * @param modelsCleared        models removed
 * @param seedsRolledBack      seeds reverted
 * @param migrationsRolledBack migrations reverted
 * @param errors               one message per failed step; later steps still ran
 */
public record RollbackReport(
    boolean skipped,
    int modelsCleared,
    List<String> seedsRolledBack,
    List<String> migrationsRolledBack,
    List<String> errors) {

  public RollbackReport {
    seedsRolledBack = seedsRolledBack == null ? List.of() : List.copyOf(seedsRolledBack);
    migrationsRolledBack = migrationsRolledBack == null ? List.of() : List.copyOf(migrationsRolledBack);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static RollbackReport skippedReport() {
    return new RollbackReport(true, 0, List.of(), List.of(), List.of());
  }

  public boolean success() {
    return errors.isEmpty();
  }
}
