package tenantdb.supervisor;

/**
 * Lifecycle of a {@link ConnectionSupervisor}.
 *
 * <p>{@code CREATED → INITIALIZING → INITIALIZED → SHUTTING_DOWN → SHUTDOWN}. A failed
 * initialization returns to {@code CREATED}; a failed shutdown returns to {@code INITIALIZED}.
 */
public enum SupervisorState {
  CREATED,
  INITIALIZING,
  INITIALIZED,
  SHUTTING_DOWN,
  SHUTDOWN
}
