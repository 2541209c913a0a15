package tenantdb.spi;

import java.time.Instant;

/**
 * Outcome of a lifecycle call on a component.
 */
public record ComponentResult(boolean success, String message, Instant timestamp) {

  public static ComponentResult ok(String message) {
    return new ComponentResult(true, message, Instant.now());
  }

  public static ComponentResult failed(String message) {
    return new ComponentResult(false, message, Instant.now());
  }
}
