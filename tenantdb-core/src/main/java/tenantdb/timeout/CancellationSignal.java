package tenantdb.timeout;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag handed to operations run through
 * {@link TimeoutController#withCancellableDeadline}.
 *
 * <p>The flag is raised when the deadline elapses. The worker thread is also interrupted, so
 * blocking JDBC calls that honor interruption return early; everything else must poll
 * {@link #isCancelled()} or call {@link #throwIfCancelled()} at safe points.
 */
public final class CancellationSignal {
  private volatile boolean cancelled;
  private volatile String reason;

  public boolean isCancelled() {
    return cancelled;
  }

  public String reason() {
    return reason;
  }

  /**
   * Raises the flag. Later calls keep the first reason.
   */
  public void cancel(String reason) {
    if (!cancelled) {
      this.reason = reason;
      cancelled = true;
    }
  }

  /**
   * @throws CancellationException if the signal was raised
   */
  public void throwIfCancelled() {
    if (cancelled) {
      throw new CancellationException(reason == null ? "cancelled" : reason);
    }
  }
}
