package tenantdb.tx;

import java.time.Instant;

/**
 * Snapshot of a transaction, active or finished.
 *
 * @param id         transaction id, stable across retries
 * @param tenantName owning tenant
 * @param startTime  when the first attempt began
 * @param endTime    when the transaction finished, or {@code null} while active
 * @param durationMs elapsed time so far, or total duration once finished
 * @param status     current status
 * @param attempts   attempts made
 * @param error      failure message, or {@code null}
 */
public record TransactionRecord(
    String id,
    String tenantName,
    Instant startTime,
    Instant endTime,
    long durationMs,
    TransactionStatus status,
    int attempts,
    String error) {
}
