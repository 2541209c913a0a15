package tenantdb.spi;

/**
 * Point-in-time view of a handle's connection pool.
 *
 * @param minIdle  configured minimum idle connections
 * @param max      configured maximum pool size
 * @param active   connections currently checked out
 * @param idle     connections idle in the pool
 * @param pending  threads waiting for a connection
 */
public record PoolStats(int minIdle, int max, int active, int idle, int pending) {

  /**
   * Stats for a handle without a pool, using the configured bounds.
   */
  public static PoolStats unpooled(int minIdle, int max) {
    return new PoolStats(minIdle, max, 0, 0, 0);
  }

  /**
   * True when every connection is in use and callers are queueing.
   */
  public boolean saturated() {
    return max > 0 && active >= max && pending > 0;
  }

  public int total() {
    return active + idle;
  }
}
