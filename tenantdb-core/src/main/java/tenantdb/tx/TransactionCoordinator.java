package tenantdb.tx;

import tenantdb.TransactionFailedException;
import tenantdb.TransactionLimitExceededException;
import tenantdb.spi.AbstractLifecycleComponent;
import tenantdb.spi.ComponentFactory;
import tenantdb.spi.ComponentStatus;
import tenantdb.spi.Handle;
import tenantdb.spi.MetricsExporter;
import tenantdb.timeout.CancellationSignal;
import tenantdb.timeout.TimeoutContext;
import tenantdb.timeout.TimeoutController;
import tenantdb.util.NamedThreadFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import static tenantdb.event.LifecycleEvent.payload;

/**
 * Executes units of work inside database transactions for one tenant.
 *
 * <p>Each call gets a transaction id that stays the same across retries. An attempt runs under
 * a cancellable deadline; failures classified as transient by {@link TransientErrorClassifier}
 * (and deadline overruns) are retried after {@code retryDelay × attempt} until
 * {@code maxRetries} is spent. A background sweep force-rolls-back transactions older than
 * {@code maxTransactionTime} and records them as {@link TransactionStatus#TIMED_OUT}.
 *
 * <pre>{@code
 * TransactionCoordinator coordinator = TransactionCoordinator.builder()
 *     .tenantName("billing")
 *     .timeouts(timeouts)
 *     .build();
 * coordinator.initialize();
 * int rows = coordinator.run(conn -> {
 *   try (var ps = conn.prepareStatement("UPDATE account SET balance = balance - 10 WHERE id = 1")) {
 *     return ps.executeUpdate();
 *   }
 * }, TransactionOptions.on(handle).withIsolation(IsolationLevel.SERIALIZABLE));
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class TransactionCoordinator extends AbstractLifecycleComponent implements TransactionComponent {
  private static final Logger logger = Logger.getLogger(TransactionCoordinator.class.getName());

  public static final String COMPONENT_NAME = "transactionManager";

  private final String tenantName;
  private final TimeoutController timeouts;
  private final MetricsExporter metrics;
  private final RetryPolicy retryPolicy;
  private volatile TransactionSettings settings;

  private final Map<String, ActiveTransaction> active = new LinkedHashMap<>();
  private final Deque<TransactionRecord> history = new ArrayDeque<>();

  private final AtomicLong total = new AtomicLong();
  private final AtomicLong successful = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong timedOut = new AtomicLong();
  private final AtomicLong attempts = new AtomicLong();
  private final AtomicLong retries = new AtomicLong();
  private final AtomicLong totalDurationMs = new AtomicLong();
  private final AtomicLong longestDurationMs = new AtomicLong();

  private ScheduledExecutorService sweeper;
  private ScheduledFuture<?> sweepTask;

  private TransactionCoordinator(Builder builder) {
    super(COMPONENT_NAME);
    this.tenantName = Objects.requireNonNull(builder.tenantName, "tenantName");
    this.timeouts = Objects.requireNonNull(builder.timeouts, "timeouts");
    this.settings = builder.settings != null ? builder.settings : TransactionSettings.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.retryPolicy = builder.retryPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Factory for the transaction slot of a connection supervisor.
   */
  public static ComponentFactory<TransactionCoordinator> factory() {
    return context -> builder()
        .tenantName(context.tenantName())
        .settings(TransactionSettings.from(context.settings()))
        .timeouts(context.timeouts())
        .metrics(context.metrics())
        .build();
  }

  // ── Lifecycle ──

  @Override
  protected void doInitialize() {
    events.publish("initialization-started", payload("connectionName", tenantName));
    startSweep();
    events.publish("initialization-completed", payload("connectionName", tenantName,
        "maxConcurrentTransactions", settings.maxConcurrentTransactions()));
  }

  @Override
  protected void doShutdown(Duration timeout) {
    stopSweep();
    long waitMs = timeout == null
        ? settings.shutdownTimeoutMs()
        : Math.min(timeout.toMillis(), settings.shutdownTimeoutMs());
    awaitDrained(waitMs);

    List<ActiveTransaction> remaining;
    synchronized (active) {
      remaining = new ArrayList<>(active.values());
    }
    int forced = 0;
    for (ActiveTransaction tx : remaining) {
      if (terminate(tx, TransactionStatus.FAILED, "Transaction manager shut down while transaction was active")) {
        forced++;
      }
    }
    if (forced > 0) {
      logger.log(Level.WARNING, "Rolled back {0} active transaction(s) of ''{1}'' during shutdown",
          new Object[] {forced, tenantName});
    }
    events.publish("shutdown-completed", payload("connectionName", tenantName, "forcedRollbacks", forced));
  }

  /**
   * Replaces the settings. A changed cleanup interval reschedules the sweep.
   */
  public synchronized void updateSettings(TransactionSettings newSettings) {
    Objects.requireNonNull(newSettings, "newSettings");
    TransactionSettings previous = settings;
    settings = newSettings;
    if (sweepTask != null && previous.cleanupIntervalMs() != newSettings.cleanupIntervalMs()) {
      sweepTask.cancel(false);
      sweepTask = null;
      startSweep();
    }
    logger.log(Level.INFO, "Transaction settings updated for ''{0}''", tenantName);
  }

  public TransactionSettings settings() {
    return settings;
  }

  // ── Execution ──

  @Override
  public <T> T run(UnitOfWork<T> work, TransactionOptions options) {
    Objects.requireNonNull(work, "work");
    Objects.requireNonNull(options, "options");
    if (!isInitialized()) {
      throw new IllegalStateException("TransactionCoordinator for '" + tenantName + "' is not initialized");
    }

    TransactionSettings cfg = settings;
    long timeoutMs = options.timeoutMs() != null ? options.timeoutMs() : cfg.timeoutMs();
    IsolationLevel isolation = options.isolationLevel() != null ? options.isolationLevel() : cfg.isolationLevel();
    Handle handle = options.handle();

    ActiveTransaction tx = register(cfg);
    events.publish("transaction-started", payload(
        "transactionId", tx.id,
        "connectionName", tenantName,
        "isolationLevel", isolation == null ? null : isolation.sqlName(),
        "timeout", timeoutMs));

    int attempt = 0;
    while (true) {
      attempt++;
      if (tx.isFinished()) {
        throw new TransactionFailedException(tx.id, tenantName, attempt - 1, new IllegalStateException(tx.error));
      }
      tx.attempts = attempt;
      attempts.incrementAndGet();
      final int current = attempt;
      TimeoutContext context = new TimeoutContext("transaction", COMPONENT_NAME, tenantName,
          () -> onAttemptTimeout(tx, current, timeoutMs));
      try {
        T result = timeouts.withCancellableDeadline(
            signal -> executeAttempt(tx, work, handle, isolation, cfg, signal), timeoutMs, context);
        complete(tx, TransactionStatus.COMMITTED, null);
        return result;
      } catch (Exception e) {
        if (tx.isFinished()) {
          throw new TransactionFailedException(tx.id, tenantName, attempt, e);
        }
        boolean retry = attempt <= cfg.maxRetries() && TransientErrorClassifier.isTransient(e, handle.dialect());
        events.publish("transaction-failed", payload(
            "transactionId", tx.id,
            "connectionName", tenantName,
            "attempt", attempt,
            "error", String.valueOf(e.getMessage()),
            "willRetry", retry));
        if (!retry) {
          complete(tx, TransactionStatus.FAILED, e);
          throw new TransactionFailedException(tx.id, tenantName, attempt, e);
        }
        retries.incrementAndGet();
        metrics.incrementTransactionRetried();
        long delayMs = retryPolicy != null
            ? retryPolicy.computeDelayMs(attempt)
            : new LinearBackoffRetryPolicy(cfg.retryDelayMs()).computeDelayMs(attempt);
        logger.log(Level.FINE, "Transaction {0} attempt {1} failed transiently, retrying in {2}ms",
            new Object[] {tx.id, attempt, delayMs});
        if (!pause(delayMs)) {
          complete(tx, TransactionStatus.FAILED, e);
          throw new TransactionFailedException(tx.id, tenantName, attempt, e);
        }
      }
    }
  }

  private <T> T executeAttempt(ActiveTransaction tx, UnitOfWork<T> work, Handle handle,
      IsolationLevel isolation, TransactionSettings cfg, CancellationSignal signal) throws Exception {
    try (JdbcTransaction jdbcTx = JdbcTransaction.begin(handle.getConnection())) {
      tx.attach(jdbcTx, signal);
      if (isolation != null) {
        applyIsolation(tx, jdbcTx, isolation);
      }
      long startNanos = System.nanoTime();
      T result = work.execute(jdbcTx.connection());
      if (!tx.beginCommit(signal)) {
        throw new CancellationException("Transaction " + tx.id + " was cancelled before commit");
      }
      try {
        jdbcTx.commit();
      } catch (SQLException | RuntimeException e) {
        tx.endCommit();
        throw e;
      }
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      if (cfg.warnLongTransactions() && elapsedMs > cfg.longTransactionThresholdMs()) {
        logger.log(Level.WARNING, "Long transaction {0} on ''{1}'' took {2}ms",
            new Object[] {tx.id, tenantName, elapsedMs});
        events.publish("long-transaction", payload(
            "transactionId", tx.id,
            "connectionName", tenantName,
            "duration", elapsedMs,
            "threshold", cfg.longTransactionThresholdMs()));
      }
      return result;
    } finally {
      tx.detach();
    }
  }

  private void applyIsolation(ActiveTransaction tx, JdbcTransaction jdbcTx, IsolationLevel isolation) {
    try {
      jdbcTx.setIsolation(isolation);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to set isolation level " + isolation.sqlName()
          + " for transaction " + tx.id, e);
      events.warning("isolation-level", "Failed to set isolation level " + isolation.sqlName()
          + ": " + e.getMessage(), payload("transactionId", tx.id, "connectionName", tenantName));
    }
  }

  private void onAttemptTimeout(ActiveTransaction tx, int attempt, long timeoutMs) {
    tx.abortCurrent(timeouts.executor());
    events.publish("transaction-timeout", payload(
        "transactionId", tx.id,
        "connectionName", tenantName,
        "attempt", attempt,
        "timeout", timeoutMs));
  }

  private static boolean pause(long delayMs) {
    if (delayMs <= 0) {
      return true;
    }
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  // ── Active table and history ──

  private ActiveTransaction register(TransactionSettings cfg) {
    ActiveTransaction tx = new ActiveTransaction("tx_" + UUID.randomUUID(), tenantName);
    synchronized (active) {
      if (active.size() >= cfg.maxConcurrentTransactions()) {
        throw new TransactionLimitExceededException(tenantName, cfg.maxConcurrentTransactions());
      }
      active.put(tx.id, tx);
    }
    total.incrementAndGet();
    return tx;
  }

  private void complete(ActiveTransaction tx, TransactionStatus status, Throwable error) {
    if (!tx.claimCompletion(error == null ? null : String.valueOf(error.getMessage()))) {
      return;
    }
    removeActive(tx);
    TransactionRecord record = finish(tx, status);
    if (status == TransactionStatus.COMMITTED) {
      events.publish("transaction-completed", payload(
          "transactionId", tx.id,
          "connectionName", tenantName,
          "duration", record.durationMs(),
          "attempts", record.attempts()));
    }
  }

  /**
   * Ends a transaction from outside its own thread: the sweep, an abort or shutdown.
   */
  private boolean terminate(ActiveTransaction tx, TransactionStatus status, String reason) {
    if (!tx.claimTermination(reason)) {
      return false;
    }
    removeActive(tx);
    tx.abortCurrent(timeouts.executor());
    finish(tx, status);
    return true;
  }

  private void removeActive(ActiveTransaction tx) {
    synchronized (active) {
      active.remove(tx.id);
      active.notifyAll();
    }
  }

  private TransactionRecord finish(ActiveTransaction tx, TransactionStatus status) {
    TransactionRecord record = tx.snapshot(status, Instant.now());
    long duration = record.durationMs();
    totalDurationMs.addAndGet(duration);
    longestDurationMs.accumulateAndGet(duration, Math::max);
    metrics.recordTransactionDurationMs(duration);
    switch (status) {
      case COMMITTED -> {
        successful.incrementAndGet();
        metrics.incrementTransactionCommitted();
      }
      case TIMED_OUT -> {
        timedOut.incrementAndGet();
        metrics.incrementTransactionTimedOut();
      }
      default -> {
        failed.incrementAndGet();
        metrics.incrementTransactionFailed();
      }
    }
    int maxSize = settings.maxHistorySize();
    synchronized (history) {
      history.addLast(record);
      while (history.size() > maxSize) {
        history.removeFirst();
      }
    }
    return record;
  }

  private void awaitDrained(long waitMs) {
    long deadline = System.currentTimeMillis() + waitMs;
    synchronized (active) {
      long remaining = waitMs;
      while (!active.isEmpty() && remaining > 0) {
        try {
          active.wait(remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        remaining = deadline - System.currentTimeMillis();
      }
    }
  }

  @Override
  public boolean abortTransaction(String transactionId) {
    ActiveTransaction tx;
    synchronized (active) {
      tx = active.get(transactionId);
    }
    if (tx == null || !terminate(tx, TransactionStatus.FAILED, "Transaction aborted")) {
      return false;
    }
    logger.log(Level.INFO, "Aborted transaction {0} on ''{1}''", new Object[] {transactionId, tenantName});
    events.publish("transaction-aborted", payload("transactionId", transactionId, "connectionName", tenantName));
    return true;
  }

  // ── Sweep ──

  private synchronized void startSweep() {
    if (sweepTask != null) {
      return;
    }
    if (sweeper == null) {
      sweeper = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("tenantdb-tx-sweeper-"));
    }
    long intervalMs = settings.cleanupIntervalMs();
    sweepTask = sweeper.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    events.publish("cleanup-started", payload("connectionName", tenantName, "interval", intervalMs));
  }

  private synchronized void stopSweep() {
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
      events.publish("cleanup-stopped", payload("connectionName", tenantName));
    }
    if (sweeper != null) {
      sweeper.shutdownNow();
      sweeper = null;
    }
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Transaction sweep failed for '" + tenantName + "'", t);
      events.error("cleanup", t, payload("connectionName", tenantName));
    }
  }

  /**
   * Runs one sweep: force-rolls-back transactions older than {@code maxTransactionTime} and
   * drops history entries older than {@code maxHistoryAge}. Called by the scheduler, and
   * directly by tests.
   *
   * @return number of transactions rolled back
   */
  public int sweep() {
    TransactionSettings cfg = settings;
    List<ActiveTransaction> stale = new ArrayList<>();
    synchronized (active) {
      for (ActiveTransaction tx : active.values()) {
        if (tx.elapsedMs() > cfg.maxTransactionTimeMs()) {
          stale.add(tx);
        }
      }
    }

    int cleaned = 0;
    for (ActiveTransaction tx : stale) {
      long age = tx.elapsedMs();
      if (terminate(tx, TransactionStatus.TIMED_OUT,
          "Transaction exceeded maximum time of " + cfg.maxTransactionTimeMs() + "ms")) {
        cleaned++;
        logger.log(Level.WARNING, "Rolled back stale transaction {0} on ''{1}'' after {2}ms",
            new Object[] {tx.id, tenantName, age});
        events.publish("transaction-cleaned-up", payload(
            "transactionId", tx.id,
            "connectionName", tenantName,
            "duration", age,
            "reason", "timeout"));
      }
    }

    int evicted = 0;
    Instant cutoff = Instant.now().minusMillis(cfg.maxHistoryAgeMs());
    synchronized (history) {
      Iterator<TransactionRecord> it = history.iterator();
      while (it.hasNext()) {
        TransactionRecord record = it.next();
        if (record.endTime() != null && record.endTime().isBefore(cutoff)) {
          it.remove();
          evicted++;
        }
      }
    }
    if (evicted > 0) {
      events.publish("history-cleanup", payload("connectionName", tenantName, "removed", evicted));
    }
    return cleaned;
  }

  // ── Reporting ──

  @Override
  public TransactionMetrics metrics() {
    int activeCount;
    synchronized (active) {
      activeCount = active.size();
    }
    return new TransactionMetrics(
        total.get(),
        successful.get(),
        failed.get(),
        timedOut.get(),
        attempts.get(),
        retries.get(),
        totalDurationMs.get(),
        longestDurationMs.get(),
        activeCount);
  }

  @Override
  public List<TransactionRecord> activeTransactions() {
    List<TransactionRecord> result = new ArrayList<>();
    synchronized (active) {
      for (ActiveTransaction tx : active.values()) {
        result.add(tx.snapshot(TransactionStatus.ACTIVE, null));
      }
    }
    return result;
  }

  @Override
  public List<TransactionRecord> history() {
    synchronized (history) {
      return List.copyOf(history);
    }
  }

  @Override
  public ComponentStatus status() {
    TransactionMetrics snapshot = metrics();
    boolean sweeping;
    synchronized (this) {
      sweeping = sweepTask != null;
    }
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("connectionName", tenantName);
    details.put("activeTransactions", snapshot.active());
    details.put("maxConcurrentTransactions", settings.maxConcurrentTransactions());
    details.put("cleanupRunning", sweeping);
    details.put("successRate", snapshot.successRate());
    details.put("historySize", history().size());
    return new ComponentStatus(COMPONENT_NAME, isInitialized(), isInitialized(), details);
  }

  /**
   * Mutable tracking entry of one in-flight transaction.
   */
  private static final class ActiveTransaction {
    final String id;
    final String tenantName;
    final Instant startTime = Instant.now();
    final long startNanos = System.nanoTime();
    volatile int attempts;
    volatile String error;
    private volatile JdbcTransaction current;
    private boolean finished;
    private boolean committing;

    ActiveTransaction(String id, String tenantName) {
      this.id = id;
      this.tenantName = tenantName;
    }

    void attach(JdbcTransaction jdbcTx, CancellationSignal signal) {
      current = jdbcTx;
      if (signal.isCancelled() || isFinished()) {
        current = null;
        throw new CancellationException("Transaction " + id + " was cancelled before it started");
      }
    }

    void detach() {
      current = null;
    }

    synchronized boolean beginCommit(CancellationSignal signal) {
      if (finished || signal.isCancelled()) {
        return false;
      }
      committing = true;
      return true;
    }

    synchronized void endCommit() {
      committing = false;
    }

    synchronized boolean claimCompletion(String failure) {
      if (finished) {
        return false;
      }
      finished = true;
      committing = false;
      error = failure;
      return true;
    }

    synchronized boolean claimTermination(String reason) {
      if (finished || committing) {
        return false;
      }
      finished = true;
      error = reason;
      return true;
    }

    synchronized boolean isFinished() {
      return finished;
    }

    void abortCurrent(Executor executor) {
      JdbcTransaction jdbcTx = current;
      if (jdbcTx != null && !jdbcTx.isCompleted()) {
        executor.execute(jdbcTx::abort);
      }
    }

    long elapsedMs() {
      return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    TransactionRecord snapshot(TransactionStatus status, Instant endTime) {
      return new TransactionRecord(id, tenantName, startTime, endTime, elapsedMs(), status, attempts, error);
    }
  }

  public static final class Builder {
    private String tenantName;
    private TransactionSettings settings;
    private TimeoutController timeouts;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;

    private Builder() {
    }

    public Builder tenantName(String tenantName) {
      this.tenantName = tenantName;
      return this;
    }

    public Builder settings(TransactionSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder timeouts(TimeoutController timeouts) {
      this.timeouts = timeouts;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Overrides the default linear backoff derived from {@code retryDelay}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public TransactionCoordinator build() {
      return new TransactionCoordinator(this);
    }
  }
}
