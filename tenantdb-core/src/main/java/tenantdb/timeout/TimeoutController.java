package tenantdb.timeout;

import tenantdb.OperationTimeoutException;
import tenantdb.util.NamedThreadFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs operations against a deadline.
 *
 * <p>If the operation settles first, its result or exception is passed through unchanged.
 * If the deadline elapses first, the context's cleanup callback runs (its failures are logged,
 * never thrown) and the call fails with {@link OperationTimeoutException}.
 *
 * <p>{@link #withDeadline} does not stop the operation: it keeps running on a worker thread
 * after the caller has been released. {@link #withCancellableDeadline} raises a
 * {@link CancellationSignal} and interrupts the worker, which stops cooperative operations and
 * JDBC calls that honor interruption.
 *
 * <p>This class is thread-safe.
 */
public final class TimeoutController implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TimeoutController.class.getName());

  private final ExecutorService workers;
  private final boolean ownsWorkers;
  private final ScheduledExecutorService timer;
  private volatile boolean closed;

  /**
   * Creates a controller backed by its own cached pool of daemon worker threads.
   */
  public TimeoutController() {
    this(Executors.newCachedThreadPool(new NamedThreadFactory("tenantdb-deadline-")), true);
  }

  /**
   * Creates a controller that runs guarded operations on {@code workers}. The executor is not
   * shut down by {@link #close()}.
   */
  public TimeoutController(ExecutorService workers) {
    this(workers, false);
  }

  private TimeoutController(ExecutorService workers, boolean ownsWorkers) {
    this.workers = Objects.requireNonNull(workers, "workers");
    this.ownsWorkers = ownsWorkers;
    this.timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("tenantdb-deadline-timer-"));
  }

  /**
   * Runs {@code operation} and waits at most {@code durationMs} for it.
   *
   * @throws OperationTimeoutException if the deadline elapsed first
   * @throws Exception                 whatever the operation threw, unchanged
   */
  public <T> T withDeadline(DeadlineOperation<T> operation, long durationMs, TimeoutContext context)
      throws Exception {
    Objects.requireNonNull(operation, "operation");
    validate(durationMs, context);
    Future<T> future = submit(operation::run);
    return await(future, null, durationMs, context);
  }

  /**
   * Like {@link #withDeadline}, but the operation receives a {@link CancellationSignal} that is
   * raised, and its thread interrupted, when the deadline elapses.
   */
  public <T> T withCancellableDeadline(CancellableOperation<T> operation, long durationMs, TimeoutContext context)
      throws Exception {
    Objects.requireNonNull(operation, "operation");
    validate(durationMs, context);
    CancellationSignal signal = new CancellationSignal();
    Future<T> future = submit(() -> operation.run(signal));
    return await(future, signal, durationMs, context);
  }

  /**
   * Guards an already asynchronous operation. The returned future completes with the
   * operation's outcome, or exceptionally with {@link OperationTimeoutException}.
   */
  public <T> CompletableFuture<T> withDeadlineAsync(Supplier<? extends CompletionStage<T>> operation,
      long durationMs, TimeoutContext context) {
    Objects.requireNonNull(operation, "operation");
    validate(durationMs, context);
    ensureOpen();

    CompletableFuture<T> result = new CompletableFuture<>();
    CompletionStage<T> stage;
    try {
      stage = Objects.requireNonNull(operation.get(), "operation returned null");
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
      return result;
    }

    ScheduledFuture<?> deadline = timer.schedule(() -> {
      if (result.completeExceptionally(new OperationTimeoutException(durationMs, context))) {
        runCleanup(context);
      }
    }, durationMs, TimeUnit.MILLISECONDS);

    stage.whenComplete((value, error) -> {
      deadline.cancel(false);
      if (error != null) {
        result.completeExceptionally(error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error);
      } else {
        result.complete(value);
      }
    });
    return result;
  }

  /**
   * Executor the controller runs guarded operations on, for callers fanning out async work.
   */
  public ExecutorService executor() {
    return workers;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    timer.shutdownNow();
    if (ownsWorkers) {
      workers.shutdownNow();
    }
  }

  private <T> Future<T> submit(Callable<T> task) {
    ensureOpen();
    try {
      return workers.submit(task);
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("TimeoutController has been closed", e);
    }
  }

  private <T> T await(Future<T> future, CancellationSignal signal, long durationMs, TimeoutContext context)
      throws Exception {
    try {
      return future.get(durationMs, TimeUnit.MILLISECONDS);
    } catch (java.util.concurrent.TimeoutException e) {
      if (signal != null) {
        signal.cancel("deadline of " + durationMs + "ms elapsed");
        future.cancel(true);
      }
      runCleanup(context);
      throw new OperationTimeoutException(durationMs, context);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw e;
    } catch (InterruptedException e) {
      if (signal != null) {
        signal.cancel("caller interrupted");
        future.cancel(true);
      }
      Thread.currentThread().interrupt();
      throw e;
    }
  }

  private void runCleanup(TimeoutContext context) {
    Runnable cleanup = context.cleanup();
    if (cleanup == null) {
      return;
    }
    try {
      cleanup.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Timeout cleanup failed for " + context.component() + "/" + context.operation(), e);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("TimeoutController has been closed");
    }
  }

  private static void validate(long durationMs, TimeoutContext context) {
    if (durationMs <= 0L) {
      throw new IllegalArgumentException("durationMs must be > 0, got: " + durationMs);
    }
    Objects.requireNonNull(context, "context");
  }
}
