package tenantdb.registry;

import tenantdb.OperationTimeoutException;
import tenantdb.config.RegistryConfig;
import tenantdb.event.EventPublisher;
import tenantdb.spi.MetricsExporter;
import tenantdb.supervisor.ConnectionSupervisor;
import tenantdb.supervisor.HealthCheckResult;
import tenantdb.supervisor.SupervisorStatus;
import tenantdb.timeout.TimeoutContext;
import tenantdb.timeout.TimeoutController;
import tenantdb.util.NamedThreadFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static tenantdb.event.LifecycleEvent.payload;

/**
 * Periodic health supervision across all tenants of a registry.
 *
 * <p>Each cycle starts one probe per tenant at once and waits for all of them; every probe is
 * bounded by {@link RegistryConfig#healthProbeTimeoutMs()}, so a hung tenant costs one timeout
 * and never blocks the others or the next cycle. Results go into a rolling history of
 * {@value #HISTORY_SIZE} samples per tenant.
 */
final class HealthMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());

  static final int HISTORY_SIZE = 10;
  static final long PERFORMANCE_ALERT_MS = 1_000L;

  private final Supplier<Map<String, ConnectionSupervisor>> tenants;
  private final TimeoutController timeouts;
  private final RegistryConfig config;
  private final MetricsExporter metrics;
  private final EventPublisher events;

  private final Map<String, Deque<HealthSample>> history = new ConcurrentHashMap<>();
  private final AtomicLong cycles = new AtomicLong();

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> cycleTask;
  private volatile boolean running;

  HealthMonitor(Supplier<Map<String, ConnectionSupervisor>> tenants, TimeoutController timeouts,
      RegistryConfig config, MetricsExporter metrics, EventPublisher events) {
    this.tenants = Objects.requireNonNull(tenants, "tenants");
    this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.events = Objects.requireNonNull(events, "events");
  }

  synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("tenantdb-health-"));
    scheduleNextCycle();
    logger.log(Level.INFO, "Health monitoring started with interval {0}ms", config.healthCheckIntervalMs());
  }

  boolean isRunning() {
    return running;
  }

  @Override
  public void close() {
    ScheduledExecutorService stopping;
    synchronized (this) {
      running = false;
      if (cycleTask != null) {
        cycleTask.cancel(false);
        cycleTask = null;
      }
      stopping = scheduler;
      scheduler = null;
    }
    if (stopping != null) {
      stopping.shutdownNow();
      try {
        stopping.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Delay before the next cycle: the interval plus up to 10% random jitter, so registries
   * started together do not probe in lockstep.
   */
  static long nextDelayMs(long intervalMs) {
    long jitter = intervalMs / 10;
    return jitter <= 0 ? intervalMs : intervalMs + ThreadLocalRandom.current().nextLong(jitter + 1);
  }

  private synchronized void scheduleNextCycle() {
    if (!running || scheduler == null) {
      return;
    }
    cycleTask = scheduler.schedule(this::runScheduledCycle, nextDelayMs(config.healthCheckIntervalMs()),
        TimeUnit.MILLISECONDS);
  }

  private void runScheduledCycle() {
    try {
      runCycle();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Health monitoring cycle failed", t);
      events.error("health-monitoring", t, payload());
    } finally {
      scheduleNextCycle();
    }
  }

  /**
   * Probes every tenant once and returns when all probes have settled.
   */
  HealthReport runCycle() {
    long started = System.nanoTime();
    String cycleId = "health-" + cycles.incrementAndGet();
    Map<String, ConnectionSupervisor> snapshot = tenants.get();
    history.keySet().retainAll(snapshot.keySet());

    long probeTimeout = config.healthProbeTimeoutMs();
    Map<String, CompletableFuture<HealthSample>> probes = new LinkedHashMap<>();
    snapshot.forEach((name, supervisor) -> probes.put(name, probe(name, supervisor, probeTimeout)));
    CompletableFuture.allOf(probes.values().toArray(new CompletableFuture<?>[0])).join();

    Map<String, HealthSample> samples = new LinkedHashMap<>();
    Map<String, HealthTrend> trends = new LinkedHashMap<>();
    long latencyTotal = 0;
    int finished = 0;
    for (Map.Entry<String, CompletableFuture<HealthSample>> entry : probes.entrySet()) {
      HealthSample sample = entry.getValue().join();
      samples.put(entry.getKey(), sample);
      if (sample.status() != HealthStatus.TIMEOUT) {
        latencyTotal += sample.latencyMs();
        finished++;
      }
      record(sample);
      trends.put(entry.getKey(), trend(entry.getKey()));
      metrics.recordHealthScore(entry.getKey(), sample.score());
    }

    double averageLatency = finished == 0 ? 0.0 : (double) latencyTotal / finished;
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    HealthReport report = new HealthReport(cycleId, samples, trends, averageLatency, durationMs, Instant.now());
    publishAlerts(report);
    events.publish("health-check-completed", payload(
        "cycleId", cycleId,
        "totalConnections", samples.size(),
        "healthy", report.tenantsWith(HealthStatus.HEALTHY).size(),
        "degraded", report.tenantsWith(HealthStatus.DEGRADED).size(),
        "unhealthy", report.tenantsWith(HealthStatus.UNHEALTHY).size(),
        "timeout", report.tenantsWith(HealthStatus.TIMEOUT).size(),
        "averageCheckDuration", averageLatency,
        "totalCheckDuration", durationMs,
        "allHealthy", report.allHealthy()));
    return report;
  }

  private CompletableFuture<HealthSample> probe(String name, ConnectionSupervisor supervisor, long probeTimeout) {
    long started = System.nanoTime();
    TimeoutContext context = new TimeoutContext("health-check", "TenantRegistry", name, null);
    CompletableFuture<HealthSample> guarded;
    try {
      guarded = timeouts.withDeadlineAsync(
          () -> CompletableFuture.supplyAsync(() -> score(name, supervisor), timeouts.executor()),
          probeTimeout, context);
    } catch (RuntimeException e) {
      return CompletableFuture.completedFuture(failed(name, HealthStatus.UNHEALTHY, started, e));
    }
    return guarded.handle((sample, error) -> {
      if (error == null) {
        return sample;
      }
      Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
      if (cause instanceof OperationTimeoutException) {
        logger.log(Level.WARNING, "Health probe for ''{0}'' timed out after {1}ms", new Object[] {name, probeTimeout});
        return failed(name, HealthStatus.TIMEOUT, started, cause);
      }
      logger.log(Level.WARNING, "Health probe for '" + name + "' failed", cause);
      return failed(name, HealthStatus.UNHEALTHY, started, cause);
    });
  }

  private HealthSample score(String name, ConnectionSupervisor supervisor) {
    long started = System.nanoTime();
    HealthCheckResult check = supervisor.checkHealth();
    SupervisorStatus status = supervisor.status();
    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    long threshold = config.healthPerformanceThresholdMs();
    boolean connected = status.connected() && check.healthy();

    int score = HealthScorer.score(status.initialized(), connected, status.healthyComponents(),
        status.totalComponents(), latencyMs, threshold);
    List<String> issues = new ArrayList<>(check.issues());
    if (!status.initialized()) {
      issues.add("not-initialized");
    }
    if (!connected) {
      issues.add("database-disconnected");
    }
    if (latencyMs > threshold) {
      issues.add("slow-response");
    }
    status.components().forEach((component, componentStatus) -> {
      if (!componentStatus.healthy()) {
        issues.add("component-unhealthy-" + component);
      }
    });
    return new HealthSample(name, score, HealthStatus.fromScore(score), latencyMs, issues, Instant.now());
  }

  private static HealthSample failed(String name, HealthStatus status, long started, Throwable error) {
    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    String issue = status == HealthStatus.TIMEOUT ? "timeout" : "status-check-failed: " + error.getMessage();
    return new HealthSample(name, 0, status, latencyMs, List.of(issue), Instant.now());
  }

  private void publishAlerts(HealthReport report) {
    List<String> unhealthy = report.tenantsWith(HealthStatus.UNHEALTHY);
    List<String> timedOut = report.tenantsWith(HealthStatus.TIMEOUT);
    if (!unhealthy.isEmpty() || !timedOut.isEmpty()) {
      Map<String, Object> details = new LinkedHashMap<>();
      report.samples().forEach((name, sample) -> {
        if (!sample.issues().isEmpty()) {
          details.put(name, sample.issues());
        }
      });
      events.publish("health-check-warning", payload(
          "cycleId", report.cycleId(),
          "unhealthyConnections", unhealthy,
          "timeoutConnections", timedOut,
          "degradedConnections", report.tenantsWith(HealthStatus.DEGRADED),
          "healthyConnections", report.tenantsWith(HealthStatus.HEALTHY),
          "errorDetails", details));
    }

    List<String> falling = new ArrayList<>();
    report.trends().forEach((name, trend) -> {
      if (trend == HealthTrend.FALLING) {
        falling.add(name);
      }
    });
    if (!falling.isEmpty()) {
      falling.sort(null);
      events.publish("health-trend-alert", payload(
          "cycleId", report.cycleId(),
          "type", "declining",
          "connections", falling,
          "message", "Health declining for " + falling.size() + " connection(s)"));
    }

    if (report.averageLatencyMs() >= PERFORMANCE_ALERT_MS) {
      events.publish("health-performance-alert", payload(
          "cycleId", report.cycleId(),
          "averageCheckDuration", report.averageLatencyMs(),
          "totalCheckDuration", report.durationMs(),
          "message", "System performance is degraded"));
    }
  }

  // ── History ──

  private void record(HealthSample sample) {
    Deque<HealthSample> samples = history.computeIfAbsent(sample.tenantName(), ignored -> new ArrayDeque<>());
    synchronized (samples) {
      samples.addLast(sample);
      while (samples.size() > HISTORY_SIZE) {
        samples.removeFirst();
      }
    }
  }

  List<HealthSample> history(String tenantName) {
    Deque<HealthSample> samples = history.get(tenantName);
    if (samples == null) {
      return List.of();
    }
    synchronized (samples) {
      return List.copyOf(samples);
    }
  }

  HealthTrend trend(String tenantName) {
    return HealthTrend.of(history(tenantName));
  }

  Map<String, HealthSample> latest() {
    Map<String, HealthSample> result = new LinkedHashMap<>();
    for (String name : history.keySet()) {
      List<HealthSample> samples = history(name);
      if (!samples.isEmpty()) {
        result.put(name, samples.get(samples.size() - 1));
      }
    }
    return result;
  }

  void forget(String tenantName) {
    history.remove(tenantName);
  }

  void clear() {
    history.clear();
  }
}
