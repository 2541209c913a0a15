package tenantdb.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import tenantdb.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code tenantdb.tenants.registered}</li>
 *   <li>{@code tenantdb.tenants.registration.failed} (registrations rolled back)</li>
 *   <li>{@code tenantdb.tenants.unregistered}</li>
 *   <li>{@code tenantdb.transactions.committed}</li>
 *   <li>{@code tenantdb.transactions.failed}</li>
 *   <li>{@code tenantdb.transactions.timed.out} (force-rolled-back by the sweep)</li>
 *   <li>{@code tenantdb.transactions.retried}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code tenantdb.tenants.count}</li>
 *   <li>{@code tenantdb.health.score}, tagged {@code tenant}</li>
 *   <li>{@code tenantdb.transactions.duration}</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter registered;
  private final Counter registrationFailed;
  private final Counter unregistered;
  private final Counter committed;
  private final Counter failed;
  private final Counter timedOut;
  private final Counter retried;
  private final Timer duration;
  private final Gauge tenantCountGauge;

  private final AtomicInteger tenantCount = new AtomicInteger();
  private final Map<String, AtomicInteger> healthScores = new ConcurrentHashMap<>();
  private final Map<String, Gauge> healthGauges = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "tenantdb");
  }

  /**
   * @param namePrefix prefix for all meter names, e.g. {@code "billing.tenantdb"}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.registered = Counter.builder(namePrefix + ".tenants.registered")
        .description("Tenants registered")
        .register(registry);
    this.registrationFailed = Counter.builder(namePrefix + ".tenants.registration.failed")
        .description("Registrations that failed and were rolled back")
        .register(registry);
    this.unregistered = Counter.builder(namePrefix + ".tenants.unregistered")
        .description("Tenants unregistered")
        .register(registry);
    this.committed = Counter.builder(namePrefix + ".transactions.committed")
        .description("Transactions committed")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".transactions.failed")
        .description("Transactions that failed terminally")
        .register(registry);
    this.timedOut = Counter.builder(namePrefix + ".transactions.timed.out")
        .description("Transactions force-rolled-back for exceeding their maximum age")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".transactions.retried")
        .description("Transaction attempts retried after a transient failure")
        .register(registry);
    this.duration = Timer.builder(namePrefix + ".transactions.duration")
        .description("Transaction duration including retries")
        .register(registry);
    this.tenantCountGauge = Gauge.builder(namePrefix + ".tenants.count", tenantCount, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementTenantRegistered() {
    if (closed) return;
    registered.increment();
  }

  @Override
  public void incrementTenantRegistrationFailed() {
    if (closed) return;
    registrationFailed.increment();
  }

  @Override
  public void incrementTenantUnregistered() {
    if (closed) return;
    unregistered.increment();
  }

  @Override
  public void incrementTransactionCommitted() {
    if (closed) return;
    committed.increment();
  }

  @Override
  public void incrementTransactionFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementTransactionTimedOut() {
    if (closed) return;
    timedOut.increment();
  }

  @Override
  public void incrementTransactionRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void recordTransactionDurationMs(long durationMs) {
    if (closed) return;
    duration.record(Duration.ofMillis(Math.max(0L, durationMs)));
  }

  @Override
  public void recordHealthScore(String tenantName, int score) {
    if (closed) return;
    healthScores.computeIfAbsent(tenantName, name -> {
      AtomicInteger holder = new AtomicInteger();
      healthGauges.put(name, Gauge.builder(namePrefix + ".health.score", holder, AtomicInteger::get)
          .tag("tenant", name)
          .description("Latest health score (0-100)")
          .register(registry));
      return holder;
    }).set(score);
  }

  @Override
  public void recordTenantCount(int tenants) {
    if (closed) return;
    tenantCount.set(tenants);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(registered, registrationFailed, unregistered,
        committed, failed, timedOut, retried, duration, tenantCountGauge));
    meters.addAll(healthGauges.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    healthGauges.clear();
    healthScores.clear();
    if (first != null) throw first;
  }
}
