package tenantdb.registry;

import tenantdb.AlreadyRegisteredException;
import tenantdb.ComponentException;
import tenantdb.ConfigurationException;
import tenantdb.NotRegisteredException;
import tenantdb.TenantDbException;
import tenantdb.config.Defaults;
import tenantdb.config.RegistryConfig;
import tenantdb.config.Settings;
import tenantdb.config.TenantConfig;
import tenantdb.event.EventPublisher;
import tenantdb.event.EventSource;
import tenantdb.event.LifecycleListener;
import tenantdb.spi.ComponentSlot;
import tenantdb.spi.HandleFactory;
import tenantdb.spi.MetricsExporter;
import tenantdb.spi.MigrationResult;
import tenantdb.spi.RollbackResult;
import tenantdb.supervisor.ComponentFactories;
import tenantdb.supervisor.ConnectionSupervisor;
import tenantdb.timeout.TimeoutContext;
import tenantdb.timeout.TimeoutController;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

import static tenantdb.event.LifecycleEvent.payload;

/**
 * Creates, shares and destroys the connection supervisors of named tenants.
 *
 * <p>A tenant either gets a new {@link ConnectionSupervisor} or reuses a shared one, chosen in
 * this order:
 * <ol>
 *   <li>{@code useConnection} names a registered shared tenant, or asks for any compatible
 *       one ({@code true}, {@code "global"}, {@code "*"}): the most recently registered shared
 *       tenant is reused</li>
 *   <li>the tenant is shared and a live shared supervisor already owns its fingerprint: that
 *       supervisor is reused</li>
 *   <li>otherwise a new supervisor is created and initialized</li>
 * </ol>
 * After that the enabled auto-operations run in order: migrations, seeds, models. If any step
 * fails, the steps already attempted are rolled back (models cleared, seeds rolled back,
 * migrations rolled back, each independently), the tenant's reference is released and the
 * original error is rethrown; the tenant never becomes visible.
 *
 * <p>Shared handles are reference counted per fingerprint. Releasing a reference and deciding
 * whether it was the last one happen under one lock, so a shared supervisor is shut down exactly
 * once, when its last tenant goes away.
 *
 * <pre>{@code
 * try (TenantRegistry registry = TenantRegistry.builder()
 *     .handleFactory(new HikariHandleFactory())
 *     .build()) {
 *   registry.initialize();
 *   ConnectionSupervisor billing = registry.registerApp("billing", TenantConfig.of(Map.of(
 *       "database.jdbcUrl", "jdbc:h2:mem:billing",
 *       "database.shared", true)));
 *   billing.withTransaction(conn -> ...);
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class TenantRegistry implements EventSource, AutoCloseable {
  private static final Logger logger = Logger.getLogger(TenantRegistry.class.getName());

  private final Settings settings;
  private final RegistryConfig config;
  private final ComponentFactories factories;
  private final HandleFactory handleFactory;
  private final TimeoutController timeouts;
  private final boolean ownsTimeouts;
  private final MetricsExporter metrics;
  private final EventPublisher events = new EventPublisher("TenantRegistry");
  private final HealthMonitor health;

  private final AtomicReference<RegistryState> state = new AtomicReference<>(RegistryState.CREATED);
  private final Object lock = new Object();
  private final Map<String, TenantEntry> tenants = new LinkedHashMap<>();
  private final Set<String> pending = new HashSet<>();
  private final SharedHandleTable shared = new SharedHandleTable();

  /**
   * @param fingerprint key in the shared-handle table, or {@code null} for a private handle
   */
  private record TenantEntry(String name, ConnectionSupervisor supervisor, String fingerprint, String reuseType) {
  }

  private record Resolution(ConnectionSupervisor supervisor, String fingerprint, String reuseType) {
  }

  private record Release(boolean shutdownPerformed, int remainingReferences) {
  }

  /** Auto-operations attempted so far, i.e. the ones a rollback has to undo. */
  private static final class Progress {
    boolean migrations;
    boolean seeds;
    boolean models;
  }

  private TenantRegistry(Builder builder) {
    this.settings = Defaults.settings().merge(builder.settings != null ? builder.settings : Settings.empty());
    this.config = RegistryConfig.from(settings);
    this.factories = builder.factories != null ? builder.factories : ComponentFactories.defaults();
    this.factories.validateAgainst(settings);
    this.handleFactory = builder.handleFactory;
    this.ownsTimeouts = builder.timeouts == null;
    this.timeouts = builder.timeouts != null ? builder.timeouts : new TimeoutController();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.health = new HealthMonitor(this::supervisorsByTenant, timeouts, config, metrics, events);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Lifecycle ──

  /**
   * Moves the registry to {@link RegistryState#INITIALIZED} and starts health monitoring when
   * {@code registry.enableHealthMonitoring} is set. Calling it again is a no-op.
   */
  public void initialize() {
    if (state.get() == RegistryState.INITIALIZED) {
      logger.log(Level.WARNING, "TenantRegistry is already initialized");
      return;
    }
    if (!state.compareAndSet(RegistryState.CREATED, RegistryState.INITIALIZED)) {
      throw new IllegalStateException("TenantRegistry cannot be initialized in state " + state.get());
    }
    if (config.healthMonitoringEnabled()) {
      health.start();
    }
    logger.log(Level.INFO, "TenantRegistry initialized (health monitoring {0})",
        config.healthMonitoringEnabled() ? "enabled" : "disabled");
  }

  public RegistryState state() {
    return state.get();
  }

  public RegistryConfig config() {
    return config;
  }

  /**
   * Registry-level settings (defaults plus the builder's layer) that every tenant's
   * configuration is merged over.
   */
  public Settings settings() {
    return settings;
  }

  // ── Registration ──

  public ConnectionSupervisor registerApp(String name, Map<String, ?> config) {
    return registerApp(name, TenantConfig.of(config));
  }

  /**
   * Registers {@code name} and returns the supervisor it is bound to.
   *
   * @throws AlreadyRegisteredException if the name is registered or being registered
   * @throws ConfigurationException     if no connection can be reused and the configuration
   *                                    has no database details
   * @throws TenantDbException          for any other failure; the tenant is not registered
   */
  public ConnectionSupervisor registerApp(String name, TenantConfig config) {
    Objects.requireNonNull(config, "config");
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    ensureInitialized("registerApp");
    synchronized (lock) {
      if (tenants.containsKey(name) || pending.contains(name)) {
        throw new AlreadyRegisteredException(name);
      }
      pending.add(name);
    }

    TenantConfig effective = config.withBase(settings);
    Resolution resolution = null;
    Progress progress = new Progress();
    try {
      resolution = resolveConnection(name, effective);
      runAutoOperations(name, resolution.supervisor(), effective, progress);
      synchronized (lock) {
        if (state.get() != RegistryState.INITIALIZED) {
          throw new IllegalStateException("TenantRegistry was shut down while registering '" + name + "'");
        }
        pending.remove(name);
        tenants.put(name, new TenantEntry(name, resolution.supervisor(), resolution.fingerprint(),
            resolution.reuseType()));
        metrics.recordTenantCount(tenants.size());
      }
    } catch (RuntimeException e) {
      abortRegistration(name, resolution, progress, e);
      if (e instanceof TenantDbException) {
        throw e;
      }
      throw new TenantDbException("Failed to register '" + name + "': " + e.getMessage(), "app-registration", name, e);
    }

    metrics.incrementTenantRegistered();
    logger.log(Level.INFO, "Registered tenant ''{0}'' ({1})", new Object[] {name, resolution.reuseType()});
    events.publish("app-registered", payload(
        "appName", name,
        "connectionName", resolution.supervisor().name(),
        "shared", resolution.fingerprint() != null,
        "reuseType", resolution.reuseType()));
    return resolution.supervisor();
  }

  private Resolution resolveConnection(String name, TenantConfig config) {
    Optional<String> useConnection = config.useConnection();
    if (useConnection.isPresent()) {
      Optional<Resolution> reused = reuseRequested(name, useConnection.get());
      if (reused.isPresent()) {
        return reused.get();
      }
      logger.log(Level.WARNING, "No shared connection matches useConnection={0} for ''{1}''; creating a new one",
          new Object[] {useConnection.get(), name});
      events.warning("connection-reuse", "No shared connection available for '" + name + "', creating a new one",
          payload("appName", name, "useConnection", useConnection.get()));
    }
    return createConnection(name, config);
  }

  private Optional<Resolution> reuseRequested(String name, String source) {
    boolean any = TenantConfig.ANY_COMPATIBLE.equals(source);
    TenantEntry sourceEntry = null;
    synchronized (lock) {
      if (any) {
        List<TenantEntry> entries = new ArrayList<>(tenants.values());
        for (int i = entries.size() - 1; i >= 0; i--) {
          if (isReusable(entries.get(i))) {
            sourceEntry = entries.get(i);
            break;
          }
        }
      } else {
        TenantEntry candidate = tenants.get(source);
        if (candidate != null && isReusable(candidate)) {
          sourceEntry = candidate;
        }
      }
      if (sourceEntry == null) {
        return Optional.empty();
      }
      shared.acquire(sourceEntry.fingerprint(), sourceEntry.supervisor(), name);
    }
    String reuseType = any ? "auto-compatible" : "explicit-app";
    events.publish("connection-reused", payload(
        "appName", name,
        "sourceApp", sourceEntry.name(),
        "reuseType", reuseType));
    return Optional.of(new Resolution(sourceEntry.supervisor(), sourceEntry.fingerprint(), reuseType));
  }

  private static boolean isReusable(TenantEntry entry) {
    return entry.fingerprint() != null && entry.supervisor().isInitialized();
  }

  private Resolution createConnection(String name, TenantConfig config) {
    if (!config.hasDatabase()) {
      throw new ConfigurationException("Database configuration is required when not reusing an existing connection",
          "app-registration", name);
    }
    String fingerprint = config.isShared() ? config.database().target().fingerprint() : null;
    if (fingerprint != null) {
      synchronized (lock) {
        Optional<ConnectionSupervisor> live = shared.find(fingerprint);
        if (live.isPresent()) {
          shared.acquire(fingerprint, live.get(), name);
          return fingerprintMatch(name, live.get(), fingerprint);
        }
      }
    }

    ConnectionSupervisor supervisor = ConnectionSupervisor.builder()
        .name(name)
        .config(config)
        .factories(factories)
        .handleFactory(handleFactory)
        .timeouts(timeouts)
        .metrics(metrics)
        .build();
    supervisor.initialize();

    if (fingerprint != null) {
      ConnectionSupervisor owner;
      synchronized (lock) {
        owner = shared.find(fingerprint).orElse(supervisor);
        shared.acquire(fingerprint, owner, name);
      }
      if (owner != supervisor) {
        // lost a race with another registration for the same fingerprint
        supervisor.shutdown();
        return fingerprintMatch(name, owner, fingerprint);
      }
    }

    events.publish("connection-created", payload(
        "appName", name,
        "shared", fingerprint != null,
        "connectionId", fingerprint));
    return new Resolution(supervisor, fingerprint, "new");
  }

  private Resolution fingerprintMatch(String name, ConnectionSupervisor owner, String fingerprint) {
    events.publish("connection-reused", payload(
        "appName", name,
        "sourceApp", owner.name(),
        "reuseType", "fingerprint-match",
        "connectionId", fingerprint));
    return new Resolution(owner, fingerprint, "fingerprint-match");
  }

  private void runAutoOperations(String name, ConnectionSupervisor supervisor, TenantConfig config, Progress progress) {
    if (config.isEnabled(ComponentSlot.MIGRATION)) {
      progress.migrations = true;
      MigrationResult result = supervisor.runMigrations(
          config.slotSettings(ComponentSlot.MIGRATION).with("appName", name));
      requireSuccess(result, ComponentSlot.MIGRATION, "auto-migration", name);
      if (!result.disabled()) {
        events.publish("auto-migration-completed", payload("appName", name, "migrations", result.migrations()));
      }
    }
    if (config.isEnabled(ComponentSlot.SEED)) {
      progress.seeds = true;
      MigrationResult result = supervisor.runSeeds(
          config.slotSettings(ComponentSlot.SEED).with("appName", name));
      requireSuccess(result, ComponentSlot.SEED, "auto-seeding", name);
      if (!result.disabled()) {
        events.publish("auto-seeding-completed", payload("appName", name, "seeds", result.migrations()));
      }
    }
    Map<String, Object> definitions = config.modelDefinitions();
    if (config.isEnabled(ComponentSlot.MODEL) && !definitions.isEmpty()) {
      progress.models = true;
      List<String> models = supervisor.registerModels(definitions);
      events.publish("auto-models-registered", payload("appName", name, "models", models));
    }
  }

  private static void requireSuccess(MigrationResult result, ComponentSlot slot, String phase, String name) {
    if (!result.disabled() && !result.success()) {
      throw new ComponentException(slot, phase, name,
          new IllegalStateException(slot.configKey() + " reported failure after " + result.migrations()));
    }
  }

  private void abortRegistration(String name, Resolution resolution, Progress progress, RuntimeException error) {
    try {
      if (resolution != null) {
        RollbackReport report = rollback(name, resolution.supervisor(), progress.models, progress.seeds,
            progress.migrations, true);
        events.publish("registration-rollback", payload(
            "appName", name,
            "modelsCleared", report.modelsCleared(),
            "seedsRolledBack", report.seedsRolledBack(),
            "migrationsRolledBack", report.migrationsRolledBack(),
            "errors", report.errors()));
        release(name, resolution.supervisor(), resolution.fingerprint(),
            Duration.ofMillis(config.shutdownTimeoutMs()));
      }
    } finally {
      synchronized (lock) {
        pending.remove(name);
      }
    }
    metrics.incrementTenantRegistrationFailed();
    logger.log(Level.SEVERE, "Registration of '" + name + "' failed", error);
    events.error("app-registration", error, payload("appName", name));
  }

  /**
   * Clears models, rolls back seeds and rolls back migrations. A failed step is recorded and
   * the next one still runs. Rollbacks revert one step and carry {@code appName} so components
   * on a shared handle can pick the tenant's own batch.
   */
  private RollbackReport rollback(String name, ConnectionSupervisor supervisor, boolean models, boolean seeds,
      boolean migrations, boolean force) {
    Settings options = rollbackOptions(name, force);
    List<String> errors = new ArrayList<>();
    int cleared = 0;
    List<String> seedsRolledBack = List.of();
    List<String> migrationsRolledBack = List.of();
    if (models) {
      try {
        cleared = supervisor.clearModels();
      } catch (RuntimeException e) {
        errors.add("models: " + e.getMessage());
        logger.log(Level.SEVERE, "Clearing models of '" + name + "' failed", e);
      }
    }
    if (seeds) {
      try {
        RollbackResult result = supervisor.rollbackSeeds(options);
        seedsRolledBack = result.rolledBack();
        if (!result.success()) {
          errors.add("seeds: rollback reported failure");
        }
      } catch (RuntimeException e) {
        errors.add("seeds: " + e.getMessage());
        logger.log(Level.SEVERE, "Seed rollback of '" + name + "' failed", e);
      }
    }
    if (migrations) {
      try {
        RollbackResult result = supervisor.rollbackMigrations(options);
        migrationsRolledBack = result.rolledBack();
        if (!result.success()) {
          errors.add("migrations: rollback reported failure");
        }
      } catch (RuntimeException e) {
        errors.add("migrations: " + e.getMessage());
        logger.log(Level.SEVERE, "Migration rollback of '" + name + "' failed", e);
      }
    }
    return new RollbackReport(false, cleared, seedsRolledBack, migrationsRolledBack, errors);
  }

  private static Settings rollbackOptions(String name, boolean force) {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("step", 1);
    options.put("force", force);
    options.put("appName", name);
    return Settings.of(options);
  }

  /**
   * Drops {@code name}'s reference and shuts the supervisor down when nobody else holds it.
   */
  private Release release(String name, ConnectionSupervisor supervisor, String fingerprint, Duration timeout) {
    if (fingerprint != null) {
      int remaining;
      synchronized (lock) {
        remaining = shared.release(fingerprint, name);
      }
      if (remaining > 0) {
        events.publish("shared-connection-kept-alive", payload(
            "connectionId", fingerprint,
            "removedApp", name,
            "remainingRefs", remaining));
        return new Release(false, remaining);
      }
    }
    try {
      supervisor.shutdown(timeout);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Shutting down connection of '" + name + "' failed", e);
      events.warning("connection-shutdown", "Failed to close connection of '" + name + "': " + e.getMessage(),
          payload("appName", name, "connectionId", fingerprint));
    }
    return new Release(true, 0);
  }

  // ── Unregistration ──

  public UnregisterResult unregisterApp(String name) {
    return unregisterApp(name, UnregisterOptions.defaults());
  }

  /**
   * Removes {@code name}, rolls back its models, seeds and migrations unless
   * {@link UnregisterOptions#skipRollback()} is set, then shuts its supervisor down if no other
   * tenant still shares it.
   *
   * @throws NotRegisteredException if {@code name} is not registered
   */
  public UnregisterResult unregisterApp(String name, UnregisterOptions options) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(options, "options");
    ensureInitialized("unregisterApp");
    TenantEntry entry;
    synchronized (lock) {
      entry = tenants.remove(name);
      if (entry == null) {
        throw new NotRegisteredException(name, "app-unregistration");
      }
      metrics.recordTenantCount(tenants.size());
    }

    RollbackReport report = options.skipRollback()
        ? RollbackReport.skippedReport()
        : rollback(name, entry.supervisor(), true, true, true, options.forceCleanup());
    if (!report.success()) {
      events.warning("app-rollback", "Rollback of '" + name + "' finished with errors: " + report.errors(),
          payload("appName", name));
    }

    Duration timeout = options.timeout() != null ? options.timeout() : Duration.ofMillis(config.shutdownTimeoutMs());
    Release release = release(name, entry.supervisor(), entry.fingerprint(), timeout);
    health.forget(name);
    metrics.incrementTenantUnregistered();
    logger.log(Level.INFO, "Unregistered tenant ''{0}'' (connection {1})",
        new Object[] {name, release.shutdownPerformed() ? "shut down" : "kept alive"});
    events.publish("app-unregistered", payload(
        "appName", name,
        "connectionShutdown", release.shutdownPerformed(),
        "remainingRefs", release.remainingReferences()));
    return new UnregisterResult(name, entry.supervisor(), release.shutdownPerformed(),
        release.remainingReferences(), report);
  }

  // ── Queries ──

  public Optional<ConnectionSupervisor> getApp(String name) {
    synchronized (lock) {
      TenantEntry entry = tenants.get(name);
      return entry == null ? Optional.empty() : Optional.of(entry.supervisor());
    }
  }

  public boolean hasApp(String name) {
    synchronized (lock) {
      return tenants.containsKey(name);
    }
  }

  /**
   * Registered tenant names in registration order.
   */
  public List<String> appNames() {
    synchronized (lock) {
      return List.copyOf(tenants.keySet());
    }
  }

  /**
   * Number of tenants referencing the shared handle {@code fingerprint}.
   */
  public int sharedReferences(String fingerprint) {
    synchronized (lock) {
      return shared.references(fingerprint);
    }
  }

  public RegistryStatus status() {
    List<String> names;
    Map<String, Set<String>> references;
    synchronized (lock) {
      names = new ArrayList<>(tenants.keySet());
      references = shared.snapshot();
    }
    return new RegistryStatus(state.get(), names, references, health.latest(), health.isRunning(), Instant.now());
  }

  public List<HealthSample> healthHistory(String name) {
    return health.history(name);
  }

  public HealthTrend healthTrend(String name) {
    return health.trend(name);
  }

  /**
   * Runs one health cycle on the calling thread, independent of the periodic loop.
   */
  public HealthReport runHealthCycle() {
    ensureInitialized("runHealthCycle");
    return health.runCycle();
  }

  private Map<String, ConnectionSupervisor> supervisorsByTenant() {
    Map<String, ConnectionSupervisor> snapshot = new LinkedHashMap<>();
    synchronized (lock) {
      tenants.forEach((name, entry) -> snapshot.put(name, entry.supervisor()));
    }
    return snapshot;
  }

  // ── Shutdown ──

  /**
   * Shuts down with the configured {@code registry.shutdownTimeout}.
   */
  @Override
  public void close() {
    shutdown(Duration.ofMillis(config.shutdownTimeoutMs()));
  }

  /**
   * Stops health monitoring and shuts every distinct supervisor down in parallel, each under
   * {@code timeout}. Failures are collected into the result, not thrown. Idempotent.
   */
  public RegistryShutdownResult shutdown(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    RegistryState current = state.get();
    if (current == RegistryState.SHUTTING_DOWN || current == RegistryState.SHUTDOWN
        || !state.compareAndSet(current, RegistryState.SHUTTING_DOWN)) {
      return RegistryShutdownResult.alreadyShutDown();
    }

    long started = System.nanoTime();
    health.close();
    List<ConnectionSupervisor> supervisors;
    int tenantCount;
    synchronized (lock) {
      Set<ConnectionSupervisor> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
      tenants.values().forEach(entry -> distinct.add(entry.supervisor()));
      distinct.addAll(shared.supervisors());
      tenantCount = tenants.size();
      tenants.clear();
      shared.clear();
      supervisors = new ArrayList<>(distinct);
    }

    List<String> errors = Collections.synchronizedList(new ArrayList<>());
    List<CompletableFuture<Void>> tasks = new ArrayList<>(supervisors.size());
    for (ConnectionSupervisor supervisor : supervisors) {
      tasks.add(shutdownAsync(supervisor, timeout, errors));
    }
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();

    health.clear();
    metrics.recordTenantCount(0);
    state.set(RegistryState.SHUTDOWN);
    if (ownsTimeouts) {
      timeouts.close();
    }

    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    RegistryShutdownResult result = new RegistryShutdownResult(errors.isEmpty(), tenantCount, supervisors.size(),
        errors, durationMs);
    logger.log(Level.INFO, "TenantRegistry shut down {0} tenant(s) in {1}ms with {2} error(s)",
        new Object[] {tenantCount, durationMs, errors.size()});
    events.publish("shutdown-completed", payload(
        "tenants", tenantCount,
        "connections", supervisors.size(),
        "errors", result.errors(),
        "duration", durationMs));
    return result;
  }

  private CompletableFuture<Void> shutdownAsync(ConnectionSupervisor supervisor, Duration timeout, List<String> errors) {
    TimeoutContext context = new TimeoutContext("shutdown", "TenantRegistry", supervisor.name(), null);
    CompletableFuture<Void> guarded;
    try {
      guarded = timeouts.withDeadlineAsync(
          () -> CompletableFuture.runAsync(() -> supervisor.shutdown(timeout), timeouts.executor()),
          timeout.toMillis(), context);
    } catch (RuntimeException e) {
      errors.add(supervisor.name() + ": " + e.getMessage());
      logger.log(Level.WARNING, "Shutdown of '" + supervisor.name() + "' could not start", e);
      return CompletableFuture.completedFuture(null);
    }
    return guarded.handle((ignored, error) -> {
      if (error != null) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        errors.add(supervisor.name() + ": " + cause.getMessage());
        logger.log(Level.WARNING, "Shutdown of '" + supervisor.name() + "' failed", cause);
      }
      return null;
    });
  }

  // ── Events ──

  @Override
  public void addListener(String eventType, LifecycleListener listener) {
    events.addListener(eventType, listener);
  }

  @Override
  public void removeListener(LifecycleListener listener) {
    events.removeListener(listener);
  }

  private void ensureInitialized(String operation) {
    RegistryState current = state.get();
    if (current != RegistryState.INITIALIZED) {
      throw new IllegalStateException("TenantRegistry is not initialized (state " + current + "); cannot "
          + operation);
    }
  }

  public static final class Builder {
    private Settings settings;
    private ComponentFactories factories;
    private HandleFactory handleFactory;
    private TimeoutController timeouts;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Registry-level settings layered over the built-in defaults and under every tenant's
     * configuration.
     */
    public Builder settings(Settings settings) {
      this.settings = settings;
      return this;
    }

    public Builder settings(Map<String, ?> settings) {
      this.settings = Settings.of(settings);
      return this;
    }

    public Builder factories(ComponentFactories factories) {
      this.factories = factories;
      return this;
    }

    /**
     * Factory used by the default security component, and directly when security is disabled.
     */
    public Builder handleFactory(HandleFactory handleFactory) {
      this.handleFactory = handleFactory;
      return this;
    }

    /**
     * Deadline controller to share. When omitted the registry creates one and closes it on
     * shutdown.
     */
    public Builder timeouts(TimeoutController timeouts) {
      this.timeouts = timeouts;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws ConfigurationException if the registry settings are invalid or a component enabled
     *                                by default has no factory
     */
    public TenantRegistry build() {
      return new TenantRegistry(this);
    }
  }
}
