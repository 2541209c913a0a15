package tenantdb.supervisor;

import tenantdb.ComponentException;
import tenantdb.ConfigurationException;
import tenantdb.ConnectionValidationException;
import tenantdb.TenantDbException;
import tenantdb.TransactionFailedException;
import tenantdb.config.DatabaseConfig;
import tenantdb.config.Settings;
import tenantdb.config.TenantConfig;
import tenantdb.event.EventPublisher;
import tenantdb.event.EventSource;
import tenantdb.event.LifecycleListener;
import tenantdb.spi.ComponentContext;
import tenantdb.spi.ComponentResult;
import tenantdb.spi.ComponentSlot;
import tenantdb.spi.ComponentStatus;
import tenantdb.spi.EngineDialect;
import tenantdb.spi.Handle;
import tenantdb.spi.HandleFactory;
import tenantdb.spi.LifecycleComponent;
import tenantdb.spi.MetricsExporter;
import tenantdb.spi.MigrationComponent;
import tenantdb.spi.MigrationResult;
import tenantdb.spi.ModelComponent;
import tenantdb.spi.PoolStats;
import tenantdb.spi.RollbackResult;
import tenantdb.spi.SecurityComponent;
import tenantdb.spi.SeedComponent;
import tenantdb.timeout.TimeoutContext;
import tenantdb.timeout.TimeoutController;
import tenantdb.tx.IsolationLevel;
import tenantdb.tx.TransactionComponent;
import tenantdb.tx.TransactionMetrics;
import tenantdb.tx.TransactionOptions;
import tenantdb.tx.UnitOfWork;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static tenantdb.event.LifecycleEvent.payload;

/**
 * Owns one database handle and the sub-components built around it for a tenant.
 *
 * <p>{@link #initialize()} creates the enabled sub-components in slot order (security,
 * migration, seed, model, transaction), builds the handle through the security component (or
 * directly through the {@link HandleFactory} when security is disabled) and validates it with a
 * round-trip query, an engine-specific schema probe and a pool saturation check, retrying up to
 * {@code database.validation.attempts} times. Any failure tears down what was built and returns
 * the supervisor to {@link SupervisorState#CREATED}.
 *
 * <p>Migration, seed, model and transaction calls delegate to the matching sub-component and
 * return a disabled no-op result when it is not enabled.
 *
 * <p>This class is thread-safe. Lifecycle transitions are guarded by compare-and-set on the
 * state.
 */
public final class ConnectionSupervisor implements EventSource, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionSupervisor.class.getName());

  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final String name;
  private final TenantConfig config;
  private final ComponentFactories factories;
  private final HandleFactory handleFactory;
  private final TimeoutController timeouts;
  private final MetricsExporter metrics;
  private final EventPublisher events;

  private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.CREATED);
  private final AtomicReference<PoolWarmingStatus> warming = new AtomicReference<>(PoolWarmingStatus.idle());
  private volatile Map<ComponentSlot, LifecycleComponent> components = Map.of();
  private volatile Handle handle;
  private volatile boolean handleValidated;

  private ConnectionSupervisor(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.config = Objects.requireNonNull(builder.config, "config");
    this.timeouts = Objects.requireNonNull(builder.timeouts, "timeouts");
    this.factories = builder.factories != null ? builder.factories : ComponentFactories.defaults();
    this.handleFactory = builder.handleFactory;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    this.events = new EventPublisher("ConnectionSupervisor:" + name);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Lifecycle ──

  /**
   * Creates sub-components and the validated handle.
   *
   * @throws ConfigurationException        on an unsafe working directory or missing factory
   * @throws ComponentException            when a sub-component fails to initialize
   * @throws ConnectionValidationException when the handle does not validate in time
   */
  public ComponentResult initialize() {
    if (state.get() == SupervisorState.INITIALIZED) {
      logger.log(Level.WARNING, "Connection supervisor ''{0}'' is already initialized", name);
      return ComponentResult.ok("already initialized");
    }
    if (!state.compareAndSet(SupervisorState.CREATED, SupervisorState.INITIALIZING)) {
      throw new IllegalStateException("Cannot initialize '" + name + "' in state " + state.get());
    }

    Map<ComponentSlot, LifecycleComponent> created = new EnumMap<>(ComponentSlot.class);
    try {
      Path workingDirectory = validateWorkingDirectory();
      createComponents(created, workingDirectory);
      components = Collections.unmodifiableMap(created);
      initializeHandle();
      state.set(SupervisorState.INITIALIZED);
    } catch (RuntimeException e) {
      releaseHandleQuietly();
      shutdownQuietly(created);
      components = Map.of();
      state.set(SupervisorState.CREATED);
      logger.log(Level.SEVERE, "Initialization of '" + name + "' failed", e);
      events.error("initialize", e, payload("connectionName", name));
      throw e;
    }

    logger.log(Level.INFO, "Connection supervisor ''{0}'' initialized with components {1}",
        new Object[] {name, created.keySet()});
    events.publish("initialized", payload(
        "connectionName", name,
        "components", componentNames(),
        "shared", isShared()));
    return ComponentResult.ok("initialized");
  }

  private Path validateWorkingDirectory() {
    Path raw = config.workingDirectory();
    for (Path part : raw) {
      if ("..".equals(part.toString())) {
        throw new ConfigurationException("Working directory '" + raw + "' of '" + name
            + "' must not contain '..'", "initialize", name);
      }
    }
    Path resolved = raw.toAbsolutePath().normalize();
    if (!Files.isDirectory(resolved)) {
      throw new ConfigurationException("Working directory '" + resolved + "' of '" + name
          + "' does not exist or is not a directory", "initialize", name);
    }
    if (!Files.isReadable(resolved)) {
      throw new ConfigurationException("Working directory '" + resolved + "' of '" + name
          + "' is not readable", "initialize", name);
    }
    return resolved;
  }

  private void createComponents(Map<ComponentSlot, LifecycleComponent> created, Path workingDirectory) {
    for (ComponentSlot slot : ComponentSlot.values()) {
      if (!config.isEnabled(slot)) {
        continue;
      }
      ComponentContext context = new ComponentContext(name, config.slotSettings(slot), config.settings(),
          timeouts, handleFactory, metrics, workingDirectory);
      LifecycleComponent component = factories.create(slot, context);
      component.addListener("error", relay(slot, "component-error"));
      component.addListener("warning", relay(slot, "component-warning"));
      created.put(slot, component);
      try {
        component.initialize();
      } catch (TenantDbException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new ComponentException(slot, "initialize", name, e);
      }
      logger.log(Level.FINE, "Initialized {0} for ''{1}''", new Object[] {slot.componentName(), name});
    }
  }

  private LifecycleListener relay(ComponentSlot slot, String eventType) {
    return event -> {
      Map<String, Object> attributes = new LinkedHashMap<>(event.attributes());
      attributes.put("component", slot.componentName());
      attributes.put("connectionName", name);
      events.publish(eventType, attributes);
    };
  }

  private void initializeHandle() {
    DatabaseConfig database = config.database().validate(name);
    int maxAttempts = database.validationAttempts();
    Exception last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        Handle current = handle;
        if (current == null || current.isClosed()) {
          current = createHandle(database);
          handle = current;
        }
        validate(current);
        handleValidated = true;
        return;
      } catch (SQLException | RuntimeException e) {
        last = e;
        logger.log(Level.WARNING, "Connection validation attempt {0}/{1} for ''{2}'' failed: {3}",
            new Object[] {attempt, maxAttempts, name, e.getMessage()});
        if (attempt < maxAttempts && !pause(database.validationRetryDelayMs() * attempt)) {
          break;
        }
      }
    }
    releaseHandleQuietly();
    throw new ConnectionValidationException("Connection validation failed for '" + name + "' after "
        + maxAttempts + " attempts: " + (last == null ? "interrupted" : last.getMessage()), name, maxAttempts, last);
  }

  private Handle createHandle(DatabaseConfig database) throws SQLException {
    LifecycleComponent security = components.get(ComponentSlot.SECURITY);
    Handle created;
    if (security instanceof SecurityComponent securityComponent) {
      created = securityComponent.createHandle(database);
    } else if (handleFactory != null) {
      created = handleFactory.create(database);
    } else {
      throw new ConfigurationException("Security is disabled and no HandleFactory is configured",
          "initialize", name);
    }
    if (created == null) {
      throw new IllegalStateException("Handle creation for '" + name + "' returned null");
    }
    return created;
  }

  /**
   * Round trip, schema probe and pool saturation check.
   */
  private static void validate(Handle target) throws SQLException {
    EngineDialect dialect = target.dialect() != null ? target.dialect() : EngineDialect.GENERIC;
    try (Connection connection = target.getConnection();
         Statement statement = connection.createStatement()) {
      try (ResultSet rs = statement.executeQuery(dialect.pingSql())) {
        if (!rs.next()) {
          throw new SQLException("Round-trip query returned no rows");
        }
      }
      try (ResultSet rs = statement.executeQuery(dialect.schemaProbeSql())) {
        if (!rs.next()) {
          throw new SQLException("Schema probe returned no rows");
        }
      }
    }
    PoolStats stats = target.poolStats();
    if (stats != null && stats.saturated()) {
      throw new SQLException("Connection pool saturated: " + stats.active() + "/" + stats.max()
          + " in use, " + stats.pending() + " waiting");
    }
  }

  private static void ping(Handle target) throws SQLException {
    EngineDialect dialect = target.dialect() != null ? target.dialect() : EngineDialect.GENERIC;
    try (Connection connection = target.getConnection();
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(dialect.pingSql())) {
      if (!rs.next()) {
        throw new SQLException("Round-trip query returned no rows");
      }
    }
  }

  /**
   * Shuts down with a 30 second deadline per sub-component.
   */
  public ComponentResult shutdown() {
    return shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Shuts sub-components down in reverse slot order, each under {@code timeout}, then releases
   * the handle. Sub-component failures are logged and counted, not thrown. Calling this again
   * after a completed shutdown is a no-op.
   */
  public ComponentResult shutdown(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    SupervisorState current = state.get();
    if (current == SupervisorState.SHUTDOWN || current == SupervisorState.SHUTTING_DOWN) {
      return ComponentResult.ok("already shut down");
    }
    if (!state.compareAndSet(SupervisorState.INITIALIZED, SupervisorState.SHUTTING_DOWN)) {
      return ComponentResult.ok("not initialized (state " + state.get() + ")");
    }

    long started = System.nanoTime();
    List<String> failures;
    try {
      failures = shutdownComponents(timeout);
      Handle current0 = handle;
      handle = null;
      handleValidated = false;
      if (current0 != null) {
        current0.close();
      }
      components = Map.of();
      warming.set(PoolWarmingStatus.idle());
      state.set(SupervisorState.SHUTDOWN);
    } catch (RuntimeException e) {
      state.set(SupervisorState.INITIALIZED);
      logger.log(Level.SEVERE, "Shutdown of '" + name + "' failed", e);
      events.error("shutdown", e, payload("connectionName", name));
      throw new TenantDbException("Shutdown of '" + name + "' failed: " + e.getMessage(), "shutdown", name, e);
    }

    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    logger.log(Level.INFO, "Connection supervisor ''{0}'' shut down in {1}ms", new Object[] {name, durationMs});
    events.publish("shutdown-completed", payload(
        "connectionName", name,
        "duration", durationMs,
        "componentFailures", failures.size()));
    return failures.isEmpty()
        ? ComponentResult.ok("shut down")
        : ComponentResult.ok("shut down with " + failures.size() + " component failure(s): " + failures);
  }

  @Override
  public void close() {
    shutdown();
  }

  private List<String> shutdownComponents(Duration timeout) {
    List<ComponentSlot> order = new ArrayList<>(components.keySet());
    Collections.reverse(order);
    List<String> failures = new ArrayList<>();
    for (ComponentSlot slot : order) {
      LifecycleComponent component = components.get(slot);
      try {
        timeouts.withDeadline(() -> component.shutdown(timeout), timeout.toMillis(),
            new TimeoutContext("shutdown", slot.componentName(), name, null));
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        failures.add(slot.componentName() + ": " + e.getMessage());
        logger.log(Level.WARNING, "Shutdown of " + slot.componentName() + " for '" + name + "' failed", e);
        events.warning("shutdown", slot.componentName() + " shutdown failed: " + e.getMessage(),
            payload("connectionName", name, "component", slot.componentName()));
      }
    }
    return failures;
  }

  private void shutdownQuietly(Map<ComponentSlot, LifecycleComponent> created) {
    List<ComponentSlot> order = new ArrayList<>(created.keySet());
    Collections.reverse(order);
    for (ComponentSlot slot : order) {
      try {
        created.get(slot).shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Cleanup of " + slot.componentName() + " for '" + name + "' failed", e);
      }
    }
  }

  private void releaseHandleQuietly() {
    Handle current = handle;
    handle = null;
    handleValidated = false;
    if (current == null) {
      return;
    }
    try {
      if (components.get(ComponentSlot.SECURITY) instanceof SecurityComponent security) {
        security.destroyHandle();
      }
      current.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Releasing handle of '" + name + "' failed", e);
    }
  }

  // ── Pool warming ──

  /**
   * Runs {@code max(1, pool.min)} trivial queries in parallel to open pooled connections ahead
   * of traffic. A second call while one is running is rejected without side effects.
   */
  public WarmPoolResult warmPool() {
    ensureInitialized("warmPool");
    int target = Math.max(1, config.database().poolMin());
    PoolWarmingStatus previous = warming.get();
    if (previous.inProgress() || !warming.compareAndSet(previous, PoolWarmingStatus.started(target))) {
      return WarmPoolResult.rejected(name, "Pool warming already in progress for '" + name + "'");
    }

    Handle current = handle;
    long started = System.nanoTime();
    events.publish("pool-warming-started", payload("connectionName", name, "targetConnections", target));

    AtomicInteger warmed = new AtomicInteger();
    ConcurrentLinkedQueue<String> errors = new ConcurrentLinkedQueue<>();
    List<CompletableFuture<Void>> tasks = new ArrayList<>(target);
    for (int i = 1; i <= target; i++) {
      final int index = i;
      tasks.add(CompletableFuture.runAsync(() -> {
        try {
          ping(current);
          warmed.incrementAndGet();
        } catch (SQLException | RuntimeException e) {
          errors.add("Connection " + index + ": " + e.getMessage());
        }
      }, timeouts.executor()));
    }
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();

    int ok = warmed.get();
    List<String> failures = List.copyOf(errors);
    PoolWarmingStatus finished = warming.get().finished(ok, failures.size(), failures);
    warming.set(finished);
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    double successRate = ok * 100.0 / target;

    events.publish("pool-warming-completed", payload(
        "connectionName", name,
        "successful", ok,
        "failed", failures.size(),
        "successRate", successRate,
        "duration", durationMs));
    if (!failures.isEmpty()) {
      logger.log(Level.WARNING, "Pool warming for ''{0}'' had {1} failure(s): {2}",
          new Object[] {name, failures.size(), failures});
    }
    return new WarmPoolResult(ok > 0, name, ok, failures.size(), target, successRate, failures, durationMs,
        "Warmed " + ok + "/" + target + " connections");
  }

  public PoolWarmingStatus poolWarmingStatus() {
    return warming.get();
  }

  // ── Delegations ──

  public MigrationResult runMigrations(Settings options) {
    return delegate(ComponentSlot.MIGRATION, MigrationComponent.class, "run-migrations",
        MigrationResult::disabledResult, m -> m.migrate(handle, orEmpty(options)));
  }

  public RollbackResult rollbackMigrations(Settings options) {
    return delegate(ComponentSlot.MIGRATION, MigrationComponent.class, "rollback-migrations",
        RollbackResult::disabledResult, m -> m.rollback(handle, orEmpty(options)));
  }

  public MigrationResult runSeeds(Settings options) {
    return delegate(ComponentSlot.SEED, SeedComponent.class, "run-seeds",
        MigrationResult::disabledResult, s -> s.migrate(handle, orEmpty(options)));
  }

  public RollbackResult rollbackSeeds(Settings options) {
    return delegate(ComponentSlot.SEED, SeedComponent.class, "rollback-seeds",
        RollbackResult::disabledResult, s -> s.rollback(handle, orEmpty(options)));
  }

  /**
   * @return names of the registered models, empty when models are disabled
   */
  public List<String> registerModels(Map<String, Object> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    return delegate(ComponentSlot.MODEL, ModelComponent.class, "register-models",
        List::of, m -> m.registerModels(handle, definitions));
  }

  /**
   * @return number of models removed, 0 when models are disabled
   */
  public int clearModels() {
    return delegate(ComponentSlot.MODEL, ModelComponent.class, "clear-models", () -> 0, ModelComponent::clearModels);
  }

  public Set<String> modelNames() {
    return delegate(ComponentSlot.MODEL, ModelComponent.class, "model-names", Set::of, ModelComponent::modelNames);
  }

  public boolean hasModel(String modelName) {
    return delegate(ComponentSlot.MODEL, ModelComponent.class, "has-model", () -> false, m -> m.hasModel(modelName));
  }

  public Optional<Object> model(String modelName) {
    return delegate(ComponentSlot.MODEL, ModelComponent.class, "get-model", Optional::empty, m -> m.model(modelName));
  }

  /**
   * Runs {@code work} through the transaction component, or on a plain auto-commit connection
   * when transactions are disabled.
   */
  public <T> T withTransaction(UnitOfWork<T> work) {
    return withTransaction(work, null, null);
  }

  public <T> T withTransaction(UnitOfWork<T> work, IsolationLevel isolationLevel, Long timeoutMs) {
    Objects.requireNonNull(work, "work");
    ensureInitialized("withTransaction");
    TransactionComponent transactions = component(ComponentSlot.TRANSACTION, TransactionComponent.class);
    if (transactions != null) {
      return transactions.run(work, new TransactionOptions(handle, isolationLevel, timeoutMs));
    }
    try (Connection connection = handle.getConnection()) {
      return work.execute(connection);
    } catch (TenantDbException e) {
      throw e;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new TransactionFailedException(null, name, 1, e);
    }
  }

  /**
   * @return false when transactions are disabled or no active transaction has that id
   */
  public boolean abortTransaction(String transactionId) {
    TransactionComponent transactions = component(ComponentSlot.TRANSACTION, TransactionComponent.class);
    return transactions != null && transactions.abortTransaction(transactionId);
  }

  public Optional<TransactionMetrics> transactionMetrics() {
    TransactionComponent transactions = component(ComponentSlot.TRANSACTION, TransactionComponent.class);
    return transactions == null ? Optional.empty() : Optional.of(transactions.metrics());
  }

  private <C, R> R delegate(ComponentSlot slot, Class<C> type, String phase, Supplier<R> disabled,
      Function<C, R> call) {
    ensureInitialized(phase);
    C component = component(slot, type);
    if (component == null) {
      return disabled.get();
    }
    try {
      return call.apply(component);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, phase + " failed for '" + name + "'", e);
      events.error(phase, e, payload("connectionName", name, "component", slot.componentName()));
      if (e instanceof TenantDbException) {
        throw e;
      }
      throw new ComponentException(slot, phase, name, e);
    }
  }

  private <C> C component(ComponentSlot slot, Class<C> type) {
    LifecycleComponent component = components.get(slot);
    return type.isInstance(component) ? type.cast(component) : null;
  }

  private static Settings orEmpty(Settings options) {
    return options == null ? Settings.empty() : options;
  }

  // ── Health and status ──

  /**
   * Runs a round-trip query. A failure marks the handle invalid; the next successful check
   * then re-runs full validation before reporting healthy.
   */
  public HealthCheckResult checkHealth() {
    long started = System.nanoTime();
    Handle current = handle;
    if (state.get() != SupervisorState.INITIALIZED || current == null) {
      return healthResult(false, started, false, List.of("Connection supervisor is not initialized"));
    }
    try {
      ping(current);
    } catch (SQLException | RuntimeException e) {
      handleValidated = false;
      return healthFailed(started, false, "Round-trip query failed: " + e.getMessage());
    }
    boolean revalidated = false;
    if (!handleValidated) {
      try {
        validate(current);
      } catch (SQLException | RuntimeException e) {
        return healthFailed(started, true, "Revalidation failed: " + e.getMessage());
      }
      handleValidated = true;
      revalidated = true;
    }
    HealthCheckResult result = healthResult(true, started, revalidated, List.of());
    events.publish("health-check-passed", payload(
        "connectionName", name, "latency", result.latencyMs(), "revalidated", revalidated));
    return result;
  }

  private HealthCheckResult healthFailed(long started, boolean revalidated, String issue) {
    HealthCheckResult result = healthResult(false, started, revalidated, List.of(issue));
    logger.log(Level.WARNING, "Health check for ''{0}'' failed: {1}", new Object[] {name, issue});
    events.publish("health-check-failed", payload("connectionName", name, "issue", issue));
    return result;
  }

  private HealthCheckResult healthResult(boolean healthy, long started, boolean revalidated, List<String> issues) {
    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    return new HealthCheckResult(healthy, name, latencyMs, revalidated, issues, Instant.now());
  }

  public SupervisorStatus status() {
    Map<ComponentSlot, LifecycleComponent> current = components;
    Map<String, ComponentStatus> statuses = new LinkedHashMap<>();
    int healthy = 0;
    for (Map.Entry<ComponentSlot, LifecycleComponent> entry : current.entrySet()) {
      ComponentStatus componentStatus;
      try {
        componentStatus = entry.getValue().status();
      } catch (RuntimeException e) {
        componentStatus = new ComponentStatus(entry.getKey().componentName(), false, false,
            Map.of("error", String.valueOf(e.getMessage())));
      }
      statuses.put(entry.getKey().componentName(), componentStatus);
      if (componentStatus.healthy()) {
        healthy++;
      }
    }
    Handle currentHandle = handle;
    boolean connected = currentHandle != null && !currentHandle.isClosed();
    return new SupervisorStatus(
        name,
        state.get(),
        isShared(),
        connected,
        statuses,
        healthy,
        current.size(),
        warming.get(),
        connected ? currentHandle.poolStats() : null,
        config.database().target(),
        Instant.now());
  }

  // ── Accessors ──

  public String name() {
    return name;
  }

  public SupervisorState state() {
    return state.get();
  }

  public boolean isInitialized() {
    return state.get() == SupervisorState.INITIALIZED;
  }

  public boolean isShared() {
    return config.isShared();
  }

  public TenantConfig config() {
    return config;
  }

  /**
   * The live handle, or {@code null} when not initialized.
   */
  public Handle handle() {
    return handle;
  }

  public List<String> componentNames() {
    List<String> names = new ArrayList<>();
    for (ComponentSlot slot : components.keySet()) {
      names.add(slot.componentName());
    }
    return names;
  }

  @Override
  public void addListener(String eventType, LifecycleListener listener) {
    events.addListener(eventType, listener);
  }

  @Override
  public void removeListener(LifecycleListener listener) {
    events.removeListener(listener);
  }

  private void ensureInitialized(String operation) {
    SupervisorState current = state.get();
    if (current != SupervisorState.INITIALIZED) {
      throw new IllegalStateException("Connection supervisor '" + name + "' is not initialized (state "
          + current + "); cannot " + operation);
    }
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

  @Override
  public String toString() {
    return "ConnectionSupervisor[" + name + ", " + state.get() + "]";
  }

  public static final class Builder {
    private String name;
    private TenantConfig config;
    private ComponentFactories factories;
    private HandleFactory handleFactory;
    private TimeoutController timeouts;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder config(TenantConfig config) {
      this.config = config;
      return this;
    }

    public Builder factories(ComponentFactories factories) {
      this.factories = factories;
      return this;
    }

    public Builder handleFactory(HandleFactory handleFactory) {
      this.handleFactory = handleFactory;
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

    public ConnectionSupervisor build() {
      return new ConnectionSupervisor(this);
    }
  }
}
