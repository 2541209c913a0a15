package tenantdb.supervisor;

import tenantdb.ConfigurationException;
import tenantdb.config.DatabaseConfig;
import tenantdb.spi.AbstractLifecycleComponent;
import tenantdb.spi.ComponentFactory;
import tenantdb.spi.ComponentStatus;
import tenantdb.spi.Handle;
import tenantdb.spi.HandleFactory;
import tenantdb.spi.SecurityComponent;

import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static tenantdb.event.LifecycleEvent.payload;

/**
 * Security slot used unless overridden: checks the database configuration, creates the handle
 * through the registry's {@link HandleFactory} and owns it until shutdown.
 *
 * <p>At most one handle is live at a time; asking again returns the open one.
 */
public final class DefaultSecurityComponent extends AbstractLifecycleComponent implements SecurityComponent {
  private static final Logger logger = Logger.getLogger(DefaultSecurityComponent.class.getName());

  public static final String COMPONENT_NAME = "securityManager";

  private final String tenantName;
  private final HandleFactory handleFactory;
  private Handle handle;

  public DefaultSecurityComponent(String tenantName, HandleFactory handleFactory) {
    super(COMPONENT_NAME);
    this.tenantName = Objects.requireNonNull(tenantName, "tenantName");
    this.handleFactory = handleFactory;
  }

  public static ComponentFactory<DefaultSecurityComponent> factory() {
    return context -> new DefaultSecurityComponent(context.tenantName(), context.handleFactory());
  }

  @Override
  protected void doInitialize() {
    if (handleFactory == null) {
      throw new ConfigurationException("No HandleFactory available to create database handles",
          "security-initialization", tenantName);
    }
  }

  @Override
  public synchronized Handle createHandle(DatabaseConfig config) throws SQLException {
    if (!isInitialized()) {
      throw new IllegalStateException("Security component for '" + tenantName + "' is not initialized");
    }
    if (handle != null && !handle.isClosed()) {
      return handle;
    }
    config.validate(tenantName);
    if (config.password() == null && config.username() != null) {
      events.warning("create-handle", "Database user '" + config.username() + "' has no password configured",
          payload("connectionName", tenantName));
    }
    handle = handleFactory.create(config);
    logger.log(Level.FINE, "Created handle for ''{0}'' ({1})", new Object[] {tenantName, config.target().fingerprint()});
    return handle;
  }

  @Override
  public synchronized void destroyHandle() {
    Handle current = handle;
    handle = null;
    if (current != null) {
      current.close();
    }
  }

  @Override
  protected void doShutdown(Duration timeout) {
    destroyHandle();
  }

  @Override
  public synchronized ComponentStatus status() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("connectionName", tenantName);
    details.put("handleActive", handle != null && !handle.isClosed());
    if (handle != null) {
      details.put("target", handle.target().fingerprint());
    }
    return new ComponentStatus(COMPONENT_NAME, isInitialized(), isInitialized(), details);
  }
}
