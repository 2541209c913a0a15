package tenantdb.testing;

import tenantdb.config.DatabaseConfig;
import tenantdb.spi.Handle;
import tenantdb.spi.HandleFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Creates {@link TestHandle}s from tenant database configuration and remembers them.
 */
public final class TestHandleFactory implements HandleFactory {
  private final List<TestHandle> created = new CopyOnWriteArrayList<>();
  private final AtomicBoolean failing = new AtomicBoolean();

  @Override
  public Handle create(DatabaseConfig config) throws SQLException {
    if (failing.get()) {
      throw new SQLException("Connection refused (ECONNREFUSED)", "08001");
    }
    TestHandle handle = new TestHandle(config.jdbcUrl(), config.target());
    created.add(handle);
    return handle;
  }

  public List<TestHandle> created() {
    return List.copyOf(created);
  }

  public TestHandle last() {
    return created.get(created.size() - 1);
  }

  /** Makes every later {@link #create} call fail. */
  public void setFailing(boolean failing) {
    this.failing.set(failing);
  }
}
