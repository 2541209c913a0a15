package tenantdb.spi;

import tenantdb.config.Settings;
import tenantdb.timeout.TimeoutController;

import java.nio.file.Path;

/**
 * What a {@link ComponentFactory} gets to build a sub-component for one tenant.
 *
 * @param tenantName      owning tenant (or connection) name
 * @param settings        the slot's own settings section
 * @param tenantSettings  the tenant's full merged settings
 * @param timeouts        shared deadline controller
 * @param handleFactory   factory for direct handle creation
 * @param metrics         metrics sink
 * @param workingDirectory validated working directory of the tenant
 */
public record ComponentContext(
    String tenantName,
    Settings settings,
    Settings tenantSettings,
    TimeoutController timeouts,
    HandleFactory handleFactory,
    MetricsExporter metrics,
    Path workingDirectory) {
}
