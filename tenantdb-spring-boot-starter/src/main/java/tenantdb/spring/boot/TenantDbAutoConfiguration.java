package tenantdb.spring.boot;

import tenantdb.jdbc.HikariHandleFactory;
import tenantdb.registry.TenantRegistry;
import tenantdb.spi.HandleFactory;
import tenantdb.spi.MetricsExporter;
import tenantdb.supervisor.ComponentFactories;
import tenantdb.timeout.TimeoutController;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the tenant registry.
 *
 * <p>Builds a {@link TenantRegistry} from {@link TenantDbProperties}, backed by HikariCP pools
 * unless another {@link HandleFactory} bean is present, and registers every tenant declared under
 * {@code tenantdb.tenants}. A tenant that fails to register fails context startup.
 *
 * @see TenantDbProperties
 * @see TenantDbMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(TenantRegistry.class)
@EnableConfigurationProperties(TenantDbProperties.class)
public class TenantDbAutoConfiguration {
  private static final Logger logger = Logger.getLogger(TenantDbAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean(HandleFactory.class)
  public HikariHandleFactory handleFactory() {
    return HikariHandleFactory.builder().build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ComponentFactories componentFactories() {
    return ComponentFactories.defaults();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public TimeoutController tenantDbTimeoutController() {
    return new TimeoutController();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public TenantRegistry tenantRegistry(TenantDbProperties props,
      HandleFactory handleFactory,
      ComponentFactories componentFactories,
      TimeoutController timeouts,
      ObjectProvider<MetricsExporter> metricsProvider) {

    TenantRegistry registry = TenantRegistry.builder()
        .settings(props.toSettings())
        .handleFactory(handleFactory)
        .factories(componentFactories)
        .timeouts(timeouts)
        .metrics(metricsProvider.getIfAvailable())
        .build();
    registry.initialize();
    try {
      for (Map.Entry<String, TenantDbProperties.Tenant> entry : props.getTenants().entrySet()) {
        registry.registerApp(entry.getKey(), entry.getValue().toConfig());
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Tenant registration failed during startup", e);
      registry.close();
      throw e;
    }
    return registry;
  }
}
