package tenantdb.spi;

import tenantdb.event.EventSource;

import java.time.Duration;

/**
 * Uniform contract of every sub-component owned by a connection supervisor.
 *
 * <p>Components publish {@code error} and {@code warning} events whose payload carries
 * {@code phase}, {@code message} and {@code timestamp}.
 *
 * @see AbstractLifecycleComponent
 */
public interface LifecycleComponent extends EventSource {

  ComponentResult initialize();

  /**
   * Releases the component's resources, giving in-flight work up to {@code timeout}.
   */
  ComponentResult shutdown(Duration timeout);

  ComponentStatus status();
}
