/**
 * Micrometer bridge for exporting registry, transaction and health metrics.
 *
 * @see tenantdb.micrometer.MicrometerMetricsExporter
 */
package tenantdb.micrometer;
