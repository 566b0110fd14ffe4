/**
 * Micrometer bridge for exporting janitor pass statistics to Prometheus, Grafana and other backends.
 *
 * <p>{@link janitor.micrometer.MicrometerMetricsExporter} implements the
 * {@link janitor.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see janitor.micrometer.MicrometerMetricsExporter
 */
package janitor.micrometer;
