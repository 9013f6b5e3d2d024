/**
 * Micrometer bridge for exporting webhook queue metrics to Prometheus and other backends.
 *
 * <p>{@link webhook.micrometer.MicrometerMetricsExporter} implements the
 * {@link webhook.spi.MetricsExporter} SPI using Micrometer counters, a gauge and timers.
 *
 * @see webhook.micrometer.MicrometerMetricsExporter
 */
package webhook.micrometer;
