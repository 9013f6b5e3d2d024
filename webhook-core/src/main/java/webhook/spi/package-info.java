/**
 * Service provider interfaces implemented by integration modules.
 *
 * @see webhook.spi.MetricsExporter
 */
package webhook.spi;
