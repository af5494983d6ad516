/**
 * Micrometer bridge for {@link agentdesk.spi.MetricsExporter}.
 *
 * @see agentdesk.micrometer.MicrometerMetricsExporter
 */
package agentdesk.micrometer;
