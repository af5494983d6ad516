/**
 * Service provider interfaces: task, audit and outbox persistence and metrics export.
 *
 * <p>The {@code agentdesk-jdbc} module provides JDBC implementations of the stores and
 * {@code agentdesk-micrometer} provides a Micrometer {@link agentdesk.spi.MetricsExporter}.
 */
package agentdesk.spi;
