/**
 * JDBC implementations of the core persistence SPIs.
 *
 * @see agentdesk.jdbc.store.JdbcTaskStore
 * @see agentdesk.jdbc.store.JdbcAuditLog
 * @see agentdesk.jdbc.store.JdbcOutboxStore
 */
package agentdesk.jdbc.store;
