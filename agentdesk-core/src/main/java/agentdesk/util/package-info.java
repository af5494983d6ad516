/**
 * Internal utilities: thread factory and the flat JSON codec used by the JDBC outbox store.
 */
package agentdesk.util;
