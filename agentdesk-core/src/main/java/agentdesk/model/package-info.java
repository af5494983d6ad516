/**
 * Value types shared by the stores and workers: task status, metadata, audit events
 * and outbox items.
 */
package agentdesk.model;
