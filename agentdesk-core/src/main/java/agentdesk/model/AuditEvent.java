package agentdesk.model;

import java.time.Instant;

/**
 * One immutable audit record describing a lifecycle transition of a task.
 *
 * @param sequence  store-assigned append position, increasing across all tasks
 * @param taskId    the task this event belongs to
 * @param agent     capability name of the task
 * @param action    action of the task
 * @param eventType kind of transition
 * @param detail    optional human-readable detail, may be {@code null}
 * @param timestamp when the event was appended
 * @see agentdesk.spi.AuditLog
 */
public record AuditEvent(
    long sequence,
    String taskId,
    String agent,
    String action,
    AuditEventType eventType,
    String detail,
    Instant timestamp
) {}
