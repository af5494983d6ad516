package agentdesk.spi;

import agentdesk.model.AuditEvent;
import agentdesk.model.AuditEventType;

import java.util.List;

/**
 * Append-only record of task lifecycle transitions.
 *
 * <p>Events are never updated or deleted. Events of one task are returned in the
 * order they were appended.
 */
public interface AuditLog {

  /**
   * Appends one event.
   *
   * @param taskId    the task the event belongs to
   * @param agent     capability name of the task
   * @param action    action of the task
   * @param eventType kind of transition
   * @param detail    optional detail, may be {@code null}
   * @return the stored event
   * @throws RuntimeException if the event could not be written
   */
  AuditEvent append(String taskId, String agent, String action, AuditEventType eventType, String detail);

  /**
   * Returns every event of {@code taskId}, oldest first.
   */
  List<AuditEvent> trail(String taskId);

  /**
   * Returns the last {@code limit} events across all tasks, oldest first.
   *
   * @param limit maximum number of events, must be &gt; 0
   */
  List<AuditEvent> recent(int limit);
}
