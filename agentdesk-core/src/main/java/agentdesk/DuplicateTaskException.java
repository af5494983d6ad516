package agentdesk;

/**
 * Thrown by {@link agentdesk.spi.TaskStore#addTask} when the task id is already stored.
 */
public final class DuplicateTaskException extends AgentDeskException {
  public DuplicateTaskException(String taskId) {
    super("Duplicate taskId: " + taskId);
  }

  public DuplicateTaskException(String taskId, Throwable cause) {
    super("Duplicate taskId: " + taskId, cause);
  }
}
