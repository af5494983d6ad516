package agentdesk;

import agentdesk.model.TaskStatus;

/**
 * Thrown when an operation is not allowed for the current status of a task.
 * The stored task is left unchanged.
 */
public final class InvalidTransitionException extends AgentDeskException {
  private final String taskId;
  private final TaskStatus currentStatus;

  public InvalidTransitionException(String taskId, TaskStatus currentStatus, String message) {
    super(message);
    this.taskId = taskId;
    this.currentStatus = currentStatus;
  }

  public String taskId() {
    return taskId;
  }

  public TaskStatus currentStatus() {
    return currentStatus;
  }
}
