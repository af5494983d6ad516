package agentdesk;

public final class TaskNotFoundException extends AgentDeskException {
  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super("Task not found: " + taskId);
    this.taskId = taskId;
  }

  public String taskId() {
    return taskId;
  }
}
