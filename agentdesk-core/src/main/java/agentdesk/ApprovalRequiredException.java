package agentdesk;

/**
 * Thrown when a task that requires user approval is run before it was approved.
 *
 * <p>By the time this is thrown the task has already been recorded as failed with
 * {@link #MESSAGE} and a {@code failed} audit event has been appended. Approving the
 * task and running it again is the recovery path.
 */
public final class ApprovalRequiredException extends AgentDeskException {
  public static final String MESSAGE = "requires user approval";

  private final String taskId;

  public ApprovalRequiredException(String taskId) {
    super("Task " + taskId + " " + MESSAGE);
    this.taskId = taskId;
  }

  public String taskId() {
    return taskId;
  }
}
