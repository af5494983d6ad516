package agentdesk;

import agentdesk.model.TaskMetadata;
import agentdesk.model.TaskStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Partial update applied to the latest persisted state of a task.
 *
 * <p>Fields that were never set are left unchanged. {@code result} and {@code error}
 * can be explicitly cleared with {@link Builder#clearResult()} and
 * {@link Builder#clearError()}. Store implementations call {@link #applyTo} inside
 * their critical section so that every store enforces the same transition rules.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * taskStore.updateTask(taskId, TaskUpdate.builder()
 *     .status(TaskStatus.COMPLETED)
 *     .result(output)
 *     .clearError()
 *     .build());
 * }</pre>
 */
public final class TaskUpdate {
  private final TaskStatus status;
  private final TaskMetadata metadata;
  private final boolean resultSet;
  private final String result;
  private final boolean errorSet;
  private final String error;

  private TaskUpdate(Builder builder) {
    this.status = builder.status;
    this.metadata = builder.metadata;
    this.resultSet = builder.resultSet;
    this.result = builder.result;
    this.errorSet = builder.errorSet;
    this.error = builder.error;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Moves to {@code status} and clears the fields that do not belong to it. */
  public static TaskUpdate status(TaskStatus status) {
    Builder builder = builder().status(status);
    if (status != TaskStatus.COMPLETED) {
      builder.clearResult();
    }
    if (status != TaskStatus.FAILED) {
      builder.clearError();
    }
    return builder.build();
  }

  public static TaskUpdate completed(String result) {
    return builder().status(TaskStatus.COMPLETED).result(result).clearError().build();
  }

  public static TaskUpdate failed(String error) {
    return builder().status(TaskStatus.FAILED).error(error).clearResult().build();
  }

  public static TaskUpdate metadata(TaskMetadata metadata) {
    return builder().metadata(metadata).build();
  }

  public TaskStatus status() {
    return status;
  }

  public TaskMetadata metadata() {
    return metadata;
  }

  /**
   * Merges this update into {@code current}.
   *
   * @param current the latest persisted task
   * @param now     the new {@code updatedAt} value
   * @return the merged task
   * @throws InvalidTransitionException if {@code current} is terminal or the status
   *     change is not allowed
   */
  public AgentTask applyTo(AgentTask current, Instant now) {
    Objects.requireNonNull(current, "current");
    TaskStatus from = current.status();
    if (from.isTerminal()) {
      throw new InvalidTransitionException(current.taskId(), from,
          "Task " + current.taskId() + " is " + from.code() + " and can no longer change");
    }
    if (status != null && !from.canTransitionTo(status)) {
      throw new InvalidTransitionException(current.taskId(), from,
          "Cannot move task " + current.taskId() + " from " + from.code() + " to " + status.code());
    }
    AgentTask.Builder merged = current.toBuilder().updatedAt(now);
    if (status != null) {
      merged.status(status);
    }
    if (metadata != null) {
      merged.metadata(metadata);
    }
    if (resultSet) {
      merged.result(result);
    }
    if (errorSet) {
      merged.error(error);
    }
    return merged.build();
  }

  public static final class Builder {
    private TaskStatus status;
    private TaskMetadata metadata;
    private boolean resultSet;
    private String result;
    private boolean errorSet;
    private String error;

    private Builder() {}

    public Builder status(TaskStatus status) {
      this.status = status;
      return this;
    }

    public Builder metadata(TaskMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder result(String result) {
      this.resultSet = true;
      this.result = result;
      return this;
    }

    public Builder clearResult() {
      return result(null);
    }

    public Builder error(String error) {
      this.errorSet = true;
      this.error = error;
      return this;
    }

    public Builder clearError() {
      return error(null);
    }

    public TaskUpdate build() {
      return new TaskUpdate(this);
    }
  }
}
