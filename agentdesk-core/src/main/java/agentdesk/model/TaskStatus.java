package agentdesk.model;

import java.util.Locale;

/**
 * Lifecycle status of an agent task.
 *
 * <p>{@link #COMPLETED} and {@link #CANCELLED} are terminal. {@link #FAILED} is not:
 * a failed task may be run again (for example after approval) or cancelled.
 */
public enum TaskStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  CANCELLED;

  /** Lower-case wire name, e.g. {@code in_progress}. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TaskStatus fromCode(String code) {
    for (TaskStatus status : values()) {
      if (status.code().equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown task status: " + code);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  /**
   * Whether a stored task in this status may move to {@code next}.
   * Staying in the same non-terminal status is always allowed.
   */
  public boolean canTransitionTo(TaskStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == this) {
      return true;
    }
    switch (this) {
      case PENDING:
        return next == IN_PROGRESS || next == FAILED || next == CANCELLED;
      case IN_PROGRESS:
        return next == COMPLETED || next == FAILED || next == CANCELLED;
      case FAILED:
        return next == IN_PROGRESS || next == CANCELLED;
      default:
        return false;
    }
  }
}
