package agentdesk.model;

/**
 * Closed set of per-task metadata fields.
 *
 * @param safetyLevel         informational risk tag, may be {@code null}
 * @param requireUserApproval whether the task must be approved before it may run
 * @param approved            set only by the approval operation
 * @param rejectionReason     set only by the reject operation, may be {@code null}
 */
public record TaskMetadata(
    SafetyLevel safetyLevel,
    boolean requireUserApproval,
    boolean approved,
    String rejectionReason
) {

  public static final TaskMetadata NONE = new TaskMetadata(null, false, false, null);

  /** Metadata for a task that must be approved before it runs. */
  public static TaskMetadata approvalRequired(SafetyLevel safetyLevel) {
    return new TaskMetadata(safetyLevel, true, false, null);
  }

  public boolean awaitingApproval() {
    return requireUserApproval && !approved;
  }

  public TaskMetadata withApproved(boolean approved) {
    return new TaskMetadata(safetyLevel, requireUserApproval, approved, rejectionReason);
  }

  public TaskMetadata withRejectionReason(String rejectionReason) {
    return new TaskMetadata(safetyLevel, requireUserApproval, approved, rejectionReason);
  }
}
