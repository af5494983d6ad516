package agentdesk.model;

/**
 * Informational risk tag carried in task metadata. Only
 * {@link TaskMetadata#requireUserApproval()} drives gating.
 */
public enum SafetyLevel {
  LOW,
  HIGH
}
