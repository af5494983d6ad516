package agentdesk;

import agentdesk.model.TaskMetadata;

/**
 * Input of {@link AgentDesk#create}.
 *
 * @param supervisor producing context, informational; may be {@code null}
 * @param agent      capability name, required
 * @param action     sub-operation, required
 * @param payload    opaque handler input, may be {@code null}
 * @param metadata   approval and safety flags, may be {@code null}
 */
public record TaskRequest(
    String supervisor,
    String agent,
    String action,
    String payload,
    TaskMetadata metadata
) {

  public static TaskRequest of(String agent, String action, String payload) {
    return new TaskRequest(null, agent, action, payload, null);
  }
}
