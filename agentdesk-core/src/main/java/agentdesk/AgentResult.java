package agentdesk;

/**
 * Outcome of a successful handler invocation.
 *
 * @param output opaque value stored as the task result
 * @param detail optional short text copied into the {@code completed} audit event
 */
public record AgentResult(String output, String detail) {

  public static AgentResult of(String output) {
    return new AgentResult(output, null);
  }

  public static AgentResult of(String output, String detail) {
    return new AgentResult(output, detail);
  }
}
