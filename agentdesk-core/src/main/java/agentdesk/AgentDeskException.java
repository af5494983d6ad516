package agentdesk;

/**
 * Base class for failures raised by the task lifecycle operations.
 */
public class AgentDeskException extends RuntimeException {
  public AgentDeskException(String message) {
    super(message);
  }

  public AgentDeskException(String message, Throwable cause) {
    super(message, cause);
  }
}
