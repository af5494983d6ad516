package agentdesk.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors raised by the JDBC stores.
 */
public final class AgentDeskStoreException extends RuntimeException {
  public AgentDeskStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the underlying failure is a constraint violation (SQLState class {@code 23}).
   */
  public boolean isConstraintViolation() {
    Throwable cause = getCause();
    while (cause != null) {
      if (cause instanceof SQLException sql && sql.getSQLState() != null
          && sql.getSQLState().startsWith("23")) {
        return true;
      }
      cause = cause.getCause();
    }
    return false;
  }
}
