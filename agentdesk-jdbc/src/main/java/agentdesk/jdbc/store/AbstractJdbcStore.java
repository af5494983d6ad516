package agentdesk.jdbc.store;

import agentdesk.jdbc.AgentDeskStoreException;
import agentdesk.jdbc.ConnectionProvider;
import agentdesk.jdbc.TableNames;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for the JDBC stores: owns the connection provider and table name, and
 * runs statements either in auto-commit mode or inside a single transaction.
 */
abstract class AbstractJdbcStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  AbstractJdbcStore(ConnectionProvider connectionProvider, String tableName) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  @FunctionalInterface
  interface ConnectionCallback<T> {
    T execute(Connection conn);
  }

  /** Runs {@code op} on a fresh auto-commit connection. */
  protected <T> T withConnection(String action, ConnectionCallback<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.execute(conn);
    } catch (SQLException e) {
      throw new AgentDeskStoreException("Failed to " + action, e);
    }
  }

  /**
   * Runs {@code op} in one transaction. Any exception rolls the transaction back and
   * is rethrown unchanged.
   */
  protected <T> T inTransaction(String action, ConnectionCallback<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = op.execute(conn);
        conn.commit();
        return result;
      } catch (RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new AgentDeskStoreException("Failed to " + action, e);
    }
  }

  private static void rollbackQuietly(Connection conn, RuntimeException cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }
}
