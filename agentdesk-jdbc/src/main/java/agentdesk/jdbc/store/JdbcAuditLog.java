package agentdesk.jdbc.store;

import agentdesk.jdbc.ConnectionProvider;
import agentdesk.jdbc.JdbcTemplate;
import agentdesk.jdbc.TableNames;
import agentdesk.model.AuditEvent;
import agentdesk.model.AuditEventType;
import agentdesk.spi.AuditLog;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC {@link AuditLog}. Rows are only ever inserted; the identity column {@code seq}
 * gives the append order.
 */
public final class JdbcAuditLog extends AbstractJdbcStore implements AuditLog {
  private static final int MAX_DETAIL_LENGTH = 4000;

  private static final JdbcTemplate.RowMapper<AuditEvent> EVENT_ROW_MAPPER = rs -> new AuditEvent(
      rs.getLong("seq"),
      rs.getString("task_id"),
      rs.getString("agent"),
      rs.getString("action"),
      AuditEventType.fromCode(rs.getString("event_type")),
      rs.getString("detail"),
      JdbcTemplate.instant(rs, "created_at"));

  public JdbcAuditLog(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_AUDIT);
  }

  public JdbcAuditLog(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  public AuditEvent append(String taskId, String agent, String action, AuditEventType eventType, String detail) {
    String sql = "INSERT INTO " + tableName()
        + " (task_id, agent, action, event_type, detail, created_at) VALUES (?,?,?,?,?,?)";
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    String storedDetail = truncate(detail);
    long seq = withConnection("append audit event for task " + taskId,
        conn -> JdbcTemplate.insertReturningKey(conn, sql,
            taskId, agent, action, eventType.code(), storedDetail, JdbcTemplate.timestamp(now)));
    return new AuditEvent(seq, taskId, agent, action, eventType, storedDetail, now);
  }

  @Override
  public List<AuditEvent> trail(String taskId) {
    String sql = "SELECT seq, task_id, agent, action, event_type, detail, created_at FROM " + tableName()
        + " WHERE task_id=? ORDER BY seq";
    return withConnection("read audit trail of task " + taskId,
        conn -> JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, taskId));
  }

  @Override
  public List<AuditEvent> recent(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT seq, task_id, agent, action, event_type, detail, created_at FROM " + tableName()
        + " ORDER BY seq DESC LIMIT ?";
    List<AuditEvent> newestFirst = withConnection("read recent audit events",
        conn -> JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, limit));
    List<AuditEvent> result = new ArrayList<>(newestFirst);
    Collections.reverse(result);
    return result;
  }

  private static String truncate(String detail) {
    if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
      return detail;
    }
    return detail.substring(0, MAX_DETAIL_LENGTH);
  }
}
