package agentdesk.jdbc.store;

import agentdesk.AgentTask;
import agentdesk.DuplicateTaskException;
import agentdesk.TaskUpdate;
import agentdesk.jdbc.AgentDeskStoreException;
import agentdesk.jdbc.ConnectionProvider;
import agentdesk.jdbc.JdbcTemplate;
import agentdesk.jdbc.TableNames;
import agentdesk.model.SafetyLevel;
import agentdesk.model.TaskMetadata;
import agentdesk.model.TaskStatus;
import agentdesk.spi.TaskStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link TaskStore}.
 *
 * <p>{@link #updateTask} reads the row with {@code SELECT ... FOR UPDATE}, merges the
 * update and writes it back in one transaction, so concurrent updates of the same task
 * are serialized by the database.
 */
public final class JdbcTaskStore extends AbstractJdbcStore implements TaskStore {

  private static final String COLUMNS = "task_id, supervisor, agent, action, payload, status, "
      + "safety_level, require_approval, approved, rejection_reason, result, error, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<AgentTask> TASK_ROW_MAPPER = rs -> {
    String safety = rs.getString("safety_level");
    TaskMetadata metadata = new TaskMetadata(
        safety == null ? null : SafetyLevel.valueOf(safety),
        rs.getBoolean("require_approval"),
        rs.getBoolean("approved"),
        rs.getString("rejection_reason"));
    return AgentTask.builder(rs.getString("agent"), rs.getString("action"))
        .taskId(rs.getString("task_id"))
        .supervisor(rs.getString("supervisor"))
        .payload(rs.getString("payload"))
        .metadata(metadata)
        .status(TaskStatus.fromCode(rs.getString("status")))
        .result(rs.getString("result"))
        .error(rs.getString("error"))
        .createdAt(JdbcTemplate.instant(rs, "created_at"))
        .updatedAt(JdbcTemplate.instant(rs, "updated_at"))
        .build();
  };

  public JdbcTaskStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_TASKS);
  }

  public JdbcTaskStore(ConnectionProvider connectionProvider, String tableName) {
    super(connectionProvider, tableName);
  }

  @Override
  public void addTask(AgentTask task) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    TaskMetadata metadata = task.metadata();
    try {
      withConnection("insert task " + task.taskId(), conn -> JdbcTemplate.update(conn, sql,
          task.taskId(), task.supervisor(), task.agent(), task.action(), task.payload(),
          task.status().code(),
          metadata.safetyLevel() == null ? null : metadata.safetyLevel().name(),
          metadata.requireUserApproval(), metadata.approved(), metadata.rejectionReason(),
          task.result(), task.error(),
          JdbcTemplate.timestamp(task.createdAt()), JdbcTemplate.timestamp(task.updatedAt())));
    } catch (AgentDeskStoreException e) {
      if (e.isConstraintViolation()) {
        throw new DuplicateTaskException(task.taskId(), e);
      }
      throw e;
    }
  }

  @Override
  public Optional<AgentTask> getTask(String taskId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE task_id=?";
    return withConnection("load task " + taskId,
        conn -> JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, taskId).stream().findFirst());
  }

  @Override
  public List<AgentTask> listTasks() {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " ORDER BY created_at, task_id";
    return withConnection("list tasks", conn -> JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER));
  }

  @Override
  public Optional<AgentTask> updateTask(String taskId, TaskUpdate update) {
    return inTransaction("update task " + taskId, conn -> {
      Optional<AgentTask> current = lockRow(conn, taskId);
      if (current.isEmpty()) {
        return Optional.empty();
      }
      AgentTask updated = update.applyTo(current.get(), Instant.now().truncatedTo(ChronoUnit.MILLIS));
      writeRow(conn, updated);
      return Optional.of(updated);
    });
  }

  private Optional<AgentTask> lockRow(Connection conn, String taskId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE task_id=? FOR UPDATE";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, taskId).stream().findFirst();
  }

  private void writeRow(Connection conn, AgentTask task) {
    String sql = "UPDATE " + tableName()
        + " SET status=?, safety_level=?, require_approval=?, approved=?, rejection_reason=?,"
        + " result=?, error=?, updated_at=? WHERE task_id=?";
    TaskMetadata metadata = task.metadata();
    JdbcTemplate.update(conn, sql,
        task.status().code(),
        metadata.safetyLevel() == null ? null : metadata.safetyLevel().name(),
        metadata.requireUserApproval(), metadata.approved(), metadata.rejectionReason(),
        task.result(), task.error(),
        JdbcTemplate.timestamp(task.updatedAt()), task.taskId());
  }
}
