package agentdesk.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores, validated as plain SQL identifiers because they
 * are concatenated into statements.
 *
 * @param tasks  task table
 * @param audit  audit event table
 * @param outbox outbox item table
 */
public record TableNames(String tasks, String audit, String outbox) {
  public static final String DEFAULT_TASKS = "agent_task";
  public static final String DEFAULT_AUDIT = "agent_audit_event";
  public static final String DEFAULT_OUTBOX = "agent_outbox";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public static final TableNames DEFAULTS = new TableNames(DEFAULT_TASKS, DEFAULT_AUDIT, DEFAULT_OUTBOX);

  public TableNames {
    validate(tasks);
    validate(audit);
    validate(outbox);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
