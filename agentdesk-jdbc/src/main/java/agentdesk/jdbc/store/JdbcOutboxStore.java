package agentdesk.jdbc.store;

import agentdesk.OutboxMessage;
import agentdesk.jdbc.ConnectionProvider;
import agentdesk.jdbc.JdbcTemplate;
import agentdesk.jdbc.TableNames;
import agentdesk.model.OutboxItem;
import agentdesk.spi.OutboxStore;
import agentdesk.util.JsonCodec;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link OutboxStore}.
 *
 * <p>Recipients and headers are stored as JSON text through a {@link JsonCodec}. Every
 * {@code mark*} statement carries {@code sent=false AND failed=false} in its WHERE
 * clause so a resent or deleted item is never overwritten by a late delivery result.
 */
public final class JdbcOutboxStore extends AbstractJdbcStore implements OutboxStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "id, channel, recipients, subject, body, headers, attempts, "
      + "next_attempt_at, sent, failed, last_error, created_at, last_attempt_at, sent_at";

  private static final String DELIVERABLE = "sent=false AND failed=false";

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<OutboxItem> itemRowMapper;

  public JdbcOutboxStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT_OUTBOX, JsonCodec.getDefault());
  }

  public JdbcOutboxStore(ConnectionProvider connectionProvider, String tableName, JsonCodec jsonCodec) {
    super(connectionProvider, tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.itemRowMapper = rs -> new OutboxItem(
        rs.getString("id"),
        rs.getString("channel"),
        this.jsonCodec.parseArray(rs.getString("recipients")),
        rs.getString("subject"),
        rs.getString("body"),
        this.jsonCodec.parseObject(rs.getString("headers")),
        rs.getInt("attempts"),
        JdbcTemplate.instant(rs, "next_attempt_at"),
        rs.getBoolean("sent"),
        rs.getBoolean("failed"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "last_attempt_at"),
        JdbcTemplate.instant(rs, "sent_at"));
  }

  @Override
  public OutboxItem insert(OutboxMessage message, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    String recipients = jsonCodec.toJsonArray(message.recipients());
    String headers = jsonCodec.toJson(message.headers());
    withConnection("insert outbox item " + message.id(), conn -> JdbcTemplate.update(conn, sql,
        message.id(), message.channel(), recipients, message.subject(), message.body(), headers,
        0, now, false, false, null, now, null, null));
    return new OutboxItem(message.id(), message.channel(), message.recipients(), message.subject(),
        message.body(), message.headers(), 0, now, false, false, null, now, null, null);
  }

  @Override
  public Optional<OutboxItem> find(String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return withConnection("load outbox item " + id,
        conn -> JdbcTemplate.query(conn, sql, itemRowMapper, id).stream().findFirst());
  }

  @Override
  public List<OutboxItem> listAll() {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " ORDER BY created_at, id";
    return withConnection("list outbox items", conn -> JdbcTemplate.query(conn, sql, itemRowMapper));
  }

  @Override
  public List<OutboxItem> pollEligible(Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE " + DELIVERABLE + " AND next_attempt_at <= ? ORDER BY created_at, id LIMIT ?";
    return withConnection("poll outbox items",
        conn -> JdbcTemplate.query(conn, sql, itemRowMapper, now, limit));
  }

  @Override
  public int markSent(String id, Instant at) {
    String sql = "UPDATE " + tableName()
        + " SET sent=true, attempts=attempts+1, last_attempt_at=?, sent_at=?, last_error=NULL"
        + " WHERE id=? AND " + DELIVERABLE;
    return withConnection("mark outbox item " + id + " sent",
        conn -> JdbcTemplate.update(conn, sql, at, at, id));
  }

  @Override
  public int markRetry(String id, Instant at, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName()
        + " SET attempts=attempts+1, last_attempt_at=?, next_attempt_at=?, last_error=?"
        + " WHERE id=? AND " + DELIVERABLE;
    return withConnection("schedule retry of outbox item " + id,
        conn -> JdbcTemplate.update(conn, sql, at, nextAttemptAt, truncate(error), id));
  }

  @Override
  public int markFailed(String id, Instant at, String error) {
    String sql = "UPDATE " + tableName()
        + " SET failed=true, attempts=attempts+1, last_attempt_at=?, last_error=?"
        + " WHERE id=? AND " + DELIVERABLE;
    return withConnection("mark outbox item " + id + " failed",
        conn -> JdbcTemplate.update(conn, sql, at, truncate(error), id));
  }

  @Override
  public int reset(String id, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET sent=false, failed=false, attempts=0, next_attempt_at=?, last_error=NULL, sent_at=NULL"
        + " WHERE id=?";
    return withConnection("reset outbox item " + id, conn -> JdbcTemplate.update(conn, sql, now, id));
  }

  @Override
  public int delete(String id) {
    String sql = "DELETE FROM " + tableName() + " WHERE id=?";
    return withConnection("delete outbox item " + id, conn -> JdbcTemplate.update(conn, sql, id));
  }

  @Override
  public int countPending() {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE " + DELIVERABLE;
    return withConnection("count pending outbox items",
        conn -> JdbcTemplate.query(conn, sql, rs -> rs.getInt(1)).get(0));
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
