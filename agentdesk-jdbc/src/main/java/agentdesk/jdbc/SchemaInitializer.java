package agentdesk.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Creates the task, audit and outbox tables from the bundled DDL scripts
 * ({@code agentdesk/jdbc/schema-<database>.sql}). Every statement uses
 * {@code IF NOT EXISTS}, so running it against an initialized schema is harmless.
 *
 * <pre>{@code
 * SchemaInitializer.create(dataSource, TableNames.DEFAULTS);
 * }</pre>
 */
public final class SchemaInitializer {
  private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

  /** Databases with a bundled schema script, detected from the JDBC URL. */
  public enum Database {
    H2("jdbc:h2:", "schema-h2.sql"),
    POSTGRESQL("jdbc:postgresql:", "schema-postgresql.sql"),
    MYSQL("jdbc:mysql:", "schema-mysql.sql");

    private final String urlPrefix;
    private final String script;

    Database(String urlPrefix, String script) {
      this.urlPrefix = urlPrefix;
      this.script = script;
    }

    public String script() {
      return script;
    }

    public static Database fromJdbcUrl(String jdbcUrl) {
      if (jdbcUrl == null || jdbcUrl.isEmpty()) {
        throw new IllegalArgumentException("JDBC URL cannot be null or empty");
      }
      String url = jdbcUrl.toLowerCase(Locale.ROOT);
      for (Database db : values()) {
        if (url.startsWith(db.urlPrefix)) {
          return db;
        }
      }
      throw new IllegalArgumentException("No schema script for JDBC URL: " + jdbcUrl);
    }
  }

  private SchemaInitializer() {
  }

  /** Detects the database from the connection metadata and creates the tables. */
  public static void create(DataSource dataSource, TableNames tables) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      create(conn, Database.fromJdbcUrl(conn.getMetaData().getURL()), tables);
    } catch (SQLException e) {
      throw new AgentDeskStoreException("Failed to initialize schema", e);
    }
  }

  public static void create(Connection conn, Database database, TableNames tables) {
    Objects.requireNonNull(tables, "tables");
    List<String> statements = statements(database, tables);
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
    } catch (SQLException e) {
      throw new AgentDeskStoreException("Failed to initialize schema", e);
    }
    logger.info("Initialized " + database + " schema for tables " + tables.tasks() + ", "
        + tables.audit() + ", " + tables.outbox());
  }

  /** The DDL statements for {@code database} with the table names substituted. */
  public static List<String> statements(Database database, TableNames tables) {
    String script = load(database.script())
        .replace("${tasks}", tables.tasks())
        .replace("${audit}", tables.audit())
        .replace("${outbox}", tables.outbox());
    List<String> statements = new ArrayList<>();
    for (String part : script.split(";")) {
      String sql = part.trim();
      if (!sql.isEmpty()) {
        statements.add(sql);
      }
    }
    return statements;
  }

  private static String load(String script) {
    String resource = "agentdesk/jdbc/" + script;
    try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing schema resource: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }
}
