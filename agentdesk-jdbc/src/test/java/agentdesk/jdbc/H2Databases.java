package agentdesk.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.util.UUID;

/** Fresh in-memory H2 databases with the schema already created. */
public final class H2Databases {
  private H2Databases() {
  }

  public static JdbcDataSource create() {
    return create(TableNames.DEFAULTS);
  }

  public static JdbcDataSource create(TableNames tables) {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    SchemaInitializer.create(dataSource, tables);
    return dataSource;
  }
}
