/**
 * JDBC plumbing shared by the stores: {@link agentdesk.jdbc.ConnectionProvider},
 * {@link agentdesk.jdbc.JdbcTemplate}, validated {@link agentdesk.jdbc.TableNames} and the
 * bundled DDL run by {@link agentdesk.jdbc.SchemaInitializer}.
 *
 * <p>Statements use only portable SQL ({@code LIMIT}, {@code FOR UPDATE}) and run
 * unchanged on H2, PostgreSQL and MySQL.
 *
 * @see agentdesk.jdbc.store
 */
package agentdesk.jdbc;
