/**
 * JDBC implementation of the append log.
 *
 * <p>{@link fanout.jdbc.JdbcAppendLog} obtains connections from a
 * {@link fanout.jdbc.ConnectionProvider} and delegates SQL to a dialect-specific
 * {@link fanout.jdbc.store.AbstractJdbcLogStore}. JDBC errors surface as
 * {@link fanout.jdbc.AppendLogException}.
 *
 * <h2>Schema</h2>
 * <p>DDL for each database ships as a classpath resource:
 * {@code schema/h2.sql}, {@code schema/mysql.sql}, {@code schema/postgresql.sql}.
 */
package fanout.jdbc;
