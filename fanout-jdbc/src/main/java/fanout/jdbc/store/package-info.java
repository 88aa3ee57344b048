/**
 * Dialect-specific SQL for the append log table, discovered via {@link java.util.ServiceLoader}.
 *
 * @see fanout.jdbc.store.JdbcLogStores
 */
package fanout.jdbc.store;
