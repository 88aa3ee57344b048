/**
 * JDBC implementations of {@link fanout.spi.LogTrimmer}, one per supported database.
 */
package fanout.jdbc.trim;
