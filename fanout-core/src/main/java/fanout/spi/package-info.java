/**
 * Service provider interfaces for plugging in storage and observability.
 *
 * <ul>
 *   <li>{@link fanout.spi.AppendLog} &mdash; durable per-key append log with batched reads</li>
 *   <li>{@link fanout.spi.LogTrimmer} &mdash; retention-based deletion of old records</li>
 *   <li>{@link fanout.spi.MetricsExporter} &mdash; counters and gauges export</li>
 * </ul>
 */
package fanout.spi;
