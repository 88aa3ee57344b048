/**
 * Micrometer bridge for exporting fan-out metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link fanout.micrometer.MicrometerMetricsExporter} implements the
 * {@link fanout.spi.MetricsExporter} SPI using Micrometer counters, gauges and a timer.
 *
 * @see fanout.micrometer.MicrometerMetricsExporter
 */
package fanout.micrometer;
