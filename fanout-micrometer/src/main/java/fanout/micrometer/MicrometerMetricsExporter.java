package fanout.micrometer;

import fanout.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export
 * to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code fanout.read.batches} &mdash; batched reads issued against the append log</li>
 *   <li>{@code fanout.read.failures} &mdash; batched reads that failed</li>
 *   <li>{@code fanout.records.dispatched} &mdash; records queued into sinks, one per sink</li>
 *   <li>{@code fanout.records.appended} &mdash; records appended through the writer</li>
 *   <li>{@code fanout.sinks.saturated} &mdash; subscribers disconnected for falling behind</li>
 *   <li>{@code fanout.attach} &mdash; subscriptions opened</li>
 *   <li>{@code fanout.detach} &mdash; subscriptions detached, for any reason</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code fanout.keys.active} &mdash; keys with at least one subscriber</li>
 *   <li>{@code fanout.sinks.active} &mdash; attached subscribers across all keys</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code fanout.read.latency} &mdash; duration of successful batched reads</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter batchReads;
  private final Counter batchReadFailures;
  private final Counter recordsDispatched;
  private final Counter recordsAppended;
  private final Counter sinksSaturated;
  private final Counter attached;
  private final Counter detached;
  private final Gauge activeKeysGauge;
  private final Gauge activeSinksGauge;
  private final Timer readLatency;

  private final AtomicInteger activeKeys = new AtomicInteger();
  private final AtomicInteger activeSinks = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "fanout"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "fanout");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.fanout"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.batchReads = Counter.builder(namePrefix + ".read.batches")
        .description("Batched reads issued against the append log")
        .register(registry);
    this.batchReadFailures = Counter.builder(namePrefix + ".read.failures")
        .description("Batched reads that failed")
        .register(registry);
    this.recordsDispatched = Counter.builder(namePrefix + ".records.dispatched")
        .description("Records queued into sinks, one per sink")
        .register(registry);
    this.recordsAppended = Counter.builder(namePrefix + ".records.appended")
        .description("Records appended through the writer")
        .register(registry);
    this.sinksSaturated = Counter.builder(namePrefix + ".sinks.saturated")
        .description("Subscribers disconnected for falling behind")
        .register(registry);
    this.attached = Counter.builder(namePrefix + ".attach")
        .description("Subscriptions opened")
        .register(registry);
    this.detached = Counter.builder(namePrefix + ".detach")
        .description("Subscriptions detached")
        .register(registry);

    this.activeKeysGauge = Gauge.builder(namePrefix + ".keys.active", activeKeys, AtomicInteger::get)
        .register(registry);
    this.activeSinksGauge = Gauge.builder(namePrefix + ".sinks.active", activeSinks, AtomicInteger::get)
        .register(registry);
    this.readLatency = Timer.builder(namePrefix + ".read.latency")
        .description("Duration of successful batched reads")
        .register(registry);
  }

  @Override
  public void incrementBatchReads() {
    if (closed) return;
    batchReads.increment();
  }

  @Override
  public void incrementBatchReadFailures() {
    if (closed) return;
    batchReadFailures.increment();
  }

  @Override
  public void incrementRecordsDispatched(long deliveries) {
    if (closed || deliveries <= 0) return;
    recordsDispatched.increment(deliveries);
  }

  @Override
  public void incrementSinksSaturated() {
    if (closed) return;
    sinksSaturated.increment();
  }

  @Override
  public void incrementAttached() {
    if (closed) return;
    attached.increment();
  }

  @Override
  public void incrementDetached() {
    if (closed) return;
    detached.increment();
  }

  @Override
  public void recordActive(int activeKeys, int sinks) {
    if (closed) return;
    this.activeKeys.set(activeKeys);
    this.activeSinks.set(sinks);
  }

  @Override
  public void recordReadLatencyMs(long latencyMs) {
    if (closed) return;
    readLatency.record(latencyMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementRecordsAppended(int count) {
    if (closed || count <= 0) return;
    recordsAppended.increment(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link fanout.Fanout} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(batchReads, batchReadFailures, recordsDispatched,
        recordsAppended, sinksSaturated, attached, detached,
        activeKeysGauge, activeSinksGauge, readLatency)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
