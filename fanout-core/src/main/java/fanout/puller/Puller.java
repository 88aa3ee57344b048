package fanout.puller;

import fanout.Record;
import fanout.RecordId;
import fanout.StoreUnavailableException;
import fanout.registry.ActiveStream;
import fanout.registry.DispatchOutcome;
import fanout.registry.SubscriptionRegistry;
import fanout.spi.AppendLog;
import fanout.spi.MetricsExporter;
import fanout.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded loop that serves every subscribed key from one batched read per cycle.
 *
 * <p>Each cycle:
 * <ol>
 *   <li>takes a {@linkplain SubscriptionRegistry#snapshotActive() snapshot} of the keys
 *       that have at least one sink; with none, the puller goes {@link State#IDLE} and
 *       checks again after {@code idleIntervalMs} without touching the append log;</li>
 *   <li>issues one {@link AppendLog#readBatch} covering all of them;</li>
 *   <li>groups the result by key, orders each group by id and dispatches every record to
 *       the key's current sinks, advancing the key's cursor past each record in turn.</li>
 * </ol>
 *
 * <p>If the read fails, every key of the snapshot is
 * {@linkplain SubscriptionRegistry#fail failed} with a {@link StoreUnavailableException}
 * and the next cycle waits according to the {@link BackoffPolicy}. A cycle that finishes
 * faster than {@code minCycleIntervalMs} waits out the remainder, which bounds the read
 * rate against the append log regardless of event volume.
 *
 * <p>The loop is self-rescheduling: whatever a cycle throws is logged and the next cycle
 * is scheduled anyway. Only {@link #close()} stops it.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see Puller.Builder
 */
public final class Puller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Puller.class.getName());

    private static final Comparator<Record> BY_ID = Comparator.comparing(Record::id);

    private final AppendLog appendLog;
    private final SubscriptionRegistry registry;
    private final BackoffPolicy backoffPolicy;
    private final MetricsExporter metrics;
    private final long minCycleIntervalMs;
    private final long idleIntervalMs;
    private final int maxRecordsPerKey;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private ScheduledExecutorService scheduler;
    private volatile State state = State.IDLE;
    private volatile boolean started;
    private volatile boolean closed;

    /** Whether the puller is waiting for subscribers or serving them. */
    public enum State {
        /** No key has a subscriber. */
        IDLE,
        /** At least one key was read in the most recent cycle. */
        PULLING
    }

    private Puller(Builder builder) {
        this.appendLog = Objects.requireNonNull(builder.appendLog, "appendLog");
        this.registry = Objects.requireNonNull(builder.registry, "registry");

        if (builder.minCycleIntervalMs < 0L) {
            throw new IllegalArgumentException("minCycleIntervalMs must be >= 0");
        }
        if (builder.idleIntervalMs <= 0L) {
            throw new IllegalArgumentException("idleIntervalMs must be > 0");
        }
        if (builder.maxRecordsPerKey <= 0) {
            throw new IllegalArgumentException("maxRecordsPerKey must be > 0");
        }

        this.minCycleIntervalMs = builder.minCycleIntervalMs;
        this.idleIntervalMs = builder.idleIntervalMs;
        this.maxRecordsPerKey = builder.maxRecordsPerKey;
        this.backoffPolicy = builder.backoffPolicy != null
                ? builder.backoffPolicy : new ExponentialBackoffPolicy(200, 30_000);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the loop on a dedicated daemon thread. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Puller has been closed");
        }
        if (started) {
            return;
        }
        started = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("fanout-puller-"));
        scheduleNext(0L);
    }

    private void runCycle() {
        if (closed) {
            return;
        }
        long delayMs;
        long startedAt = System.nanoTime();
        try {
            PullResult result = pollOnce();
            delayMs = nextDelayMs(result, elapsedMs(startedAt));
        } catch (Throwable t) {
            int failures = consecutiveFailures.incrementAndGet();
            logger.log(Level.SEVERE, "Puller cycle failed", t);
            delayMs = Math.max(backoffPolicy.computeDelayMs(failures), minCycleIntervalMs);
        }
        scheduleNext(delayMs);
    }

    private long nextDelayMs(PullResult result, long elapsedMs) {
        return switch (result.status()) {
            case IDLE -> idleIntervalMs;
            case FAILED -> Math.max(backoffPolicy.computeDelayMs(consecutiveFailures.get()), minCycleIntervalMs);
            case PULLED -> Math.max(0L, minCycleIntervalMs - elapsedMs);
        };
    }

    private void scheduleNext(long delayMs) {
        if (closed) {
            return;
        }
        try {
            scheduler.schedule(this::runCycle, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            if (!closed) {
                logger.log(Level.SEVERE, "Puller scheduler rejected next cycle", e);
            }
        }
    }

    /**
     * Executes a single read-and-dispatch cycle. Called by the loop, but may also be
     * invoked directly for testing or manual driving.
     *
     * @return what the cycle did
     */
    public PullResult pollOnce() {
        if (closed) {
            return PullResult.IDLE;
        }
        List<ActiveStream> active = registry.snapshotActive();
        if (active.isEmpty()) {
            state = State.IDLE;
            metrics.recordActive(0, 0);
            return PullResult.IDLE;
        }
        state = State.PULLING;

        Map<String, RecordId> cursors = new LinkedHashMap<>();
        for (ActiveStream stream : active) {
            cursors.put(stream.key(), stream.cursor());
        }

        List<Record> records;
        long readStart = System.nanoTime();
        try {
            metrics.incrementBatchReads();
            records = appendLog.readBatch(cursors, maxRecordsPerKey);
        } catch (RuntimeException e) {
            failBatch(active, e);
            return PullResult.failed(active.size());
        }
        consecutiveFailures.set(0);
        metrics.recordReadLatencyMs(elapsedMs(readStart));

        long deliveries = dispatchAll(cursors, records);
        metrics.recordActive(registry.activeKeyCount(), registry.sinkCount());
        return new PullResult(PullResult.Status.PULLED, active.size(), records.size(), deliveries);
    }

    private void failBatch(List<ActiveStream> active, RuntimeException cause) {
        metrics.incrementBatchReadFailures();
        int failures = consecutiveFailures.incrementAndGet();
        logger.log(Level.WARNING, "Batched read of " + active.size() + " keys failed ("
                + failures + " in a row); failing their subscribers", cause);
        StoreUnavailableException error = new StoreUnavailableException(
                "Append log read failed; reopen from the last processed offset", cause);
        for (ActiveStream stream : active) {
            registry.fail(stream.key(), error);
        }
    }

    private long dispatchAll(Map<String, RecordId> cursors, List<Record> records) {
        if (records.isEmpty()) {
            return 0L;
        }
        Map<String, List<Record>> byKey = new LinkedHashMap<>();
        for (Record record : records) {
            byKey.computeIfAbsent(record.key(), ignored -> new ArrayList<>()).add(record);
        }

        long deliveries = 0L;
        for (Map.Entry<String, List<Record>> entry : byKey.entrySet()) {
            String key = entry.getKey();
            RecordId readFrom = cursors.get(key);
            if (readFrom == null) {
                logger.log(Level.WARNING, "Append log returned records for unrequested key {0}", key);
                continue;
            }
            List<Record> group = entry.getValue();
            group.sort(BY_ID);
            deliveries += dispatchKey(key, readFrom, group);
        }
        metrics.incrementRecordsDispatched(deliveries);
        return deliveries;
    }

    /**
     * Dispatches one key's records in id order, advancing the cursor past each record
     * once every sink present has been offered it. A sink attaching mid-group therefore
     * receives every record at or after the cursor it inherits.
     *
     * <p>Stops at the first record where the key's cursor is not where this cycle left
     * it: the handle was dropped or re-created with another offset, and its next cycle
     * reads from its own cursor.
     */
    private long dispatchKey(String key, RecordId readFrom, List<Record> group) {
        long deliveries = 0L;
        RecordId expected = readFrom;
        for (Record record : group) {
            if (!expected.equals(registry.cursor(key))) {
                break;
            }
            DispatchOutcome outcome = registry.dispatch(key, record);
            deliveries += outcome.delivered();
            for (int i = 0; i < outcome.saturated(); i++) {
                metrics.incrementSinksSaturated();
            }
            expected = record.id().next();
            registry.advance(key, expected);
        }
        return deliveries;
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    public State state() {
        return state;
    }

    /** Number of failed cycles since the last successful read. */
    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean isRunning() {
        return started && !closed;
    }

    /**
     * Stops the loop and shuts down the puller thread. An in-flight read is interrupted.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warning("Puller thread did not stop within 5 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link Puller}.
     */
    public static final class Builder {
        private AppendLog appendLog;
        private SubscriptionRegistry registry;
        private BackoffPolicy backoffPolicy;
        private MetricsExporter metrics;
        private long minCycleIntervalMs = 50;
        private long idleIntervalMs = 100;
        private int maxRecordsPerKey = 100;

        private Builder() {
        }

        /**
         * Sets the append log read on every cycle.
         *
         * <p><b>Required.</b>
         *
         * @param appendLog the append log
         * @return this builder
         */
        public Builder appendLog(AppendLog appendLog) {
            this.appendLog = appendLog;
            return this;
        }

        /**
         * Sets the registry whose active keys are served.
         *
         * <p><b>Required.</b>
         *
         * @param registry the subscription registry
         * @return this builder
         */
        public Builder registry(SubscriptionRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the backoff applied after failed reads.
         *
         * <p>Optional. Defaults to exponential backoff from 200 ms up to 30 s.
         *
         * @param backoffPolicy the backoff policy
         * @return this builder
         */
        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the minimum time between the starts of two reads.
         *
         * <p>Optional. Defaults to {@code 50} ms. Must be &ge; 0.
         *
         * @param minCycleIntervalMs minimum cycle interval in milliseconds
         * @return this builder
         */
        public Builder minCycleIntervalMs(long minCycleIntervalMs) {
            this.minCycleIntervalMs = minCycleIntervalMs;
            return this;
        }

        /**
         * Sets how long the puller waits before re-checking an empty registry.
         *
         * <p>Optional. Defaults to {@code 100} ms. Must be &gt; 0.
         *
         * @param idleIntervalMs idle wait in milliseconds
         * @return this builder
         */
        public Builder idleIntervalMs(long idleIntervalMs) {
            this.idleIntervalMs = idleIntervalMs;
            return this;
        }

        /**
         * Sets the maximum number of records read per key per cycle.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param maxRecordsPerKey per-key read limit
         * @return this builder
         */
        public Builder maxRecordsPerKey(int maxRecordsPerKey) {
            this.maxRecordsPerKey = maxRecordsPerKey;
            return this;
        }

        public Puller build() {
            return new Puller(this);
        }
    }
}
