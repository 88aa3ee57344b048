package fanout;

import fanout.spi.AppendLog;
import fanout.spi.MetricsExporter;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Producer path: business code appends one record per key whenever that key's
 * state changes.
 *
 * <p>Writes go straight to the {@link AppendLog}. Nothing here is coupled to the
 * puller; a record becomes visible to subscribers on the puller's next cycle
 * after the append returns.
 *
 * @see AppendLog
 */
public final class RecordWriter {
    private final AppendLog appendLog;
    private final MetricsExporter metrics;

    /**
     * Creates a writer that reports no metrics.
     *
     * @param appendLog the append log to write to
     */
    public RecordWriter(AppendLog appendLog) {
        this(appendLog, MetricsExporter.NOOP);
    }

    /**
     * @param appendLog the append log to write to
     * @param metrics   metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
     */
    public RecordWriter(AppendLog appendLog, MetricsExporter metrics) {
        this.appendLog = Objects.requireNonNull(appendLog, "appendLog");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Appends one record.
     *
     * @param key     the stream key
     * @param payload the payload, at most {@value Record#MAX_PAYLOAD_BYTES} bytes
     * @return the id assigned to the record
     */
    public RecordId append(String key, byte[] payload) {
        Record.requireKey(key);
        requirePayload(payload);
        RecordId id = appendLog.append(key, payload);
        metrics.incrementRecordsAppended(1);
        return id;
    }

    /**
     * Appends one record whose payload is {@code payload} encoded as UTF-8.
     *
     * @param key     the stream key
     * @param payload the text payload
     * @return the id assigned to the record
     */
    public RecordId append(String key, String payload) {
        Objects.requireNonNull(payload, "payload");
        return append(key, payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Appends several records to one key, in order.
     *
     * @param key      the stream key
     * @param payloads the payloads in delivery order
     * @return the assigned ids, in the same order; empty if {@code payloads} is empty
     */
    public List<RecordId> appendAll(String key, List<byte[]> payloads) {
        Record.requireKey(key);
        Objects.requireNonNull(payloads, "payloads");
        if (payloads.isEmpty()) {
            return List.of();
        }
        for (byte[] payload : payloads) {
            requirePayload(payload);
        }
        List<RecordId> ids = appendLog.appendAll(key, payloads);
        metrics.incrementRecordsAppended(ids.size());
        return ids;
    }

    private static void requirePayload(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (payload.length > Record.MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException(
                    "payload exceeds " + Record.MAX_PAYLOAD_BYTES + " bytes: " + payload.length);
        }
    }
}
