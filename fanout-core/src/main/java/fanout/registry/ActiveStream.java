package fanout.registry;

import fanout.RecordId;

/**
 * Point-in-time view of one key with at least one attached sink, as seen by the
 * puller when it builds its next batched read.
 *
 * @param key    the stream key
 * @param cursor the next id to read for the key (inclusive)
 */
public record ActiveStream(String key, RecordId cursor) {}
