package fanout;

import java.util.Objects;

/**
 * Position of a record within its key's sequence: a coarse millisecond timestamp
 * plus a tie-break sequence for records appended within the same millisecond.
 *
 * <p>Ids are totally ordered within a key (timestamp first, then sequence) and are
 * the only ordering authority for delivery. The same type doubles as a read cursor:
 * a cursor is the next id to read, inclusive.
 *
 * <p>The text form is {@code "<timestampMs>-<sequence>"}, e.g. {@code "1718000000000-3"}.
 */
public record RecordId(long timestampMs, int sequence) implements Comparable<RecordId> {

  /** The smallest id; a cursor at {@code ZERO} reads a key from its beginning. */
  public static final RecordId ZERO = new RecordId(0L, 0);

  public RecordId {
    if (timestampMs < 0) {
      throw new IllegalArgumentException("timestampMs must be >= 0, got: " + timestampMs);
    }
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be >= 0, got: " + sequence);
    }
  }

  /**
   * Returns the first id at the given millisecond.
   *
   * @param timestampMs epoch milliseconds
   * @return {@code timestampMs-0}
   */
  public static RecordId ofMillis(long timestampMs) {
    return timestampMs == 0L ? ZERO : new RecordId(timestampMs, 0);
  }

  /**
   * Parses the {@code "<timestampMs>-<sequence>"} form. A bare number is read as
   * a millisecond offset with sequence 0.
   *
   * @param text the id text
   * @return the parsed id
   * @throws IllegalArgumentException if the text is malformed
   */
  public static RecordId parse(String text) {
    Objects.requireNonNull(text, "text");
    int dash = text.indexOf('-');
    try {
      if (dash < 0) {
        return ofMillis(Long.parseLong(text));
      }
      return new RecordId(
          Long.parseLong(text.substring(0, dash)),
          Integer.parseInt(text.substring(dash + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed record id: " + text, e);
    }
  }

  /**
   * Returns the smallest id strictly greater than this one. Used to move a cursor
   * past a delivered record.
   */
  public RecordId next() {
    if (sequence == Integer.MAX_VALUE) {
      return new RecordId(timestampMs + 1, 0);
    }
    return new RecordId(timestampMs, sequence + 1);
  }

  public boolean isBefore(RecordId other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(RecordId other) {
    int byTime = Long.compare(timestampMs, other.timestampMs);
    return byTime != 0 ? byTime : Integer.compare(sequence, other.sequence);
  }

  @Override
  public String toString() {
    return timestampMs + "-" + sequence;
  }
}
