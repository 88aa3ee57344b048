package fanout;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable entry of the append log: one update for one key.
 *
 * <p>The payload is opaque to the fan-out engine and limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes. It is copied on the way in and on the way
 * out so a record handed to several subscriptions cannot be mutated by any of them.
 *
 * @see RecordId
 * @see RecordWriter
 */
public final class Record {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

  private final String key;
  private final RecordId id;
  private final byte[] payload;

  public Record(String key, RecordId id, byte[] payload) {
    this.key = requireKey(key);
    this.id = Objects.requireNonNull(id, "id");
    Objects.requireNonNull(payload, "payload");
    if (payload.length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException(
          "payload exceeds " + MAX_PAYLOAD_BYTES + " bytes: " + payload.length);
    }
    this.payload = payload.clone();
  }

  /**
   * Validates a stream key: non-null, non-blank, at most 255 characters.
   *
   * @param key the key to check
   * @return the key
   */
  public static String requireKey(String key) {
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key cannot be blank");
    }
    if (key.length() > 255) {
      throw new IllegalArgumentException("key exceeds 255 characters: " + key.length());
    }
    return key;
  }

  public String key() {
    return key;
  }

  public RecordId id() {
    return id;
  }

  public byte[] payload() {
    return payload.clone();
  }

  /** Payload decoded as UTF-8. */
  public String payloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  public int payloadSize() {
    return payload.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Record other)) return false;
    return key.equals(other.key) && id.equals(other.id) && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * key.hashCode() + id.hashCode()) + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "Record{key=" + key + ", id=" + id + ", payloadSize=" + payload.length + "}";
  }
}
