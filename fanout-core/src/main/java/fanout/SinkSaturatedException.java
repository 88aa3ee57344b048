package fanout;

/**
 * Terminal error of a subscription whose consumer fell behind by more than the
 * sink capacity while the {@link fanout.sink.OverflowPolicy#DISCONNECT} policy
 * was in effect.
 */
public final class SinkSaturatedException extends FanoutException {
  private final String key;
  private final int capacity;

  public SinkSaturatedException(String key, int capacity) {
    super("Subscriber of key '" + key + "' fell behind by more than " + capacity + " records");
    this.key = key;
    this.capacity = capacity;
  }

  public String key() {
    return key;
  }

  public int capacity() {
    return capacity;
  }
}
