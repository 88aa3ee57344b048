package fanout;

/**
 * Terminal error of a subscription opened after the engine started shutting down.
 */
public final class AttachAfterShutdownException extends FanoutException {

  public AttachAfterShutdownException(String key) {
    super("Cannot attach to key '" + key + "': fan-out is shut down");
  }
}
