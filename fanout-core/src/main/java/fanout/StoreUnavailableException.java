package fanout;

/**
 * Terminal error delivered to every subscription of a batch whose read against
 * the append log failed.
 *
 * <p>A failed batched read cannot tell which keys were already delivered, so each
 * affected subscriber is told to reconnect from the last offset it processed.
 */
public final class StoreUnavailableException extends FanoutException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
