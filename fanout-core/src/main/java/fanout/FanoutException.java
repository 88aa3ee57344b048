package fanout;

/**
 * Base class for errors raised by the fan-out engine.
 *
 * <p>All fan-out errors are unchecked. They surface only to the subscriptions they
 * affect, as the terminal signal of a {@link fanout.attach.StreamSubscription};
 * the puller loop itself never terminates because of one.
 */
public class FanoutException extends RuntimeException {

  public FanoutException(String message) {
    super(message);
  }

  public FanoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
