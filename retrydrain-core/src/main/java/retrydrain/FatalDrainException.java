package retrydrain;

/**
 * Delivery failure that retrying cannot fix, such as a malformed record or a
 * permanently misconfigured destination. Never retried.
 */
public class FatalDrainException extends DrainException {

  public FatalDrainException(String message) {
    super(message);
  }

  public FatalDrainException(String message, Throwable cause) {
    super(message, cause);
  }
}
