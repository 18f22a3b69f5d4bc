package retrydrain;

/**
 * Delivery failure that may succeed if the same record is submitted again.
 *
 * <p>Typical use cases:
 * <ul>
 *   <li>Connection reset or refused by a log collector</li>
 *   <li>Temporary contention on a file or socket buffer</li>
 * </ul>
 */
public class TransientDrainException extends DrainException {

  public TransientDrainException(String message) {
    super(message);
  }

  public TransientDrainException(String message, Throwable cause) {
    super(message, cause);
  }
}
