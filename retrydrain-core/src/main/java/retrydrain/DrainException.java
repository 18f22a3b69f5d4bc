package retrydrain;

/**
 * Base of the failures a {@link Drain} reports.
 *
 * <ul>
 *   <li>{@link TransientDrainException}: delivery may succeed if retried</li>
 *   <li>{@link FatalDrainException}: retrying cannot fix it</li>
 *   <li>{@link RetriesExhaustedException}: a retrying drain used up its budget</li>
 * </ul>
 *
 * <p>Other subclasses are classified by the configured
 * {@link retrydrain.retry.FailureClassifier}.
 */
public class DrainException extends Exception {

  public DrainException(String message) {
    super(message);
  }

  public DrainException(String message, Throwable cause) {
    super(message, cause);
  }
}
