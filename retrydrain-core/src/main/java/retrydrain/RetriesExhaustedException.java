package retrydrain;

/**
 * Thrown when every attempt permitted by the retry budget failed transiently.
 *
 * <p>The last transient failure is preserved as the {@linkplain #getCause() cause}.
 */
public class RetriesExhaustedException extends DrainException {

  private final int attempts;

  /**
   * @param lastCause the failure reported by the final attempt
   * @param attempts  the number of attempts made (at least 1)
   */
  public RetriesExhaustedException(Throwable lastCause, int attempts) {
    super("Run out of retries after " + attempts + " attempt(s)"
        + (lastCause == null ? "" : ": " + lastCause.getMessage()), lastCause);
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1, got: " + attempts);
    }
    this.attempts = attempts;
  }

  /**
   * Returns how many delivery attempts were made before giving up.
   *
   * @return the attempt count
   */
  public int attempts() {
    return attempts;
  }
}
