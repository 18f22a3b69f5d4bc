package retrydrain.retry;

import retrydrain.FatalDrainException;
import retrydrain.RetriesExhaustedException;
import retrydrain.TransientDrainException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Decides whether a failure reported by a drain is {@linkplain FailureKind#TRANSIENT transient}
 * or {@linkplain FailureKind#FATAL fatal}.
 *
 * <p>The classifier sees every exception the wrapped drain throws: checked
 * {@link retrydrain.DrainException}s and unchecked exceptions alike.
 *
 * @see RetryPolicy.Builder#classifier(FailureClassifier)
 */
@FunctionalInterface
public interface FailureClassifier {

  /**
   * Classifies by exception type.
   *
   * <ul>
   *   <li>{@link TransientDrainException} and {@link RetriesExhaustedException} (a nested
   *       retrying drain gave up on a still-failing destination) are transient</li>
   *   <li>{@link FatalDrainException} is fatal</li>
   *   <li>anything caused by an {@link IOException} or {@link UncheckedIOException} is transient</li>
   *   <li>everything else is fatal</li>
   * </ul>
   */
  FailureClassifier DEFAULT = failure -> {
    if (failure instanceof TransientDrainException || failure instanceof RetriesExhaustedException) {
      return FailureKind.TRANSIENT;
    }
    if (failure instanceof FatalDrainException) {
      return FailureKind.FATAL;
    }
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof IOException || t instanceof UncheckedIOException) {
        return FailureKind.TRANSIENT;
      }
    }
    return FailureKind.FATAL;
  };

  /**
   * Classifier that retries every failure.
   */
  FailureClassifier ALWAYS_TRANSIENT = failure -> FailureKind.TRANSIENT;

  /**
   * @param failure the exception thrown by one delivery attempt
   * @return the failure kind, never {@code null}
   */
  FailureKind classify(Exception failure);
}
