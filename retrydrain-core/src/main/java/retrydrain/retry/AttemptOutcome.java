package retrydrain.retry;

import java.util.Objects;

/**
 * Result of a single delivery attempt.
 *
 * <ul>
 *   <li>{@link Delivered}: the drain accepted the record</li>
 *   <li>{@link TransientFailure}: the attempt failed and may be retried</li>
 *   <li>{@link FatalFailure}: the attempt failed and must not be retried</li>
 * </ul>
 */
public sealed interface AttemptOutcome
    permits AttemptOutcome.Delivered, AttemptOutcome.TransientFailure, AttemptOutcome.FatalFailure {

  /**
   * Singleton indicating a successful attempt.
   */
  Delivered DELIVERED = new Delivered();

  /**
   * Wraps a failure according to its classification.
   *
   * @param failure    the exception thrown by the attempt
   * @param classifier decides transient versus fatal
   * @return the classified outcome
   * @throws NullPointerException if the classifier returns {@code null}
   */
  static AttemptOutcome classify(Exception failure, FailureClassifier classifier) {
    FailureKind kind = Objects.requireNonNull(classifier.classify(failure),
        "classifier returned null for " + failure);
    return kind == FailureKind.TRANSIENT
        ? new TransientFailure(failure)
        : new FatalFailure(failure);
  }

  /**
   * The record was delivered.
   */
  record Delivered() implements AttemptOutcome {
  }

  /**
   * @param cause the retryable failure (never null)
   */
  record TransientFailure(Exception cause) implements AttemptOutcome {
    public TransientFailure {
      Objects.requireNonNull(cause, "cause");
    }
  }

  /**
   * @param cause the non-retryable failure (never null)
   */
  record FatalFailure(Exception cause) implements AttemptOutcome {
    public FatalFailure {
      Objects.requireNonNull(cause, "cause");
    }
  }
}
