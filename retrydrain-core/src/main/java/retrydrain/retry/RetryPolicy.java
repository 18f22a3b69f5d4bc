package retrydrain.retry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of how a failed delivery is retried: the attempt budget, the
 * delay between attempts and which failures count as transient.
 *
 * <p>One policy is shared by every emit call of a {@link RetryDrain}; it holds no
 * per-call state.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .delays(Duration.ofMillis(100), Duration.ofMillis(500), Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 *
 * @see RetryDrain
 * @see BackoffStrategy
 * @see FailureClassifier
 */
public final class RetryPolicy {

  /** Attempt budget of {@link #defaultPolicy()}. */
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  /** Delays of {@link #defaultPolicy()}: one, two, three and four seconds. */
  public static final List<Duration> DEFAULT_DELAYS = List.of(
      Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3), Duration.ofSeconds(4));

  private final int maxAttempts;
  private final BackoffStrategy backoff;
  private final FailureClassifier classifier;

  private RetryPolicy(Builder builder) {
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.maxAttempts = builder.maxAttempts;
    this.backoff = builder.backoff != null
        ? builder.backoff : new DelaySequenceBackoff(DEFAULT_DELAYS);
    this.classifier = Objects.requireNonNull(builder.classifier, "classifier");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Five attempts, waiting 1s, 2s, 3s and 4s between them.
   *
   * @return the default policy
   */
  public static RetryPolicy defaultPolicy() {
    return builder().build();
  }

  /**
   * A single attempt: a transient failure is reported as exhausted straight away.
   *
   * @return a policy that never retries
   */
  public static RetryPolicy noRetry() {
    return builder().maxAttempts(1).build();
  }

  /**
   * @param maxAttempts attempt budget, including the first attempt
   * @param delay       delay before every retry
   * @return a fixed-delay policy
   */
  public static RetryPolicy fixed(int maxAttempts, Duration delay) {
    return builder().maxAttempts(maxAttempts).fixedDelay(delay).build();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public BackoffStrategy backoff() {
    return backoff;
  }

  public FailureClassifier classifier() {
    return classifier;
  }

  /**
   * Returns the delay to wait after the given number of failed attempts.
   *
   * @param failedAttempts attempts failed so far (1-based)
   * @return delay in milliseconds, never negative
   */
  public long delayAfterMs(int failedAttempts) {
    return Math.max(0L, backoff.computeDelayMs(failedAttempts));
  }

  /**
   * Classifies a failure with the configured classifier.
   *
   * @param failure the exception thrown by one attempt
   * @return the classified outcome
   */
  public AttemptOutcome classify(Exception failure) {
    return AttemptOutcome.classify(failure, classifier);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts + ", backoff=" + backoff + '}';
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private BackoffStrategy backoff;
    private FailureClassifier classifier = FailureClassifier.DEFAULT;

    private Builder() {}

    /**
     * Sets the maximum number of delivery attempts per record, including the first.
     *
     * <p>Optional. Defaults to {@value RetryPolicy#DEFAULT_MAX_ATTEMPTS}. Must be &ge; 1.
     *
     * @param maxAttempts the attempt budget
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Waits the same duration before every retry.
     *
     * @param delay the delay (non-negative)
     * @return this builder
     */
    public Builder fixedDelay(Duration delay) {
      this.backoff = new FixedBackoff(delay);
      return this;
    }

    /**
     * Waits the given delays in order; the last one is reused once they run out.
     *
     * @param delays at least one non-negative delay
     * @return this builder
     */
    public Builder delays(Duration... delays) {
      Objects.requireNonNull(delays, "delays");
      return delays(Arrays.asList(delays));
    }

    /**
     * Waits the given delays in order; the last one is reused once they run out.
     *
     * @param delays at least one non-negative delay
     * @return this builder
     */
    public Builder delays(List<Duration> delays) {
      this.backoff = new DelaySequenceBackoff(delays);
      return this;
    }

    /**
     * Sets a custom backoff strategy.
     *
     * <p>Optional. Defaults to the delay sequence {@link RetryPolicy#DEFAULT_DELAYS}.
     *
     * @param backoff the backoff strategy
     * @return this builder
     */
    public Builder backoff(BackoffStrategy backoff) {
      this.backoff = Objects.requireNonNull(backoff, "backoff");
      return this;
    }

    /**
     * Sets how failures are split into transient and fatal.
     *
     * <p>Optional. Defaults to {@link FailureClassifier#DEFAULT}.
     *
     * @param classifier the failure classifier
     * @return this builder
     */
    public Builder classifier(FailureClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
