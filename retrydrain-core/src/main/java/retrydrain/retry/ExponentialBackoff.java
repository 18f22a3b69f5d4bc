package retrydrain.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff, optionally with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(failedAttempts-1)}, capped at {@code maxDelay}.
 * With jitter enabled the capped delay is multiplied by a random factor in [0.5, 1.5)
 * and capped again.
 */
public final class ExponentialBackoff implements BackoffStrategy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * Creates a backoff without jitter.
   *
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoff(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, false);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      whether to randomize each delay
   */
  public ExponentialBackoff(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (failedAttempts >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (failedAttempts - 1);
      // Saturate instead of overflowing
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (!jitter) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }
}
