package retrydrain.retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Walks an ordered list of delays, one per retry. Once the list runs out the last
 * delay is reused, so a short list still covers any retry budget.
 *
 * <p>With delays {@code [10ms, 50ms]}: the first retry waits 10ms, every later retry 50ms.
 */
public final class DelaySequenceBackoff implements BackoffStrategy {
  private final long[] delaysMs;

  public DelaySequenceBackoff(List<Duration> delays) {
    Objects.requireNonNull(delays, "delays");
    if (delays.isEmpty()) {
      throw new IllegalArgumentException("delays must not be empty");
    }
    this.delaysMs = new long[delays.size()];
    for (int i = 0; i < delays.size(); i++) {
      Duration delay = Objects.requireNonNull(delays.get(i), "delays must not contain null");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delays must not be negative, got: " + delay);
      }
      delaysMs[i] = FixedBackoff.toMillisRoundingUp(delay);
    }
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    return delaysMs[Math.min(failedAttempts, delaysMs.length) - 1];
  }

  /**
   * Returns how many distinct delays were configured.
   *
   * @return the sequence length
   */
  public int length() {
    return delaysMs.length;
  }
}
