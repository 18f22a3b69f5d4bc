package retrydrain.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits the same duration before every retry.
 */
public final class FixedBackoff implements BackoffStrategy {
  private final long delayMs;

  public FixedBackoff(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative, got: " + delay);
    }
    this.delayMs = toMillisRoundingUp(delay);
  }

  /** Milliseconds in {@code delay}, with any partial millisecond rounded up. */
  static long toMillisRoundingUp(Duration delay) {
    long millis = delay.toMillis();
    return delay.minusMillis(millis).isZero() ? millis : millis + 1;
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    return failedAttempts <= 0 ? 0L : delayMs;
  }

  @Override
  public String toString() {
    return "FixedBackoff{" + delayMs + "ms}";
  }
}
