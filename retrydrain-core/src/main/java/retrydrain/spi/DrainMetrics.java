package retrydrain.spi;

/**
 * Observability hook for exporting retry counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface DrainMetrics {

  /**
   * No-op instance that discards all metrics.
   */
  DrainMetrics NOOP = new Noop();

  /**
   * Increments the count of records delivered, on any attempt.
   */
  void incrementDelivered();

  /**
   * Increments the count of transient failures that will be retried.
   */
  void incrementRetried();

  /**
   * Increments the count of records rejected with a fatal failure.
   */
  void incrementFatal();

  /**
   * Increments the count of records given up on after the retry budget was spent.
   */
  void incrementExhausted();

  /**
   * Records how many attempts one emit call made before reaching a terminal state.
   *
   * @param attempts attempts made (always at least 1)
   */
  default void recordAttempts(int attempts) {
  }

  /**
   * Records the delay slept before a retry.
   *
   * @param delayMs delay in milliseconds (always non-negative)
   */
  default void recordRetryDelayMs(long delayMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements DrainMetrics {
    @Override
    public void incrementDelivered() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementFatal() {
    }

    @Override
    public void incrementExhausted() {
    }
  }
}
