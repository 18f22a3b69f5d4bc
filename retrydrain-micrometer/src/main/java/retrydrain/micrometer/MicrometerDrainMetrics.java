package retrydrain.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import retrydrain.spi.DrainMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link DrainMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code retrydrain.emit.delivered}: records delivered</li>
 *   <li>{@code retrydrain.emit.retried}: transient failures followed by a retry</li>
 *   <li>{@code retrydrain.emit.fatal}: records rejected with a fatal failure</li>
 *   <li>{@code retrydrain.emit.exhausted}: records given up on</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code retrydrain.emit.attempts}: attempts per emit call</li>
 *   <li>{@code retrydrain.retry.delay.ms}: delay slept before each retry</li>
 * </ul>
 *
 * @see DrainMetrics
 */
public final class MicrometerDrainMetrics implements DrainMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter delivered;
  private final Counter retried;
  private final Counter fatal;
  private final Counter exhausted;
  private final DistributionSummary attempts;
  private final DistributionSummary retryDelay;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "retrydrain"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerDrainMetrics(MeterRegistry registry) {
    this(registry, "retrydrain");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several drains in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "audit.drain"})
   */
  public MicrometerDrainMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.delivered = Counter.builder(namePrefix + ".emit.delivered")
        .description("Records delivered")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".emit.retried")
        .description("Transient failures followed by a retry")
        .register(registry);
    this.fatal = Counter.builder(namePrefix + ".emit.fatal")
        .description("Records rejected with a fatal failure")
        .register(registry);
    this.exhausted = Counter.builder(namePrefix + ".emit.exhausted")
        .description("Records given up on after the retry budget was spent")
        .register(registry);
    this.attempts = DistributionSummary.builder(namePrefix + ".emit.attempts")
        .description("Delivery attempts per record")
        .register(registry);
    this.retryDelay = DistributionSummary.builder(namePrefix + ".retry.delay.ms")
        .description("Delay before a retry")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementFatal() {
    if (closed) return;
    fatal.increment();
  }

  @Override
  public void incrementExhausted() {
    if (closed) return;
    exhausted.increment();
  }

  @Override
  public void recordAttempts(int attempts) {
    if (closed) return;
    this.attempts.record(attempts);
  }

  @Override
  public void recordRetryDelayMs(long delayMs) {
    if (closed) return;
    retryDelay.record(delayMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(delivered, retried, fatal, exhausted, attempts, retryDelay)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
