package retrydrain.retry;

import retrydrain.Drain;
import retrydrain.DrainException;
import retrydrain.LogRecord;
import retrydrain.RetriesExhaustedException;
import retrydrain.spi.DrainMetrics;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decorator that re-submits a record to the wrapped drain when delivery fails transiently.
 *
 * <p>Each {@link #emit(LogRecord)} call makes up to {@link RetryPolicy#maxAttempts()}
 * attempts, sleeping between them as the policy's {@link BackoffStrategy} prescribes.
 * The same record instance is passed on every attempt.
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>A fatal failure is rethrown unchanged after one attempt; the backoff is never consulted</li>
 *   <li>When every attempt fails transiently a {@link RetriesExhaustedException} is thrown,
 *       with the last failure as its cause</li>
 * </ul>
 * Records are never dropped silently: every terminal failure reaches the caller.
 *
 * <h2>Execution Model</h2>
 * <p>Emit blocks the calling thread for all attempts and delays. No threads, timers or
 * queues are created. Concurrent callers run independent retry loops against the
 * wrapped drain without any added locking, so the wrapped drain must be thread-safe
 * when shared (see {@link retrydrain.Drains#synchronizedDrain(Drain)}).
 *
 * <p>A failed attempt is assumed not to have persisted the record; the wrapped destination
 * must tolerate re-delivery.
 *
 * <p>{@link #flush()} and {@link #close()} are forwarded to the wrapped drain without retry.
 *
 * @see RetryPolicy
 * @see ReconnectingDrain
 */
public final class RetryDrain implements Drain {
  private final Drain delegate;
  private final Retrier retrier;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Wraps {@code delegate} with the given policy.
   *
   * @param delegate the drain to deliver to
   * @param policy   the retry policy
   */
  public RetryDrain(Drain delegate, RetryPolicy policy) {
    this(builder().drain(delegate).retryPolicy(Objects.requireNonNull(policy, "policy")));
  }

  private RetryDrain(Builder builder) {
    this.delegate = Objects.requireNonNull(builder.delegate, "drain");
    RetryPolicy policy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaultPolicy();
    DrainMetrics metrics = builder.metrics != null ? builder.metrics : DrainMetrics.NOOP;
    Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
    this.retrier = new Retrier(policy, metrics, sleeper);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers {@code record}, retrying transient failures within the policy's budget.
   *
   * @param record the record to deliver
   * @throws RetriesExhaustedException if every attempt failed transiently
   * @throws DrainException            the wrapped drain's fatal failure, unchanged
   */
  @Override
  public void emit(LogRecord record) throws DrainException {
    Objects.requireNonNull(record, "record");
    retrier.run(() -> delegate.emit(record), record.recordId());
  }

  @Override
  public void flush() throws DrainException {
    delegate.flush();
  }

  /**
   * Closes the wrapped drain. Only the first call is forwarded.
   */
  @Override
  public void close() throws DrainException {
    if (closed.compareAndSet(false, true)) {
      delegate.close();
    }
  }

  public RetryPolicy retryPolicy() {
    return retrier.policy();
  }

  /**
   * Returns the wrapped drain.
   *
   * @return the delegate
   */
  public Drain delegate() {
    return delegate;
  }

  /** Builder for {@link RetryDrain}. */
  public static final class Builder {
    private Drain delegate;
    private RetryPolicy retryPolicy;
    private DrainMetrics metrics;
    private Sleeper sleeper;

    private Builder() {}

    /**
     * Sets the drain to deliver to.
     *
     * <p><b>Required.</b>
     *
     * @param drain the wrapped drain
     * @return this builder
     */
    public Builder drain(Drain drain) {
      this.delegate = drain;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#defaultPolicy()}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link DrainMetrics#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(DrainMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how the calling thread waits between attempts.
     *
     * <p>Optional. Defaults to {@link Sleeper#THREAD}.
     *
     * @param sleeper the sleeper
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryDrain build() {
      return new RetryDrain(this);
    }
  }
}
