package retrydrain.retry;

import retrydrain.Drain;
import retrydrain.DrainException;
import retrydrain.LogRecord;
import retrydrain.spi.DrainMetrics;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drain that opens its destination through a {@link DrainFactory} on demand and throws it
 * away after a transient failure, so the next attempt starts from a fresh destination.
 *
 * <p>This makes one attempt per call. Wrap it in a {@link RetryDrain} (or use
 * {@link #retrying(DrainFactory, RetryPolicy, boolean)}) to get reconnect-and-retry:
 * every retry then re-opens the destination before re-sending the record.
 *
 * <h2>Failure Handling</h2>
 * <ul>
 *   <li>Factory failures are thrown as-is; nothing is cached, so the next call tries again</li>
 *   <li>A transient emit failure closes and drops the current destination</li>
 *   <li>A fatal emit failure keeps the destination; the record was the problem</li>
 * </ul>
 *
 * <p>All calls are serialized by an internal lock, so the destination itself does not
 * need to be thread-safe.
 */
public final class ReconnectingDrain implements Drain {
  private static final Logger logger = Logger.getLogger(ReconnectingDrain.class.getName());

  private final DrainFactory factory;
  private final FailureClassifier classifier;
  private final ReentrantLock lock = new ReentrantLock();
  private Drain current;

  /**
   * @param factory    opens the destination
   * @param classifier decides which emit failures discard the destination
   */
  public ReconnectingDrain(DrainFactory factory, FailureClassifier classifier) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  /**
   * Builds a retrying drain on top of a reconnecting one.
   *
   * <p>With {@code connectNow} the destination is opened immediately, retried under
   * {@code policy}; the method fails if it cannot be opened within the budget. Otherwise
   * nothing is opened until the first record arrives.
   *
   * @param factory    opens the destination
   * @param policy     retry policy shared by the initial connect and every emit
   * @param connectNow whether to open the destination before returning
   * @return the retrying drain
   * @throws DrainException if {@code connectNow} is set and the destination could not be opened
   */
  public static RetryDrain retrying(DrainFactory factory, RetryPolicy policy, boolean connectNow)
      throws DrainException {
    return retrying(factory, policy, connectNow, DrainMetrics.NOOP, Sleeper.THREAD);
  }

  /**
   * Like {@link #retrying(DrainFactory, RetryPolicy, boolean)}, reporting to {@code metrics}
   * and waiting through {@code sleeper}. Both are used for the initial connect as well as
   * for every emit.
   *
   * @param factory    opens the destination
   * @param policy     retry policy shared by the initial connect and every emit
   * @param connectNow whether to open the destination before returning
   * @param metrics    metrics hook
   * @param sleeper    waits between attempts
   * @return the retrying drain
   * @throws DrainException if {@code connectNow} is set and the destination could not be opened
   */
  public static RetryDrain retrying(DrainFactory factory, RetryPolicy policy, boolean connectNow,
      DrainMetrics metrics, Sleeper sleeper) throws DrainException {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(sleeper, "sleeper");
    ReconnectingDrain reconnecting = new ReconnectingDrain(factory, policy.classifier());
    if (connectNow) {
      new Retrier(policy, metrics, sleeper).run(reconnecting::connect, "connect");
    }
    return RetryDrain.builder()
        .drain(reconnecting)
        .retryPolicy(policy)
        .metrics(metrics)
        .sleeper(sleeper)
        .build();
  }

  /**
   * Opens the destination unless it is already open.
   *
   * @throws DrainException if the factory failed
   */
  public void connect() throws DrainException {
    lock.lock();
    try {
      connected();
    } finally {
      lock.unlock();
    }
  }

  public boolean isConnected() {
    lock.lock();
    try {
      return current != null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void emit(LogRecord record) throws DrainException {
    lock.lock();
    try {
      Drain drain = connected();
      try {
        drain.emit(record);
      } catch (DrainException | RuntimeException e) {
        if (classifier.classify(e) == FailureKind.TRANSIENT) {
          discard();
        }
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flushes the open destination, if any.
   */
  @Override
  public void flush() throws DrainException {
    lock.lock();
    try {
      if (current != null) {
        current.flush();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes and drops the open destination, if any. A later emit opens a new one.
   */
  @Override
  public void close() throws DrainException {
    lock.lock();
    try {
      Drain drain = current;
      current = null;
      if (drain != null) {
        drain.close();
      }
    } finally {
      lock.unlock();
    }
  }

  private Drain connected() throws DrainException {
    if (current == null) {
      current = Objects.requireNonNull(factory.create(), "factory returned null drain");
      logger.fine("Opened destination " + current);
    }
    return current;
  }

  private void discard() {
    Drain drain = current;
    current = null;
    try {
      drain.close();
    } catch (DrainException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close discarded destination " + drain, e);
    }
  }
}
