package retrydrain.retry;

import retrydrain.DrainException;
import retrydrain.RetriesExhaustedException;
import retrydrain.spi.DrainMetrics;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one action under a {@link RetryPolicy} on the calling thread.
 *
 * <p>Per call: the action is attempted; success returns, a fatal failure is rethrown as-is,
 * a transient failure is retried after the policy's delay until the attempt budget is spent,
 * at which point a {@link RetriesExhaustedException} carrying the last failure is thrown.
 * The budget and the attempt counter belong to one call; nothing carries over between calls.
 *
 * <p>Delays cannot be cut short. If the thread is interrupted while waiting, the wait is
 * completed, the loop carries on, and the interrupt flag is restored before returning.
 *
 * <p>This class is thread-safe; concurrent calls run independent loops.
 *
 * @see RetryDrain
 */
public final class Retrier {
  private static final Logger logger = Logger.getLogger(Retrier.class.getName());

  private final RetryPolicy policy;
  private final DrainMetrics metrics;
  private final Sleeper sleeper;

  public Retrier(RetryPolicy policy) {
    this(policy, DrainMetrics.NOOP, Sleeper.THREAD);
  }

  public Retrier(RetryPolicy policy, DrainMetrics metrics, Sleeper sleeper) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Runs {@code action} until it succeeds, fails fatally, or exhausts the budget.
   *
   * @param action  the attempt to make, possibly several times
   * @param subject what is being attempted, for log messages
   * @throws DrainException            the fatal failure, unchanged
   * @throws RetriesExhaustedException if every permitted attempt failed transiently
   * @throws RuntimeException          an unchecked fatal failure, unchanged
   */
  public void run(Attempt action, String subject) throws DrainException {
    Objects.requireNonNull(action, "action");
    boolean interrupted = false;
    try {
      int attempt = 1;
      while (true) {
        AttemptOutcome outcome = attemptOnce(action);

        if (outcome instanceof AttemptOutcome.Delivered) {
          metrics.incrementDelivered();
          metrics.recordAttempts(attempt);
          return;
        }

        if (outcome instanceof AttemptOutcome.FatalFailure fatal) {
          metrics.incrementFatal();
          metrics.recordAttempts(attempt);
          throw rethrow(fatal.cause());
        }

        Exception cause = ((AttemptOutcome.TransientFailure) outcome).cause();
        if (attempt >= policy.maxAttempts()) {
          metrics.incrementExhausted();
          metrics.recordAttempts(attempt);
          logger.log(Level.WARNING, "Giving up on " + subject + " after " + attempt + " attempt(s)", cause);
          throw new RetriesExhaustedException(cause, attempt);
        }

        long delayMs = policy.delayAfterMs(attempt);
        metrics.incrementRetried();
        metrics.recordRetryDelayMs(delayMs);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Attempt " + attempt + "/" + policy.maxAttempts() + " for " + subject
              + " failed (" + cause + "); retrying in " + delayMs + "ms");
        }
        interrupted |= sleepUninterruptibly(delayMs);
        attempt++;
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private AttemptOutcome attemptOnce(Attempt action) {
    try {
      action.run();
      return AttemptOutcome.DELIVERED;
    } catch (DrainException | RuntimeException e) {
      return policy.classify(e);
    }
  }

  private boolean sleepUninterruptibly(long delayMs) {
    if (delayMs <= 0) {
      return false;
    }
    boolean interrupted = false;
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
    long remainingMs = delayMs;
    while (true) {
      try {
        sleeper.sleep(remainingMs);
        return interrupted;
      } catch (InterruptedException e) {
        interrupted = true;
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
          return true;
        }
        // Round up so a sub-millisecond remainder is still waited out
        remainingMs = TimeUnit.NANOSECONDS.toMillis(remainingNanos + TimeUnit.MILLISECONDS.toNanos(1) - 1);
      }
    }
  }

  private static DrainException rethrow(Exception failure) {
    if (failure instanceof DrainException drainException) {
      return drainException;
    }
    throw (RuntimeException) failure;
  }

  /**
   * One attempt of a retried action.
   */
  @FunctionalInterface
  public interface Attempt {
    void run() throws DrainException;
  }
}
