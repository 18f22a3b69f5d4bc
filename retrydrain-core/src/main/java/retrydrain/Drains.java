package retrydrain;

import retrydrain.retry.DrainFactory;
import retrydrain.retry.ReconnectingDrain;
import retrydrain.retry.RetryDrain;
import retrydrain.retry.RetryPolicy;
import retrydrain.retry.Sleeper;
import retrydrain.spi.DrainMetrics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static factories for composing drains.
 *
 * <pre>{@code
 * Drain drain = Drains.ignoringFailures(
 *     Drains.reconnecting(() -> new SocketDrain("127.0.0.1", 1234),
 *         RetryPolicy.defaultPolicy(), true));
 * }</pre>
 */
public final class Drains {
  private static final Logger logger = Logger.getLogger(Drains.class.getName());

  private Drains() {}

  /**
   * Wraps {@code drain} with bounded retry.
   *
   * @param drain  the drain to deliver to
   * @param policy the retry policy
   * @return the retrying drain
   * @see RetryDrain
   */
  public static RetryDrain retrying(Drain drain, RetryPolicy policy) {
    return new RetryDrain(drain, policy);
  }

  /**
   * Builds a drain that re-opens its destination through {@code factory} after a transient
   * failure and retries under {@code policy}.
   *
   * @param factory    opens the destination
   * @param policy     the retry policy
   * @param connectNow open the destination before returning instead of on the first record
   * @return the retrying drain
   * @throws DrainException if {@code connectNow} is set and the destination could not be opened
   * @see ReconnectingDrain
   */
  public static RetryDrain reconnecting(DrainFactory factory, RetryPolicy policy, boolean connectNow)
      throws DrainException {
    return ReconnectingDrain.retrying(factory, policy, connectNow);
  }

  /**
   * Same as {@link #reconnecting(DrainFactory, RetryPolicy, boolean)}, with the given metrics
   * hook and sleeper applied to both the initial connect and every emit.
   *
   * @throws DrainException if {@code connectNow} is set and the destination could not be opened
   */
  public static RetryDrain reconnecting(DrainFactory factory, RetryPolicy policy, boolean connectNow,
      DrainMetrics metrics, Sleeper sleeper) throws DrainException {
    return ReconnectingDrain.retrying(factory, policy, connectNow, metrics, sleeper);
  }

  /**
   * Serializes every call to {@code drain} through a single lock.
   *
   * @param drain a drain that is not safe to call concurrently
   * @return a thread-safe view of {@code drain}
   */
  public static Drain synchronizedDrain(Drain drain) {
    return new SynchronizedDrain(drain);
  }

  /**
   * Logs and drops records that {@code drain} fails to deliver instead of throwing.
   *
   * <p>This is a caller-side policy for setups where a lost log line is preferable to a
   * failing call site. Failures of {@code close()} still propagate.
   *
   * @param drain the drain whose failures to ignore
   * @return a drain that never throws {@link DrainException} from {@code emit} or {@code flush}
   */
  public static Drain ignoringFailures(Drain drain) {
    return new IgnoringDrain(drain);
  }

  private static final class SynchronizedDrain implements Drain {
    private final Drain delegate;
    private final Object lock = new Object();

    SynchronizedDrain(Drain delegate) {
      this.delegate = Objects.requireNonNull(delegate, "drain");
    }

    @Override
    public void emit(LogRecord record) throws DrainException {
      synchronized (lock) {
        delegate.emit(record);
      }
    }

    @Override
    public void flush() throws DrainException {
      synchronized (lock) {
        delegate.flush();
      }
    }

    @Override
    public void close() throws DrainException {
      synchronized (lock) {
        delegate.close();
      }
    }
  }

  private static final class IgnoringDrain implements Drain {
    private final Drain delegate;

    IgnoringDrain(Drain delegate) {
      this.delegate = Objects.requireNonNull(delegate, "drain");
    }

    @Override
    public void emit(LogRecord record) {
      try {
        delegate.emit(record);
      } catch (DrainException e) {
        logger.log(Level.WARNING, "Dropping record " + record.recordId() + " after failed delivery", e);
      }
    }

    @Override
    public void flush() {
      try {
        delegate.flush();
      } catch (DrainException e) {
        logger.log(Level.WARNING, "Flush failed", e);
      }
    }

    @Override
    public void close() throws DrainException {
      delegate.close();
    }
  }
}
