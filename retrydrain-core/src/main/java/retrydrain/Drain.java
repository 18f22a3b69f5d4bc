package retrydrain;

/**
 * Destination that accepts log records: a file, a socket, the console, or another drain.
 *
 * <p>Implementations report a failed delivery by throwing. Throw a
 * {@link TransientDrainException} when the same record may succeed if submitted again
 * (temporary I/O contention, a dropped connection) and a {@link FatalDrainException}
 * when retrying cannot help (malformed record, permanently broken destination).
 * Decorators such as {@link retrydrain.retry.RetryDrain} rely on that distinction.
 *
 * <h2>Delivery contract</h2>
 * <p>A call that throws must not have durably persisted the record. Decorators that
 * re-submit a record assume the destination tolerates receiving it again.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations used from several logging threads must be safe to call
 * concurrently. Wrap a drain that is not with {@link Drains#synchronizedDrain(Drain)}.
 *
 * @see Drains
 * @see retrydrain.retry.RetryDrain
 */
public interface Drain extends AutoCloseable {

  /**
   * Delivers one record to the destination.
   *
   * @param record the record to deliver, borrowed for the duration of the call
   * @throws DrainException if the record was not delivered
   */
  void emit(LogRecord record) throws DrainException;

  /**
   * Completes destination-level buffering. Defaults to a no-op.
   *
   * @throws DrainException if buffered records could not be written
   */
  default void flush() throws DrainException {
  }

  /**
   * Releases the destination. Defaults to a no-op.
   *
   * @throws DrainException if the destination failed to shut down cleanly
   */
  @Override
  default void close() throws DrainException {
  }
}
