/**
 * Bounded retry with backoff around drain delivery.
 *
 * <p>{@link retrydrain.retry.RetryDrain} decorates a drain; {@link retrydrain.retry.RetryPolicy}
 * sets the attempt budget, the {@linkplain retrydrain.retry.BackoffStrategy delay} between
 * attempts and the {@linkplain retrydrain.retry.FailureClassifier classification} of failures.
 * {@link retrydrain.retry.ReconnectingDrain} re-opens a destination after it fails.
 *
 * @see retrydrain.retry.RetryDrain
 * @see retrydrain.retry.Retrier
 */
package retrydrain.retry;
