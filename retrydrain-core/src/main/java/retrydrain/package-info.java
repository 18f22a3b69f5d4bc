/**
 * Root API for retrydrain: log destinations ("drains") and the records they accept.
 *
 * <h2>Core Design</h2>
 * <p>A {@link retrydrain.Drain} accepts one {@link retrydrain.LogRecord} at a time and reports
 * a failed delivery by throwing a {@link retrydrain.DrainException}. Failures are either
 * {@linkplain retrydrain.TransientDrainException transient} or
 * {@linkplain retrydrain.FatalDrainException fatal}. The
 * {@linkplain retrydrain.retry.RetryDrain retry drain} wraps any drain and re-submits the same
 * record after a transient failure, sleeping between attempts, until it succeeds or the
 * attempt budget is spent.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>retrydrain-core</b>: drain contract, retry decorator, policies (ULID for record ids)</li>
 *   <li><b>retrydrain-micrometer</b>: {@linkplain retrydrain.spi.DrainMetrics metrics} bridge</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Drain socket = ...; // any destination
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(3)
 *     .fixedDelay(Duration.ofMillis(200))
 *     .build();
 *
 * try (RetryDrain drain = new RetryDrain(socket, policy)) {
 *     drain.emit(LogRecord.builder(Level.INFO, "Everything is set up")
 *         .field("version", "1.0.0")
 *         .build());
 * }
 * }</pre>
 *
 * @see retrydrain.Drain
 * @see retrydrain.Drains
 * @see retrydrain.retry.RetryDrain
 */
package retrydrain;
