package retrydrain.retry;

/**
 * Whether a failed delivery attempt may be retried.
 */
public enum FailureKind {
  /** The same record may succeed if submitted again. */
  TRANSIENT,
  /** Retrying cannot fix the failure. */
  FATAL
}
