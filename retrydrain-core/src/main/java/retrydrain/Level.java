package retrydrain;

/**
 * Severity of a {@link LogRecord}, from least to most severe.
 */
public enum Level {
  TRACE,
  DEBUG,
  INFO,
  WARN,
  ERROR,
  CRITICAL;

  /**
   * Returns {@code true} if this level is at least as severe as {@code other}.
   *
   * @param other the level to compare against
   * @return whether this level is at or above {@code other}
   */
  public boolean isAtLeast(Level other) {
    return compareTo(other) >= 0;
  }
}
