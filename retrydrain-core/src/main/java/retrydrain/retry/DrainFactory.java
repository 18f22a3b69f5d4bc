package retrydrain.retry;

import retrydrain.Drain;
import retrydrain.DrainException;

/**
 * Opens a fresh destination, for example by connecting a socket to a log collector.
 *
 * @see ReconnectingDrain
 */
@FunctionalInterface
public interface DrainFactory {

  /**
   * @return a new, ready-to-use drain (never null)
   * @throws DrainException if the destination could not be opened
   */
  Drain create() throws DrainException;
}
