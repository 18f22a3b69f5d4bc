package retrydrain.retry;

/**
 * Suspends the calling thread between attempts. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeps on the calling thread with {@link Thread#sleep(long)}.
   */
  Sleeper THREAD = Thread::sleep;

  /**
   * @param millis how long to sleep (positive)
   * @throws InterruptedException if the thread was interrupted while sleeping
   */
  void sleep(long millis) throws InterruptedException;
}
