package io.govlog.retry;

/**
 * Blocks the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeper backed by {@link Thread#sleep(long)}.
   */
  Sleeper THREAD = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
