package com.gruelbox.retry;

import java.time.Duration;

/** Blocks the calling thread between attempts of a blocking retry. */
@FunctionalInterface
public interface Sleeper {

  /**
   * @return A sleeper which uses {@link Thread#sleep(long, int)}. This is the default.
   */
  static Sleeper threadSleep() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return;
      }
      long millis = duration.toMillis();
      int nanos = duration.minusMillis(millis).getNano();
      Thread.sleep(millis, nanos);
    };
  }

  /**
   * Waits for the specified time.
   *
   * @param duration The time to wait.
   * @throws InterruptedException If the thread is interrupted while waiting. The retry session will
   *     end, surfacing the last operation error.
   */
  void sleep(Duration duration) throws InterruptedException;
}
