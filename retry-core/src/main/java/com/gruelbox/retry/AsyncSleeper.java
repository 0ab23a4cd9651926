package com.gruelbox.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Waits between attempts of an asynchronous retry without blocking a thread. */
@FunctionalInterface
public interface AsyncSleeper {

  /**
   * @return A sleeper which completes using {@link CompletableFuture#delayedExecutor(long,
   *     TimeUnit)} (and thus the common fork-join pool). This is the default.
   */
  static AsyncSleeper delayedExecutor() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return CompletableFuture.completedFuture(null);
      }
      return CompletableFuture.runAsync(
          () -> {}, CompletableFuture.delayedExecutor(duration.toNanos(), TimeUnit.NANOSECONDS));
    };
  }

  /**
   * Completes sleeps using a scheduler you control. Cancelling the returned stage cancels the
   * scheduled task.
   *
   * @param scheduler The scheduler.
   * @return The sleeper.
   */
  static AsyncSleeper using(ScheduledExecutorService scheduler) {
    return duration -> {
      CompletableFuture<Void> result = new CompletableFuture<>();
      var task =
          scheduler.schedule(
              () -> result.complete(null), duration.toNanos(), TimeUnit.NANOSECONDS);
      result.whenComplete(
          (v, e) -> {
            if (result.isCancelled()) {
              task.cancel(false);
            }
          });
      return result;
    };
  }

  /**
   * Starts waiting for the specified time.
   *
   * @param duration The time to wait.
   * @return A stage which completes when the time has elapsed.
   */
  CompletionStage<Void> sleep(Duration duration);
}
