package com.gruelbox.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TestSleepers {

  @Test
  void threadSleepSkipsZero() throws InterruptedException {
    long start = System.nanoTime();
    Sleeper.threadSleep().sleep(Duration.ZERO);
    Sleeper.threadSleep().sleep(Duration.ofMillis(-5));
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
  }

  @Test
  void threadSleepWaits() throws InterruptedException {
    long start = System.nanoTime();
    Sleeper.threadSleep().sleep(Duration.ofMillis(20));
    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(20));
  }

  @Test
  void delayedExecutor() throws Exception {
    CompletableFuture<Void> sleep =
        AsyncSleeper.delayedExecutor().sleep(Duration.ofMillis(10)).toCompletableFuture();
    sleep.get(10, TimeUnit.SECONDS);
    assertTrue(AsyncSleeper.delayedExecutor().sleep(Duration.ZERO).toCompletableFuture().isDone());
  }

  @Test
  void scheduledExecutorCancellation() throws Exception {
    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1);
    scheduler.setRemoveOnCancelPolicy(true);
    try {
      CompletableFuture<Void> sleep =
          AsyncSleeper.using(scheduler).sleep(Duration.ofMinutes(10)).toCompletableFuture();
      assertEquals(1, scheduler.getQueue().size());
      sleep.cancel(true);
      assertEquals(0, scheduler.getQueue().size());

      AsyncSleeper.using(scheduler)
          .sleep(Duration.ofMillis(5))
          .toCompletableFuture()
          .get(10, TimeUnit.SECONDS);
    } finally {
      scheduler.shutdownNow();
    }
  }
}
