package com.gruelbox.retry;

/** A runnable... that throws. */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Exception;
}
