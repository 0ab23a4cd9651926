package com.gruelbox.retry.spi;

import java.time.Duration;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/** The verdict on a failed attempt: either stop, or retry after a delay. */
@NotApi
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryDecision {

  private static final RetryDecision STOP = new RetryDecision(null);

  private final Duration delay;

  public static RetryDecision stop() {
    return STOP;
  }

  public static RetryDecision retryAfter(Duration delay) {
    if (delay == null) {
      throw new IllegalArgumentException("delay may not be null");
    }
    return new RetryDecision(delay);
  }

  public boolean isStop() {
    return delay == null;
  }

  /**
   * @return The delay before the next attempt.
   * @throws IllegalStateException If this is a decision to stop.
   */
  public Duration getDelay() {
    if (delay == null) {
      throw new IllegalStateException("No delay for a decision to stop");
    }
    return delay;
  }

  @Override
  public String toString() {
    return isStop() ? "RetryDecision(stop)" : "RetryDecision(retryAfter=" + delay + ")";
  }
}
