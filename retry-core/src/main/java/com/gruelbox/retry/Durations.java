package com.gruelbox.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** Saturating arithmetic on delays. */
final class Durations {

  private static final Duration MAX = Duration.ofNanos(Long.MAX_VALUE);

  private Durations() {}

  static Duration multiply(Duration duration, double factor) {
    double nanos = toNanos(duration) * factor;
    if (nanos >= Long.MAX_VALUE) {
      return MAX;
    }
    return Duration.ofNanos((long) nanos);
  }

  static Duration add(Duration one, Duration two) {
    long a = toNanos(one);
    long b = toNanos(two);
    if (a > Long.MAX_VALUE - b) {
      return MAX;
    }
    return Duration.ofNanos(a + b);
  }

  /** Adds a uniformly random amount in {@code [0, duration)}. */
  static Duration jitter(Duration duration) {
    return add(duration, multiply(duration, ThreadLocalRandom.current().nextDouble()));
  }

  private static long toNanos(Duration duration) {
    return duration.compareTo(MAX) >= 0 ? Long.MAX_VALUE : duration.toNanos();
  }
}
