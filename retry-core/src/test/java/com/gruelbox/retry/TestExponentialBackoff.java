package com.gruelbox.retry;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TestExponentialBackoff {

  @Test
  void defaults() {
    assertThat(
        drain(BackoffBuilder.exponential().build()),
        contains(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));
  }

  @Test
  void exhaustionIsPermanent() {
    Backoff backoff = BackoffBuilder.exponential().maxTimes(1).build();
    assertEquals(Optional.of(Duration.ofSeconds(1)), backoff.next());
    assertEquals(Optional.empty(), backoff.next());
    assertEquals(Optional.empty(), backoff.next());
  }

  @Test
  void cappedAtMaxDelay() {
    Backoff backoff =
        BackoffBuilder.exponential()
            .minDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(350))
            .factor(2)
            .maxTimes(5)
            .build();
    assertThat(
        drain(backoff),
        contains(
            Duration.ofMillis(100),
            Duration.ofMillis(200),
            Duration.ofMillis(350),
            Duration.ofMillis(350),
            Duration.ofMillis(350)));
  }

  @Test
  void unbounded() {
    Backoff backoff =
        BackoffBuilder.exponential()
            .minDelay(Duration.ofMillis(1))
            .withoutMaxDelay()
            .withoutMaxTimes()
            .build();
    Duration last = Duration.ZERO;
    for (int i = 0; i < 200; i++) {
      Optional<Duration> next = backoff.next();
      assertTrue(next.isPresent());
      assertThat(next.get(), greaterThanOrEqualTo(last));
      last = next.get();
    }
  }

  @Test
  void zeroMaxTimesIsExhaustedImmediately() {
    assertEquals(Optional.empty(), BackoffBuilder.exponential().maxTimes(0).build().next());
  }

  @Test
  void totalDelay() {
    Backoff backoff =
        BackoffBuilder.exponential()
            .minDelay(Duration.ofSeconds(1))
            .withoutMaxTimes()
            .totalDelay(Duration.ofSeconds(10))
            .build();
    assertThat(
        drain(backoff),
        contains(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));
  }

  @Test
  void jitterAddsUpToOneDelay() {
    Backoff backoff =
        BackoffBuilder.exponential()
            .minDelay(Duration.ofMillis(100))
            .factor(1)
            .maxTimes(50)
            .withJitter()
            .build();
    for (Duration delay : drain(backoff)) {
      assertThat(delay, greaterThanOrEqualTo(Duration.ofMillis(100)));
      assertThat(delay, lessThan(Duration.ofMillis(200)));
    }
  }

  @Test
  void invalidSettings() {
    var factor =
        assertThrows(
            IllegalArgumentException.class,
            () -> BackoffBuilder.exponential().factor(0.5).build());
    assertEquals(
        "ExponentialBackoffBuilder.factor must be greater than or equal to 1.0",
        factor.getMessage());
    assertThrows(
        IllegalArgumentException.class,
        () -> BackoffBuilder.exponential().minDelay(Duration.ofMillis(-1)).build());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            BackoffBuilder.exponential()
                .minDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(5))
                .build());
    assertThrows(
        IllegalArgumentException.class, () -> BackoffBuilder.exponential().maxTimes(-1).build());
  }

  static List<Duration> drain(Backoff backoff) {
    List<Duration> result = new ArrayList<>();
    for (Optional<Duration> next = backoff.next(); next.isPresent(); next = backoff.next()) {
      result.add(next.get());
    }
    return result;
  }
}
