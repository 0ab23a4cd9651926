package com.gruelbox.retry.reactor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.retry.Attempt;
import com.gruelbox.retry.BackoffBuilder;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class TestMonoContextRetry {

  @Test
  void threadsContext() {
    List<Integer> received = new CopyOnWriteArrayList<>();
    StepVerifier.create(
            ReactorRetry.<Integer, String>monoWithContext(
                    0,
                    counter -> {
                      received.add(counter);
                      if (counter < 3) {
                        return Mono.just(Attempt.failure(counter + 1, new IOException("No")));
                      }
                      return Mono.just(Attempt.success(counter + 1, "done"));
                    })
                .backoff(BackoffBuilder.constant().delay(Duration.ZERO))
                .toMono())
        .assertNext(
            attempt -> {
              assertTrue(attempt.isSuccess());
              assertEquals(4, attempt.getContext());
              assertEquals("done", attempt.getValue());
            })
        .verifyComplete();
    assertThat(received, contains(0, 1, 2, 3));
  }

  @Test
  void failedMonoHandsBackUnchangedContext() {
    List<String> received = new CopyOnWriteArrayList<>();
    StepVerifier.create(
            ReactorRetry.<String, String>monoWithContext(
                    "buffer",
                    buffer -> {
                      received.add(buffer);
                      return Mono.error(new IOException("Failed"));
                    })
                .backoff(BackoffBuilder.constant().delay(Duration.ZERO).maxTimes(1))
                .toMono())
        .assertNext(
            attempt -> {
              assertFalse(attempt.isSuccess());
              assertEquals("buffer", attempt.getContext());
              assertEquals("Failed", attempt.getError().getMessage());
            })
        .verifyComplete();
    assertThat(received, contains("buffer", "buffer"));
  }

  @Test
  void emptyOutcomeIsAnError() {
    StepVerifier.create(
            ReactorRetry.<String, String>monoWithContext("context", context -> Mono.empty())
                .toMono())
        .expectError(IllegalStateException.class)
        .verify();
  }

  @Test
  void everySubscriptionStartsFromInitialContext() {
    Mono<Attempt<Integer, Integer>> mono =
        ReactorRetry.<Integer, Integer>monoWithContext(
                10,
                counter -> {
                  if (counter < 12) {
                    return Mono.just(Attempt.failure(counter + 1, new IOException("No")));
                  }
                  return Mono.just(Attempt.success(counter, counter));
                })
            .backoff(BackoffBuilder.constant().delay(Duration.ZERO))
            .toMono();
    StepVerifier.create(mono.map(Attempt::get)).expectNext(12).verifyComplete();
    StepVerifier.create(mono.map(Attempt::get)).expectNext(12).verifyComplete();
  }
}
