package com.gruelbox.retry.reactor;

import java.time.Duration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/** Waits between attempts made by the {@link reactor.core.publisher.Mono}-based drivers. */
@FunctionalInterface
public interface ReactorSleeper {

  /**
   * @param duration How long to wait.
   * @return Completes, empty, once the time has passed. Cancelling it abandons the wait.
   */
  Mono<Void> sleep(Duration duration);

  /**
   * @return The default sleeper, which times delays using {@link Schedulers#parallel()}.
   */
  static ReactorSleeper parallel() {
    return on(Schedulers.parallel());
  }

  /**
   * @param scheduler The scheduler to time delays on.
   * @return A sleeper using the scheduler.
   */
  static ReactorSleeper on(Scheduler scheduler) {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return Mono.empty();
      }
      return Mono.delay(duration, scheduler).then();
    };
  }
}
