package com.gruelbox.retry;

import java.time.Duration;
import java.util.Optional;
import lombok.ToString;

/**
 * Builds backoffs which wait the same amount of time between every attempt.
 *
 * <p>With the defaults, waits 1 second three times and is then exhausted.
 */
@ToString
public final class ConstantBackoffBuilder implements BackoffBuilder, Validatable {

  private Duration delay = Duration.ofSeconds(1);
  private Integer maxTimes = 3;
  private boolean jitter;

  ConstantBackoffBuilder() {}

  /**
   * @param delay The delay between attempts. Defaults to 1 second.
   * @return Builder.
   */
  public ConstantBackoffBuilder delay(Duration delay) {
    this.delay = delay;
    return this;
  }

  /**
   * @param maxTimes How many delays the backoff yields before it is exhausted. Defaults to 3.
   * @return Builder.
   */
  public ConstantBackoffBuilder maxTimes(int maxTimes) {
    this.maxTimes = maxTimes;
    return this;
  }

  /**
   * Makes the backoff unbounded.
   *
   * @return Builder.
   */
  public ConstantBackoffBuilder withoutMaxTimes() {
    this.maxTimes = null;
    return this;
  }

  /**
   * Adds a random amount of up to {@link #delay(Duration)} to each delay.
   *
   * @return Builder.
   */
  public ConstantBackoffBuilder withJitter() {
    this.jitter = true;
    return this;
  }

  @Override
  public void validate(Validator validator) {
    validator.notNegative("delay", delay);
    if (maxTimes != null) {
      validator.min("maxTimes", maxTimes, 0);
    }
  }

  @Override
  public Backoff build() {
    new Validator().validate(this);
    Duration fixed = delay;
    Integer limit = maxTimes;
    boolean randomize = jitter;
    return new Backoff() {
      private int attempts;

      @Override
      public Optional<Duration> next() {
        if (limit != null && attempts >= limit) {
          return Optional.empty();
        }
        attempts++;
        return Optional.of(randomize ? Durations.jitter(fixed) : fixed);
      }
    };
  }
}
