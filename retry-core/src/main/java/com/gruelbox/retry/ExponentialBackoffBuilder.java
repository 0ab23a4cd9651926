package com.gruelbox.retry;

import java.time.Duration;
import java.util.Optional;
import lombok.ToString;

/**
 * Builds backoffs where the delay grows by a constant factor after every attempt.
 *
 * <p>With the defaults, waits 1s, 2s and 4s and is then exhausted.
 */
@ToString
public final class ExponentialBackoffBuilder implements BackoffBuilder, Validatable {

  private Duration minDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(60);
  private double factor = 2;
  private Integer maxTimes = 3;
  private boolean jitter;
  private Duration totalDelay;

  ExponentialBackoffBuilder() {}

  /**
   * @param minDelay The first delay. Defaults to 1 second.
   * @return Builder.
   */
  public ExponentialBackoffBuilder minDelay(Duration minDelay) {
    this.minDelay = minDelay;
    return this;
  }

  /**
   * @param maxDelay The largest delay the backoff will grow to. Defaults to 60 seconds.
   * @return Builder.
   */
  public ExponentialBackoffBuilder maxDelay(Duration maxDelay) {
    this.maxDelay = maxDelay;
    return this;
  }

  /**
   * Removes the cap on the delay, which will then grow without limit.
   *
   * @return Builder.
   */
  public ExponentialBackoffBuilder withoutMaxDelay() {
    this.maxDelay = null;
    return this;
  }

  /**
   * @param factor The multiplier applied to the delay after each attempt. Must be at least 1.
   *     Defaults to 2.
   * @return Builder.
   */
  public ExponentialBackoffBuilder factor(double factor) {
    this.factor = factor;
    return this;
  }

  /**
   * @param maxTimes How many delays the backoff yields before it is exhausted. Defaults to 3.
   * @return Builder.
   */
  public ExponentialBackoffBuilder maxTimes(int maxTimes) {
    this.maxTimes = maxTimes;
    return this;
  }

  /**
   * Makes the backoff unbounded. Be aware that unless the retryable predicate or the delay
   * adjuster eventually stops the session, an operation that never succeeds will be retried
   * forever.
   *
   * @return Builder.
   */
  public ExponentialBackoffBuilder withoutMaxTimes() {
    this.maxTimes = null;
    return this;
  }

  /**
   * Adds a random amount of up to the current delay to each delay, to spread out retries from
   * many callers failing at the same time.
   *
   * @return Builder.
   */
  public ExponentialBackoffBuilder withJitter() {
    this.jitter = true;
    return this;
  }

  /**
   * @param totalDelay If set, the backoff is exhausted as soon as the next delay would take the sum
   *     of all delays yielded over this value. Defaults to unlimited.
   * @return Builder.
   */
  public ExponentialBackoffBuilder totalDelay(Duration totalDelay) {
    this.totalDelay = totalDelay;
    return this;
  }

  @Override
  public void validate(Validator validator) {
    validator.notNegative("minDelay", minDelay);
    if (maxDelay != null) {
      validator.notNegative("maxDelay", maxDelay);
      validator.isTrue(
          "maxDelay",
          maxDelay.compareTo(minDelay) >= 0,
          "must be at least minDelay (%s) but was %s",
          minDelay,
          maxDelay);
    }
    validator.min("factor", factor, 1.0);
    if (maxTimes != null) {
      validator.min("maxTimes", maxTimes, 0);
    }
    if (totalDelay != null) {
      validator.notNegative("totalDelay", totalDelay);
    }
  }

  @Override
  public Backoff build() {
    new Validator().validate(this);
    return new ExponentialBackoff(minDelay, maxDelay, factor, maxTimes, jitter, totalDelay);
  }

  private static final class ExponentialBackoff implements Backoff {

    private final Duration minDelay;
    private final Duration maxDelay;
    private final double factor;
    private final Integer maxTimes;
    private final boolean jitter;
    private final Duration totalDelay;

    private Duration current;
    private Duration cumulative = Duration.ZERO;
    private int attempts;
    private boolean exhausted;

    ExponentialBackoff(
        Duration minDelay,
        Duration maxDelay,
        double factor,
        Integer maxTimes,
        boolean jitter,
        Duration totalDelay) {
      this.minDelay = minDelay;
      this.maxDelay = maxDelay;
      this.factor = factor;
      this.maxTimes = maxTimes;
      this.jitter = jitter;
      this.totalDelay = totalDelay;
    }

    @Override
    public Optional<Duration> next() {
      if (exhausted || (maxTimes != null && attempts >= maxTimes)) {
        exhausted = true;
        return Optional.empty();
      }
      attempts++;
      if (current == null) {
        current = minDelay;
      } else if (maxDelay == null || current.compareTo(maxDelay) < 0) {
        current = Durations.multiply(current, factor);
      }
      if (maxDelay != null && current.compareTo(maxDelay) > 0) {
        current = maxDelay;
      }
      Duration delay = jitter ? Durations.jitter(current) : current;
      if (totalDelay != null) {
        Duration total = Durations.add(cumulative, delay);
        if (total.compareTo(totalDelay) > 0) {
          exhausted = true;
          return Optional.empty();
        }
        cumulative = total;
      }
      return Optional.of(delay);
    }
  }
}
