package com.gruelbox.retry;

/**
 * Creates a fresh {@link Backoff} for each retry session. Builders may be shared freely between
 * sessions and threads; the {@link Backoff}s they create may not.
 */
@FunctionalInterface
public interface BackoffBuilder {

  /**
   * @return A builder for an exponentially increasing backoff. This is the default used by all
   *     retry drivers.
   */
  static ExponentialBackoffBuilder exponential() {
    return new ExponentialBackoffBuilder();
  }

  /**
   * @return A builder for a backoff which waits the same amount of time between every attempt.
   */
  static ConstantBackoffBuilder constant() {
    return new ConstantBackoffBuilder();
  }

  /**
   * Creates a new backoff, positioned at its first delay.
   *
   * @return The backoff.
   * @throws IllegalArgumentException If the builder is incorrectly configured.
   */
  Backoff build();
}
