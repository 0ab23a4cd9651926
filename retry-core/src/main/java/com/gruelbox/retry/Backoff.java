package com.gruelbox.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * A lazily-evaluated sequence of delays to wait between attempts. The sequence may be deterministic
 * or randomized.
 *
 * <p>Each retry session owns its own instance, created by a {@link BackoffBuilder}, so
 * implementations do not need to be thread safe.
 */
@FunctionalInterface
public interface Backoff {

  /**
   * Returns the next delay to wait before retrying.
   *
   * @return The delay, or empty if the backoff is exhausted. Once exhausted, a backoff must remain
   *     exhausted for the rest of the session.
   */
  Optional<Duration> next();
}
