package com.gruelbox.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Overrides the delay the backoff proposes, based on the content of the error. Useful for honouring
 * a retry hint supplied by a remote server, or for stopping immediately on some errors regardless
 * of the remaining backoff.
 *
 * <p>Only consulted once the retryable predicate has accepted the error.
 */
@FunctionalInterface
public interface DelayAdjuster {

  /** Uses the backoff's delay unchanged. */
  DelayAdjuster IDENTITY = (error, candidate) -> candidate;

  /**
   * @param error The failure of the last attempt.
   * @param candidate The delay proposed by the backoff, or empty if the backoff is exhausted.
   * @return The delay to use, or empty to stop retrying and surface {@code error}.
   */
  Optional<Duration> adjust(Exception error, Optional<Duration> candidate);
}
