package com.gruelbox.retry;

import static com.gruelbox.retry.spi.Utils.logAtLevel;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Notified each time a failed attempt is about to be retried. Never notified of the final attempt
 * of a session, whether it succeeds or fails.
 */
@FunctionalInterface
public interface RetryNotifier {

  RetryNotifier EMPTY = (error, delay) -> {};

  /**
   * Logs each retry.
   *
   * @param logger The logger to use.
   * @param level The level to log at. The full stack trace of the failure is included.
   * @return The notifier.
   */
  static RetryNotifier logging(Logger logger, Level level) {
    return (error, delay) -> logAtLevel(logger, level, "Retrying after {}", delay, error);
  }

  /**
   * Called after a failed attempt has been judged retryable, immediately before the driver waits.
   * Exceptions thrown from here abort the whole retry session and propagate to the caller.
   *
   * @param error The failure of the attempt which will be retried.
   * @param delay The delay which will be used before the next attempt.
   */
  void onRetry(Exception error, Duration delay);

  /**
   * Chains this notifier with another and returns the result.
   *
   * @param other The other notifier. It will always be called after this one.
   * @return The combined notifier.
   */
  default RetryNotifier andThen(RetryNotifier other) {
    var self = this;
    return (error, delay) -> {
      self.onRetry(error, delay);
      other.onRetry(error, delay);
    };
  }
}
