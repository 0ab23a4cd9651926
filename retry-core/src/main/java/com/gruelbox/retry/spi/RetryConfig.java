package com.gruelbox.retry.spi;

import com.gruelbox.retry.Backoff;
import com.gruelbox.retry.DelayAdjuster;
import com.gruelbox.retry.RetryNotifier;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.Getter;

/**
 * The state of a single retry session: one {@link Backoff} plus the hooks which decide whether and
 * when to retry. Created at the start of each session and discarded at the end. Not thread safe,
 * and never needs to be, since attempts within a session are strictly sequential.
 *
 * @param <S> The type of sleeper used by the driver running the session.
 */
@NotApi
public final class RetryConfig<S> {

  private final Backoff backoff;
  @Getter private final S sleeper;
  private final Predicate<? super Exception> retryable;
  private final RetryNotifier notifier;
  private final DelayAdjuster adjuster;

  public RetryConfig(
      Backoff backoff,
      S sleeper,
      Predicate<? super Exception> retryable,
      RetryNotifier notifier,
      DelayAdjuster adjuster) {
    this.backoff = backoff;
    this.sleeper = sleeper;
    this.retryable = retryable;
    this.notifier = notifier;
    this.adjuster = adjuster;
  }

  /**
   * Decides what to do about a failed attempt. The predicate is checked first; only if it accepts
   * the error is the backoff advanced and the adjuster consulted. The notifier is called only when
   * the decision is to retry, with the exact delay that will be used.
   *
   * <p>Exceptions thrown by any of the hooks propagate unchanged.
   *
   * @param error The failure.
   * @return The decision.
   */
  public RetryDecision decide(Exception error) {
    if (!retryable.test(error)) {
      return RetryDecision.stop();
    }
    Optional<Duration> candidate = backoff.next();
    Optional<Duration> delay = adjuster.adjust(error, candidate);
    if (delay == null || delay.isEmpty()) {
      return RetryDecision.stop();
    }
    notifier.onRetry(error, delay.get());
    return RetryDecision.retryAfter(delay.get());
  }
}
