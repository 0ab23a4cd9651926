package com.gruelbox.retry;

import com.gruelbox.retry.spi.RetryConfig;
import com.gruelbox.retry.spi.RetryDecision;

/**
 * Base for drivers which run attempts on the calling thread, waiting between them using a {@link
 * Sleeper}.
 *
 * @param <SELF> The driver type, for chaining.
 */
public abstract class AbstractBlockingRetry<SELF extends AbstractBlockingRetry<SELF>>
    extends AbstractRetry<Sleeper, SELF> {

  @Override
  protected final Sleeper defaultSleeper() {
    return Sleeper.threadSleep();
  }

  /**
   * Runs a session to completion.
   *
   * <p>If the thread is interrupted while waiting to retry, the session ends immediately with the
   * failed attempt as its outcome. The interrupt flag is restored and the {@link
   * InterruptedException} is added to the attempt's error as a suppressed exception.
   *
   * @param initialContext The context passed to the first attempt.
   * @param operation The operation.
   * @return The outcome of the last attempt.
   */
  protected final <C, T> Attempt<C, T> run(C initialContext, ContextualOperation<C, T> operation) {
    RetryConfig<Sleeper> config = newSession();
    C context = initialContext;
    int attempt = 1;
    while (true) {
      Attempt<C, T> outcome = invoke(operation, context);
      if (outcome.isSuccess()) {
        logSucceeded(attempt);
        return outcome;
      }
      RetryDecision decision = config.decide(outcome.getError());
      if (decision.isStop()) {
        logGivingUp(attempt, outcome.getError());
        return outcome;
      }
      logRetrying(attempt, outcome.getError(), decision.getDelay());
      try {
        config.getSleeper().sleep(decision.getDelay());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logInterrupted(attempt);
        outcome.getError().addSuppressed(e);
        return outcome;
      }
      context = outcome.getContext();
      attempt++;
    }
  }

  private static <C, T> Attempt<C, T> invoke(ContextualOperation<C, T> operation, C context) {
    Attempt<C, T> outcome;
    try {
      outcome = operation.apply(context);
    } catch (Exception e) {
      return Attempt.failure(context, e);
    }
    if (outcome == null) {
      throw new IllegalStateException("Operation returned no outcome");
    }
    return outcome;
  }
}
