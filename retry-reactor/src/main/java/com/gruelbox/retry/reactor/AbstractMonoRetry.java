package com.gruelbox.retry.reactor;

import com.gruelbox.retry.AbstractRetry;
import com.gruelbox.retry.Attempt;
import com.gruelbox.retry.DelayAdjuster;
import com.gruelbox.retry.Validator;
import com.gruelbox.retry.spi.RetryConfig;
import com.gruelbox.retry.spi.RetryDecision;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/**
 * Base for drivers which retry {@link Mono}s. Nothing happens until the {@link Mono} returned by
 * the driver is subscribed to, and each subscription is an independent retry session. Disposing the
 * subscription cancels the attempt or wait in progress and prevents any further attempts.
 *
 * @param <SELF> The driver type, for chaining.
 */
public abstract class AbstractMonoRetry<SELF extends AbstractMonoRetry<SELF>>
    extends AbstractRetry<ReactorSleeper, SELF> {

  /**
   * @param adjuster Given the chance to change or veto each delay proposed by the backoff, after
   *     the error has been accepted for retry. Defaults to {@link DelayAdjuster#IDENTITY}.
   * @return This driver.
   */
  public SELF adjust(DelayAdjuster adjuster) {
    this.adjuster = adjuster;
    return self();
  }

  @Override
  protected final ReactorSleeper defaultSleeper() {
    return ReactorSleeper.parallel();
  }

  /**
   * Assembles a session. Settings are validated immediately, so misconfiguration is reported
   * before anything is subscribed.
   *
   * @param initialContext The context passed to the first attempt.
   * @param operation The operation.
   * @return Emits the last attempt, whether or not it succeeded. Errors only if a hook fails, or if
   *     the operation fails with something other than an {@link Exception}.
   */
  protected final <C, T> Mono<Attempt<C, T>> session(
      C initialContext, Function<C, Mono<Attempt<C, T>>> operation) {
    new Validator().validate(this);
    return Mono.defer(
        () -> {
          Session<C, T> session = new Session<>(newSession(), initialContext, operation);
          return Mono.defer(session::attempt).repeat().next();
        });
  }

  /**
   * One subscription's worth of state. Each step either emits the final attempt or completes empty
   * once the wait before the next attempt is over, in which case it is resubscribed. The
   * resubscription loop is Reactor's, so attempts and waits which complete immediately do not grow
   * the stack.
   */
  private final class Session<C, T> {

    private final RetryConfig<ReactorSleeper> config;
    private final Function<C, Mono<Attempt<C, T>>> operation;
    private C context;
    private int attempts;

    Session(
        RetryConfig<ReactorSleeper> config,
        C initialContext,
        Function<C, Mono<Attempt<C, T>>> operation) {
      this.config = config;
      this.context = initialContext;
      this.operation = operation;
    }

    Mono<Attempt<C, T>> attempt() {
      int attempt = ++attempts;
      return invoke(operation, context).flatMap(outcome -> onOutcome(attempt, outcome));
    }

    private Mono<Attempt<C, T>> onOutcome(int attempt, Attempt<C, T> outcome) {
      if (outcome.isSuccess()) {
        logSucceeded(attempt);
        return Mono.just(outcome);
      }
      RetryDecision decision = config.decide(outcome.getError());
      if (decision.isStop()) {
        logGivingUp(attempt, outcome.getError());
        return Mono.just(outcome);
      }
      logRetrying(attempt, outcome.getError(), decision.getDelay());
      Mono<Void> sleep = config.getSleeper().sleep(decision.getDelay());
      if (sleep == null) {
        throw new IllegalStateException("Sleeper returned no Mono");
      }
      context = outcome.getContext();
      return sleep
          .then(Mono.<Attempt<C, T>>empty())
          .onErrorResume(
              e -> {
                logInterrupted(attempt);
                outcome.getError().addSuppressed(e);
                return Mono.just(outcome);
              });
    }
  }

  private static <C, T> Mono<Attempt<C, T>> invoke(
      Function<C, Mono<Attempt<C, T>>> operation, C context) {
    Mono<Attempt<C, T>> stage;
    try {
      stage = operation.apply(context);
    } catch (Exception e) {
      return Mono.just(Attempt.failure(context, e));
    }
    if (stage == null) {
      return Mono.error(new IllegalStateException("Operation returned no Mono"));
    }
    return stage
        .onErrorResume(Exception.class, e -> Mono.just(Attempt.failure(context, e)))
        .switchIfEmpty(
            Mono.error(() -> new IllegalStateException("Operation completed with no outcome")));
  }
}
