package com.gruelbox.retry;

import com.gruelbox.retry.spi.RetryConfig;
import com.gruelbox.retry.spi.RetryDecision;
import com.gruelbox.retry.spi.Utils;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base for drivers which run attempts asynchronously, waiting between them using an {@link
 * AsyncSleeper}. No thread is blocked at any point.
 *
 * @param <SELF> The driver type, for chaining.
 */
public abstract class AbstractAsyncRetry<SELF extends AbstractAsyncRetry<SELF>>
    extends AbstractRetry<AsyncSleeper, SELF> {

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
  protected final AsyncSleeper defaultSleeper() {
    return AsyncSleeper.delayedExecutor();
  }

  /**
   * Starts a session.
   *
   * <p>The returned future completes normally with the last attempt, whether it succeeded or not.
   * It completes exceptionally only if one of the hooks throws, if the operation fails with
   * something other than an {@link Exception}, or if it is cancelled. Cancelling it cancels the
   * attempt or wait in progress and prevents any further attempts.
   *
   * @param initialContext The context passed to the first attempt.
   * @param operation The operation.
   * @return The outcome of the last attempt.
   */
  protected final <C, T> CompletableFuture<Attempt<C, T>> start(
      C initialContext, AsyncContextualOperation<C, T> operation) {
    Session<C, T> session = new Session<>(newSession(), operation);
    session.schedule(() -> session.attempt(initialContext, 1));
    return session.result;
  }

  /**
   * Attempts are strictly sequential, but each step may be triggered from a different thread, or
   * synchronously from within the previous step where stages are already complete. Steps are
   * trampolined through {@link #schedule(Runnable)} so the stack stays flat in the latter case.
   */
  private final class Session<C, T> {

    private final RetryConfig<AsyncSleeper> config;
    private final AsyncContextualOperation<C, T> operation;
    private final CompletableFuture<Attempt<C, T>> result = new CompletableFuture<>();
    private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile Runnable next;

    Session(RetryConfig<AsyncSleeper> config, AsyncContextualOperation<C, T> operation) {
      this.config = config;
      this.operation = operation;
      result.whenComplete(
          (r, e) -> {
            if (result.isCancelled()) {
              CompletableFuture<?> pending = inFlight.get();
              if (pending != null) {
                pending.cancel(true);
              }
            }
          });
    }

    void schedule(Runnable step) {
      next = step;
      if (wip.getAndIncrement() != 0) {
        return;
      }
      do {
        Runnable current = next;
        try {
          current.run();
        } catch (Throwable t) {
          result.completeExceptionally(t);
        }
      } while (wip.decrementAndGet() != 0);
    }

    void attempt(C context, int attempt) {
      if (result.isDone()) {
        return;
      }
      CompletableFuture<Attempt<C, T>> stage = invoke(context);
      track(stage);
      stage.whenComplete(
          (outcome, error) -> schedule(() -> onOutcome(context, attempt, outcome, error)));
    }

    private CompletableFuture<Attempt<C, T>> invoke(C context) {
      CompletionStage<Attempt<C, T>> stage;
      try {
        stage = operation.apply(context);
      } catch (Exception e) {
        return CompletableFuture.completedFuture(Attempt.failure(context, e));
      }
      if (stage == null) {
        throw new IllegalStateException("Operation returned no stage");
      }
      return stage.toCompletableFuture();
    }

    private void onOutcome(C context, int attempt, Attempt<C, T> outcome, Throwable error) {
      if (result.isDone()) {
        return;
      }
      if (error != null) {
        Throwable cause = Utils.unwrap(error);
        if (!(cause instanceof Exception)) {
          result.completeExceptionally(cause);
          return;
        }
        outcome = Attempt.failure(context, (Exception) cause);
      } else if (outcome == null) {
        throw new IllegalStateException("Operation completed with no outcome");
      }
      if (outcome.isSuccess()) {
        logSucceeded(attempt);
        result.complete(outcome);
        return;
      }
      RetryDecision decision = config.decide(outcome.getError());
      if (decision.isStop()) {
        logGivingUp(attempt, outcome.getError());
        result.complete(outcome);
        return;
      }
      logRetrying(attempt, outcome.getError(), decision.getDelay());
      CompletionStage<Void> sleeping = config.getSleeper().sleep(decision.getDelay());
      if (sleeping == null) {
        throw new IllegalStateException("Sleeper returned no stage");
      }
      CompletableFuture<Void> sleep = sleeping.toCompletableFuture();
      track(sleep);
      Attempt<C, T> failed = outcome;
      sleep.whenComplete(
          (v, sleepError) -> {
            if (sleepError == null) {
              schedule(() -> attempt(failed.getContext(), attempt + 1));
            } else if (!result.isDone()) {
              logInterrupted(attempt);
              failed.getError().addSuppressed(Utils.unwrap(sleepError));
              result.complete(failed);
            }
          });
    }

    private void track(CompletableFuture<?> stage) {
      inFlight.set(stage);
      if (result.isCancelled()) {
        stage.cancel(true);
      }
    }
  }
}
