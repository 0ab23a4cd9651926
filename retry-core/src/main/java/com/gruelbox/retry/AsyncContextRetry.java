package com.gruelbox.retry;

import java.util.concurrent.CompletableFuture;

/**
 * Retries an asynchronous operation without blocking, threading a context from each attempt to the
 * next.
 *
 * @param <C> The context type.
 * @param <T> The result type.
 */
public final class AsyncContextRetry<C, T> extends AbstractAsyncRetry<AsyncContextRetry<C, T>> {

  private final C initialContext;
  private final AsyncContextualOperation<C, T> operation;

  AsyncContextRetry(C initialContext, AsyncContextualOperation<C, T> operation) {
    this.initialContext = initialContext;
    this.operation = operation;
  }

  @Override
  public void validate(Validator validator) {
    super.validate(validator);
    validator.notNull("operation", operation);
  }

  /**
   * Starts running the operation.
   *
   * @return A future which completes with the last attempt and the context it returned. Failures of
   *     the operation are reported through the attempt, not by completing exceptionally. Cancelling
   *     it stops the session.
   * @throws IllegalArgumentException If the driver is misconfigured. Thrown before any attempt.
   */
  public CompletableFuture<Attempt<C, T>> call() {
    return start(initialContext, operation);
  }
}
