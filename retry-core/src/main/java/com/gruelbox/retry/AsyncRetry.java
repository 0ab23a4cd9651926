package com.gruelbox.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Retries an asynchronous operation without blocking.
 *
 * <pre>
 * CompletableFuture&lt;Response&gt; response = Retry.async(() -&gt; client.sendAsync(request))
 *     .backoff(BackoffBuilder.exponential().withJitter())
 *     .adjust((e, delay) -&gt; retryAfterHeader(e).or(() -&gt; delay))
 *     .call();
 * </pre>
 *
 * @param <T> The result type.
 */
public final class AsyncRetry<T> extends AbstractAsyncRetry<AsyncRetry<T>> {

  private final AsyncOperation<T> operation;

  AsyncRetry(AsyncOperation<T> operation) {
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
   * @return A future which completes with the first successful result, or exceptionally with the
   *     error from the last attempt, unwrapped. Cancelling it stops the session.
   * @throws IllegalArgumentException If the driver is misconfigured. Thrown before any attempt.
   */
  public CompletableFuture<T> call() {
    CompletableFuture<Attempt<Object, T>> session =
        start(
            null,
            context -> {
              CompletionStage<T> stage = operation.call();
              if (stage == null) {
                return null;
              }
              return stage.thenApply(value -> Attempt.success(context, value));
            });
    return values(session);
  }

  /**
   * Converts a session which completes with its last attempt into one which completes with the
   * value or the error of that attempt. Cancelling the converted future cancels the session.
   */
  static <C, T> CompletableFuture<T> values(CompletableFuture<Attempt<C, T>> session) {
    CompletableFuture<T> result = new CompletableFuture<>();
    session.whenComplete(
        (outcome, error) -> {
          if (error != null) {
            result.completeExceptionally(error);
          } else if (outcome.isSuccess()) {
            result.complete(outcome.getValue());
          } else {
            result.completeExceptionally(outcome.getError());
          }
        });
    result.whenComplete(
        (value, error) -> {
          if (result.isCancelled()) {
            session.cancel(true);
          }
        });
    return result;
  }
}
