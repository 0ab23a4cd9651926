package com.gruelbox.retry;

/**
 * Retries a blocking operation on the calling thread.
 *
 * <pre>
 * String body = Retry.blocking(() -&gt; client.fetch(url))
 *     .backoff(BackoffBuilder.exponential().maxTimes(5))
 *     .when(e -&gt; e instanceof IOException)
 *     .call();
 * </pre>
 *
 * @param <T> The result type.
 * @param <E> The checked exception thrown by the operation.
 */
public final class BlockingRetry<T, E extends Exception>
    extends AbstractBlockingRetry<BlockingRetry<T, E>> {

  private final ThrowingSupplier<T, E> operation;

  BlockingRetry(ThrowingSupplier<T, E> operation) {
    this.operation = operation;
  }

  @Override
  public void validate(Validator validator) {
    super.validate(validator);
    validator.notNull("operation", operation);
  }

  /**
   * Runs the operation until it succeeds or a retry is refused.
   *
   * @return The first successful result.
   * @throws E The error from the last attempt, exactly as the operation threw it. Unchecked
   *     exceptions thrown by the operation are surfaced the same way.
   * @throws IllegalArgumentException If the driver is misconfigured. Thrown before any attempt.
   */
  public T call() throws E {
    return run(null, ignored -> Attempt.success(null, operation.get())).get();
  }
}
