package com.gruelbox.retry;

/**
 * Entry points for retrying operations. Each method returns a driver which can be configured
 * fluently and then called any number of times; every call is an independent retry session.
 *
 * <pre>
 * Connection connection = Retry.blocking(() -&gt; dataSource.getConnection())
 *     .backoff(BackoffBuilder.constant().delay(Duration.ofMillis(250)).maxTimes(10))
 *     .when(e -&gt; e instanceof SQLTransientException)
 *     .call();
 * </pre>
 */
public final class Retry {

  private Retry() {}

  /**
   * Retries a blocking operation.
   *
   * @param operation The operation.
   * @param <T> The result type.
   * @param <E> The checked exception thrown by the operation, if any.
   * @return The driver.
   */
  public static <T, E extends Exception> BlockingRetry<T, E> blocking(
      ThrowingSupplier<T, E> operation) {
    return new BlockingRetry<>(operation);
  }

  /**
   * Retries a blocking operation, threading a context from attempt to attempt.
   *
   * @param context The context passed to the first attempt.
   * @param operation The operation.
   * @param <C> The context type.
   * @param <T> The result type.
   * @return The driver.
   */
  public static <C, T> BlockingContextRetry<C, T> blockingWithContext(
      C context, ContextualOperation<C, T> operation) {
    return new BlockingContextRetry<>(context, operation);
  }

  /**
   * Retries an asynchronous operation.
   *
   * @param operation The operation.
   * @param <T> The result type.
   * @return The driver.
   */
  public static <T> AsyncRetry<T> async(AsyncOperation<T> operation) {
    return new AsyncRetry<>(operation);
  }

  /**
   * Retries an asynchronous operation, threading a context from attempt to attempt.
   *
   * @param context The context passed to the first attempt.
   * @param operation The operation.
   * @param <C> The context type.
   * @param <T> The result type.
   * @return The driver.
   */
  public static <C, T> AsyncContextRetry<C, T> asyncWithContext(
      C context, AsyncContextualOperation<C, T> operation) {
    return new AsyncContextRetry<>(context, operation);
  }
}
