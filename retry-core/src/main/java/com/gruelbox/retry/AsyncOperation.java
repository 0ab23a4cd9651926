package com.gruelbox.retry;

import java.util.concurrent.CompletionStage;

/**
 * An asynchronous operation retried by {@link AsyncRetry}. A stage which completes exceptionally,
 * or an exception thrown before a stage is returned, counts as a failed attempt.
 *
 * @param <T> The result type.
 */
@FunctionalInterface
public interface AsyncOperation<T> {

  CompletionStage<T> call() throws Exception;
}
