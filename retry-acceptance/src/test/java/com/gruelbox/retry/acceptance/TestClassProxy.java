package com.gruelbox.retry.acceptance;

import static com.gruelbox.retry.testing.TestUtils.await;

import com.gruelbox.retry.Attempt;
import com.gruelbox.retry.ContextualOperation;
import com.gruelbox.retry.RetryDeclaration;
import com.gruelbox.retry.RetryProxies;
import com.gruelbox.retry.ThrowingSupplier;
import com.gruelbox.retry.testing.AbstractRetryAcceptanceTest;
import com.gruelbox.retry.testing.RetryOptions;
import java.util.concurrent.CompletableFuture;

/**
 * Retries asynchronous calls through a ByteBuddy proxy of a class with no default constructor,
 * which also needs Objenesis.
 */
class TestClassProxy extends AbstractRetryAcceptanceTest {

  @Override
  @SuppressWarnings("unchecked")
  protected <T> T retry(RetryOptions options, ThrowingSupplier<T, Exception> operation)
      throws Exception {
    AsyncOperations proxy =
        RetryProxies.wrap(
            AsyncOperations.class,
            new AsyncOperations(operation),
            RetryDeclaration.builder()
                .backoff(options.getBackoff())
                .when(options.getWhen())
                .notifier(options.getNotifier())
                .adjust(options.getAdjust())
                .asyncSleeper(options.getSleeper().async())
                .build());
    return (T) await(proxy.run());
  }

  @Override
  protected <T> Attempt<Integer, T> retryWithContext(
      RetryOptions options, Integer initialContext, ContextualOperation<Integer, T> operation) {
    throw new UnsupportedOperationException();
  }

  @Override
  protected boolean supportsContext() {
    return false;
  }

  static class AsyncOperations {

    private final ThrowingSupplier<?, Exception> operation;

    AsyncOperations(ThrowingSupplier<?, Exception> operation) {
      this.operation = operation;
    }

    CompletableFuture<Object> run() {
      return CompletableFuture.supplyAsync(() -> null)
          .thenCompose(
              ignored -> {
                try {
                  return CompletableFuture.<Object>completedFuture(operation.get());
                } catch (Exception e) {
                  return CompletableFuture.<Object>failedFuture(e);
                }
              });
    }
  }
}
