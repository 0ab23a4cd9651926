package com.gruelbox.retry.acceptance;

import com.gruelbox.retry.Attempt;
import com.gruelbox.retry.ContextualOperation;
import com.gruelbox.retry.RetryDeclaration;
import com.gruelbox.retry.RetryProxies;
import com.gruelbox.retry.ThrowingSupplier;
import com.gruelbox.retry.testing.AbstractRetryAcceptanceTest;
import com.gruelbox.retry.testing.RetryOptions;

/** Retries blocking calls through a JDK proxy of an interface. */
class TestInterfaceProxy extends AbstractRetryAcceptanceTest {

  @Override
  @SuppressWarnings("unchecked")
  protected <T> T retry(RetryOptions options, ThrowingSupplier<T, Exception> operation)
      throws Exception {
    Operation target = operation::get;
    Operation proxy =
        RetryProxies.wrap(
            Operation.class,
            target,
            RetryDeclaration.builder()
                .backoff(options.getBackoff())
                .when(options.getWhen())
                .notifier(options.getNotifier())
                .sleeper(options.getSleeper())
                .build());
    return (T) proxy.run();
  }

  @Override
  protected <T> Attempt<Integer, T> retryWithContext(
      RetryOptions options, Integer initialContext, ContextualOperation<Integer, T> operation) {
    throw new UnsupportedOperationException();
  }

  /** Arguments survive between attempts but can't be replaced, so counters can't be threaded. */
  @Override
  protected boolean supportsContext() {
    return false;
  }

  @Override
  protected boolean supportsAdjust() {
    return false;
  }

  public interface Operation {
    Object run() throws Exception;
  }
}
