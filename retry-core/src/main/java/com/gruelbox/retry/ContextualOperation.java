package com.gruelbox.retry;

/**
 * A blocking operation which carries state from one attempt to the next. Each attempt is handed
 * the context returned by the previous attempt (or the initial context, for the first attempt) and
 * must hand it back, possibly updated, alongside its outcome.
 *
 * @param <C> The context type.
 * @param <T> The result type.
 */
@FunctionalInterface
public interface ContextualOperation<C, T> {

  /**
   * Makes one attempt.
   *
   * @param context The context, owned by the operation until it returns.
   * @return The context to pass to the next attempt, along with the outcome of this one. Use {@link
   *     Attempt#success(Object, Object)} or {@link Attempt#failure(Object, Exception)}.
   * @throws Exception Equivalent to returning {@link Attempt#failure(Object, Exception)} with the
   *     unchanged {@code context}.
   */
  Attempt<C, T> apply(C context) throws Exception;
}
