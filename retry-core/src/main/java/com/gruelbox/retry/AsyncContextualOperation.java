package com.gruelbox.retry;

import java.util.concurrent.CompletionStage;

/**
 * The asynchronous equivalent of {@link ContextualOperation}. A stage which completes
 * exceptionally, or an exception thrown before a stage is returned, counts as a failed attempt
 * which hands back the unchanged context.
 *
 * @param <C> The context type.
 * @param <T> The result type.
 */
@FunctionalInterface
public interface AsyncContextualOperation<C, T> {

  CompletionStage<Attempt<C, T>> apply(C context) throws Exception;
}
