package com.gruelbox.retry;

/**
 * Retries a blocking operation on the calling thread, threading a context from each attempt to the
 * next. Useful where an operation must take ownership of something (a connection, a buffer) and
 * hand it back whether or not it succeeds.
 *
 * @param <C> The context type.
 * @param <T> The result type.
 */
public final class BlockingContextRetry<C, T>
    extends AbstractBlockingRetry<BlockingContextRetry<C, T>> {

  private final C initialContext;
  private final ContextualOperation<C, T> operation;

  BlockingContextRetry(C initialContext, ContextualOperation<C, T> operation) {
    this.initialContext = initialContext;
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
   * @return The last attempt, with the context it returned. Never throws the operation's errors;
   *     use {@link Attempt#get()} to discard the context and surface them.
   * @throws IllegalArgumentException If the driver is misconfigured. Thrown before any attempt.
   */
  public Attempt<C, T> call() {
    return run(initialContext, operation);
  }
}
