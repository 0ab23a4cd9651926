package com.gruelbox.retry.reactor;

import com.gruelbox.retry.Attempt;
import com.gruelbox.retry.Validator;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/**
 * Retries a {@link Mono}, threading a context from each attempt to the next.
 *
 * @param <C> The context type.
 * @param <T> The result type.
 */
public final class MonoContextRetry<C, T> extends AbstractMonoRetry<MonoContextRetry<C, T>> {

  private final C initialContext;
  private final Function<C, Mono<Attempt<C, T>>> operation;

  MonoContextRetry(C initialContext, Function<C, Mono<Attempt<C, T>>> operation) {
    this.initialContext = initialContext;
    this.operation = operation;
  }

  @Override
  public void validate(Validator validator) {
    super.validate(validator);
    validator.notNull("operation", operation);
  }

  /**
   * @return A {@link Mono} which, for each subscription, runs the operation until it succeeds or a
   *     retry is refused, and emits the last attempt along with the context it returned. Failures
   *     of the operation are reported through the attempt. Every subscription starts from the same
   *     initial context.
   * @throws IllegalArgumentException If the driver is misconfigured.
   */
  public Mono<Attempt<C, T>> toMono() {
    return session(initialContext, operation);
  }
}
