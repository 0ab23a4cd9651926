package com.gruelbox.retry.reactor;

import com.gruelbox.retry.Attempt;
import com.gruelbox.retry.Validator;
import com.gruelbox.retry.spi.Utils;
import java.util.function.Supplier;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Retries a {@link Mono}.
 *
 * <pre>
 * Mono&lt;Order&gt; order = ReactorRetry.mono(() -&gt; orders.fetch(orderId))
 *     .when(e -&gt; e instanceof ConnectException)
 *     .toMono();
 * </pre>
 *
 * @param <T> The result type.
 */
public final class MonoRetry<T> extends AbstractMonoRetry<MonoRetry<T>> {

  private final Supplier<Mono<T>> operation;

  MonoRetry(Supplier<Mono<T>> operation) {
    this.operation = operation;
  }

  @Override
  public void validate(Validator validator) {
    super.validate(validator);
    validator.notNull("operation", operation);
  }

  /**
   * @return A {@link Mono} which, for each subscription, calls the supplier and subscribes to the
   *     result until it succeeds or a retry is refused. Emits the first successful result (or
   *     completes empty, if that is the result) or errors with the error from the last attempt.
   * @throws IllegalArgumentException If the driver is misconfigured.
   */
  public Mono<T> toMono() {
    return session(
            null,
            context ->
                operation
                    .get()
                    .map(value -> Attempt.success(context, value))
                    .defaultIfEmpty(Attempt.success(context, null)))
        .flatMap(
            outcome -> {
              if (outcome.isSuccess()) {
                return Mono.justOrEmpty(outcome.getValue());
              }
              return Mono.<T>error(outcome.getError());
            });
  }

  /**
   * Subscribes and waits for the result.
   *
   * @return The first successful result, or null if it was empty.
   * @throws Exception The error from the last attempt, exactly as the operation produced it.
   *     Checked exceptions are thrown without being declared.
   */
  public T block() {
    try {
      return toMono().block();
    } catch (RuntimeException e) {
      throw Utils.sneakyThrow(Exceptions.unwrap(e));
    }
  }
}
