package com.gruelbox.retry.reactor;

import com.gruelbox.retry.Attempt;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/** Entry points for retrying Project Reactor {@link Mono}s. */
public final class ReactorRetry {

  private ReactorRetry() {}

  /**
   * @param operation Supplies the {@link Mono} for each attempt.
   * @param <T> The result type.
   * @return The driver.
   */
  public static <T> MonoRetry<T> mono(Supplier<Mono<T>> operation) {
    return new MonoRetry<>(operation);
  }

  /**
   * @param context The context passed to the first attempt of each session.
   * @param operation Supplies the {@link Mono} for each attempt, given the context.
   * @param <C> The context type.
   * @param <T> The result type.
   * @return The driver.
   */
  public static <C, T> MonoContextRetry<C, T> monoWithContext(
      C context, Function<C, Mono<Attempt<C, T>>> operation) {
    return new MonoContextRetry<>(context, operation);
  }
}
