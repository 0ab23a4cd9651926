package com.gruelbox.retry;

/**
 * A supplier... that throws. The blocking operation retried by {@link BlockingRetry}.
 *
 * @param <T> The result type.
 * @param <E> The checked exception type, surfaced unchanged by {@link BlockingRetry#call()}.
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

  T get() throws E;
}
