package com.gruelbox.retry;

import com.gruelbox.retry.spi.Utils;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The outcome of one attempt of a context-threaded operation, paired with the context to hand to
 * the next attempt. Returned by the context-threaded drivers to describe the final attempt of a
 * session.
 *
 * @param <C> The context type.
 * @param <T> The result type.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Attempt<C, T> {

  C context;
  T value;
  Exception error;

  public static <C, T> Attempt<C, T> success(C context, T value) {
    return new Attempt<>(context, value, null);
  }

  public static <C, T> Attempt<C, T> failure(C context, Exception error) {
    if (error == null) {
      throw new IllegalArgumentException("error may not be null");
    }
    return new Attempt<>(context, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * Discards the context.
   *
   * @return The value, if the attempt succeeded.
   * @throws Exception The error exactly as the operation produced it, if the attempt failed.
   *     Checked exceptions are thrown without being declared.
   */
  public T get() {
    if (error != null) {
      throw Utils.sneakyThrow(error);
    }
    return value;
  }
}
