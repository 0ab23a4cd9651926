package com.gruelbox.retry.spi;

import com.gruelbox.retry.ThrowingRunnable;
import com.gruelbox.retry.UncheckedException;
import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Utility methods used by the retry drivers. These are very firmly {@link NotApi}. Don't use them
 * in your code as they may be modified or removed without warning.
 */
@Slf4j
@NotApi
public class Utils {

  private Utils() {}

  public static void uncheck(ThrowingRunnable runnable) {
    try {
      runnable.run();
    } catch (Exception e) {
      uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckedly(Callable<T> runnable) {
    try {
      return runnable.call();
    } catch (Exception e) {
      return uncheckAndThrow(e);
    }
  }

  public static <T> T uncheckAndThrow(Throwable e) {
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    if (e instanceof Error) {
      throw (Error) e;
    }
    throw new UncheckedException(e);
  }

  /**
   * Throws the supplied exception unchanged, even if it is checked, without declaring it. Used to
   * surface the last operation error verbatim.
   *
   * @param t The exception.
   * @return Never returns. Declared so callers can write {@code throw sneakyThrow(e)}.
   */
  @SneakyThrows
  public static RuntimeException sneakyThrow(Throwable t) {
    throw t;
  }

  /**
   * Strips the wrappers the JDK puts around exceptions thrown by asynchronous and reflective
   * calls.
   *
   * @param t The possibly-wrapped exception.
   * @return The underlying cause.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable result = t;
    while ((result instanceof CompletionException
            || result instanceof ExecutionException
            || result instanceof InvocationTargetException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  public static <T> T firstNonNull(T one, Supplier<T> two) {
    if (one == null) return two.get();
    return one;
  }

  public static void logAtLevel(Logger logger, Level level, String message, Object... args) {
    switch (level) {
      case ERROR:
        logger.error(message, args);
        break;
      case WARN:
        logger.warn(message, args);
        break;
      case INFO:
        logger.info(message, args);
        break;
      case DEBUG:
        logger.debug(message, args);
        break;
      case TRACE:
        logger.trace(message, args);
        break;
      default:
        logger.warn(message, args);
        break;
    }
  }
}
