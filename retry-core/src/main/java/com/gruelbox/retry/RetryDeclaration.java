package com.gruelbox.retry;

import java.util.function.Predicate;
import lombok.Builder;
import lombok.Value;

/**
 * The retry options declared for a wrapped operation. Only the options which are set are applied;
 * the rest take the driver defaults.
 *
 * @see CallingConvention#select(OperationShape, RetryDeclaration)
 * @see RetryProxies
 */
@Value
@Builder(toBuilder = true)
public class RetryDeclaration {

  /** Used where no options are needed. */
  public static final RetryDeclaration DEFAULTS = RetryDeclaration.builder().build();

  BackoffBuilder backoff;

  /** Blocking operations only. */
  Sleeper sleeper;

  /** Asynchronous operations only. */
  AsyncSleeper asyncSleeper;

  Predicate<? super Exception> when;

  RetryNotifier notifier;

  /** Asynchronous operations only. */
  DelayAdjuster adjust;

  /** Thread the operation's arguments from attempt to attempt as a context. */
  boolean context;
}
