package com.gruelbox.retry;

import java.util.HashSet;
import java.util.Set;
import javax.lang.model.SourceVersion;

/** The four ways a wrapped operation can be driven. */
public enum CallingConvention {
  BLOCKING,
  BLOCKING_WITH_CONTEXT,
  ASYNC,
  ASYNC_WITH_CONTEXT;

  /**
   * Selects how to drive an operation, given its shape and the options declared for it. The same
   * inputs always select the same convention.
   *
   * @param shape The operation's shape.
   * @param declaration The options declared for it.
   * @return The convention.
   * @throws InvalidRetryDeclarationException If the options can't be applied to the operation.
   */
  public static CallingConvention select(OperationShape shape, RetryDeclaration declaration) {
    String name = shape.getName();
    switch (shape.getReceiver()) {
      case EXCLUSIVE:
        throw new InvalidRetryDeclarationException(
            name + ": an exclusive receiver can't be shared between attempts");
      case OWNED:
        throw new InvalidRetryDeclarationException(
            name + ": a receiver consumed by the call can't be reused between attempts");
      default:
        break;
    }
    Set<String> seen = new HashSet<>();
    for (String parameter : shape.getParameters()) {
      if (!isIdentifier(parameter)) {
        throw new InvalidRetryDeclarationException(
            name + ": parameter '" + parameter + "' is not bound to an identifier");
      }
      if (!seen.add(parameter)) {
        throw new InvalidRetryDeclarationException(
            name + ": parameter '" + parameter + "' is bound more than once");
      }
    }
    if (shape.isAsync()) {
      if (declaration.getSleeper() != null) {
        throw new InvalidRetryDeclarationException(
            name + ": asynchronous operations need an asyncSleeper, not a sleeper");
      }
      return declaration.isContext() ? ASYNC_WITH_CONTEXT : ASYNC;
    }
    if (declaration.getAdjust() != null) {
      throw new InvalidRetryDeclarationException(
          name + ": adjust is only supported for asynchronous operations");
    }
    if (declaration.getAsyncSleeper() != null) {
      throw new InvalidRetryDeclarationException(
          name + ": blocking operations need a sleeper, not an asyncSleeper");
    }
    return declaration.isContext() ? BLOCKING_WITH_CONTEXT : BLOCKING;
  }

  /**
   * @return True if this convention threads the arguments through a context.
   */
  public boolean isWithContext() {
    return this == BLOCKING_WITH_CONTEXT || this == ASYNC_WITH_CONTEXT;
  }

  private static boolean isIdentifier(String name) {
    return name != null && SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
  }
}
