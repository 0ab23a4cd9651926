package com.gruelbox.retry;

/**
 * Thrown when retry options are declared for an operation they can't be applied to. Always thrown
 * when the retrying wrapper is created, never when it is called.
 */
public class InvalidRetryDeclarationException extends IllegalArgumentException {

  public InvalidRetryDeclarationException(String message) {
    super(message);
  }
}
