package com.gruelbox.retry;

/** Implemented by configuration objects which can check their own settings. */
public interface Validatable {

  /**
   * Checks the object's settings, reporting any problem through the supplied {@link Validator}.
   *
   * @param validator The validator.
   * @throws IllegalArgumentException If any setting is invalid.
   */
  void validate(Validator validator);
}
