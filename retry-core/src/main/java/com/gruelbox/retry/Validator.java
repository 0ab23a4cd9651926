package com.gruelbox.retry;

import java.time.Duration;

/**
 * Checks configuration before any attempt is made, so that configuration errors are always
 * reported up-front and never in the middle of a retry session.
 */
public final class Validator {

  private final String path;

  public Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  public void valid(String propertyName, Object object) {
    notNull(propertyName, object);
    if (!(object instanceof Validatable)) {
      return;
    }
    ((Validatable) object)
        .validate(new Validator(path.isEmpty() ? propertyName : (path + "." + propertyName)));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  public void isTrue(String propertyName, boolean condition, String message, Object... args) {
    if (!condition) {
      error(propertyName, String.format(message, args));
    }
  }

  public void min(String propertyName, int object, int minimumValue) {
    if (object < minimumValue) {
      error(propertyName, "must be greater than or equal to " + minimumValue);
    }
  }

  public void min(String propertyName, double object, double minimumValue) {
    if (object < minimumValue) {
      error(propertyName, "must be greater than or equal to " + minimumValue);
    }
  }

  public void notNegative(String propertyName, Duration duration) {
    notNull(propertyName, duration);
    if (duration.isNegative()) {
      error(propertyName, "may not be negative");
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
