package com.gruelbox.migrationledger;

import java.time.Duration;

/** Checks configuration properties, reporting failures with the full property path. */
public final class Validator {

  private final String path;

  Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
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

  public void notBlank(String propertyName, String object) {
    notNull(propertyName, object);
    if (object.isBlank()) {
      error(propertyName, "may not be blank");
    }
  }

  public void positive(String propertyName, Duration object) {
    notNull(propertyName, object);
    if (object.isZero() || object.isNegative()) {
      error(propertyName, "must be positive");
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
