package io.remindly;

/** The type of error raised by remindly. */
public enum ErrorKind {
  /** Rule error - a stored recurrence rule is outside the known vocabulary. */
  RULE("rule"),
  /** Configuration error - a setting cannot be interpreted. */
  CONFIG("config");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
