package io.remindly;

import java.util.Optional;

/**
 * Exception thrown for data-integrity and configuration errors.
 *
 * <p>Unmatched phrases and exhausted recurrences are not errors; they are reported as empty
 * results.
 */
public final class RemindException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input, if any. */
  private final String input;

  private RemindException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new rule error.
   *
   * @param message the error message
   * @param input the stored value that could not be read
   * @return a new RemindException for a rule error
   */
  public static RemindException rule(String message, String input) {
    return new RemindException(ErrorKind.RULE, message, input, null);
  }

  /**
   * Creates a new configuration error.
   *
   * @param message the error message
   * @param input the offending setting value
   * @param cause the underlying failure, may be null
   * @return a new RemindException for a configuration error
   */
  public static RemindException config(String message, String input, Throwable cause) {
    return new RemindException(ErrorKind.CONFIG, message, input, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats the error with its kind and offending input.
   *
   * <pre>
   * rule error: unknown weekday
   *   input: "friday"
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind).append(" error: ").append(getMessage());
    if (input != null) {
      sb.append("\n  input: \"").append(input).append("\"");
    }
    return sb.toString();
  }
}
