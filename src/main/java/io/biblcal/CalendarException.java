package io.biblcal;

import java.util.Optional;

/** Exception thrown when a calendar calculation cannot accept its input or produce a result. */
public final class CalendarException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input value, rendered as text. */
  private final String input;

  private CalendarException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new input error.
   *
   * @param message the error message
   * @param input the rejected value
   * @return a new CalendarException for an input error
   */
  public static CalendarException input(String message, Object input) {
    return new CalendarException(ErrorKind.INPUT, message, String.valueOf(input), null);
  }

  /**
   * Creates a new location error.
   *
   * @param message the error message
   * @param input the rejected value
   * @return a new CalendarException for a location error
   */
  public static CalendarException location(String message, Object input) {
    return new CalendarException(ErrorKind.LOCATION, message, String.valueOf(input), null);
  }

  /**
   * Creates a new configuration error.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new CalendarException for a configuration error
   */
  public static CalendarException config(String message, Throwable cause) {
    return new CalendarException(ErrorKind.CONFIG, message, null, cause);
  }

  /**
   * Creates a new computation error.
   *
   * @param message the error message
   * @return a new CalendarException for a computation error
   */
  public static CalendarException computation(String message) {
    return new CalendarException(ErrorKind.COMPUTATION, message, null, null);
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
   * Returns the rejected input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats the error with its kind and the rejected value.
   *
   * <pre>
   * error[location]: latitude must be within [-90, 90]
   *   input: 91.0
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error[").append(kind).append("]: ").append(getMessage());
    if (input != null && !input.isEmpty()) {
      sb.append("\n  input: ").append(input);
    }
    return sb.toString();
  }
}
