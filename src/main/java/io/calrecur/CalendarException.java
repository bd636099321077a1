package io.calrecur;

import java.util.Optional;

/** Exception thrown for errors in calendar parsing, value conversion, or rule expansion. */
public final class CalendarException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The physical lines where the error occurred. */
  private final Span span;

  /** The offending raw input. */
  private final String input;

  /** The property or component name the error is scoped to. */
  private final String subject;

  private CalendarException(
      ErrorKind kind, String message, Span span, String input, String subject, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.subject = subject;
  }

  /**
   * Creates a new structural error.
   *
   * @param message the error message
   * @param span the physical lines of the offending content line
   * @param input the offending logical line
   * @return a new CalendarException for a structural error
   */
  public static CalendarException structure(String message, Span span, String input) {
    return new CalendarException(ErrorKind.STRUCTURE, message, span, input, null, null);
  }

  /**
   * Creates a new conversion error scoped to one property.
   *
   * @param property the property name
   * @param rawValue the raw value that failed to convert
   * @param message what was wrong with the value
   * @return a new CalendarException for a conversion error
   */
  public static CalendarException conversion(String property, String rawValue, String message) {
    return conversion(property, rawValue, message, null);
  }

  /**
   * Creates a new conversion error scoped to one property, keeping the underlying cause.
   *
   * @param property the property name
   * @param rawValue the raw value that failed to convert
   * @param message what was wrong with the value
   * @param cause the underlying parse failure, may be null
   * @return a new CalendarException for a conversion error
   */
  public static CalendarException conversion(
      String property, String rawValue, String message, Throwable cause) {
    return new CalendarException(
        ErrorKind.CONVERSION,
        "cannot convert " + property + " value '" + rawValue + "': " + message,
        null,
        rawValue,
        property,
        cause);
  }

  /**
   * Creates a new recurrence rule definition error.
   *
   * @param message the error message
   * @param rule the raw rule text
   * @return a new CalendarException for a recurrence error
   */
  public static CalendarException recurrence(String message, String rule) {
    return new CalendarException(ErrorKind.RECURRENCE, message, null, rule, "RRULE", null);
  }

  /**
   * Creates a new missing-property error.
   *
   * @param component the component type name
   * @param property the missing property name
   * @return a new CalendarException for a missing property
   */
  public static CalendarException missingProperty(String component, String property) {
    return new CalendarException(
        ErrorKind.MISSING_PROPERTY,
        component + " is missing required property " + property,
        null,
        null,
        property,
        null);
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
   * Returns the physical lines where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the offending raw input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns the property name the error is scoped to, if any.
   *
   * @return the property name, or empty
   */
  public Optional<String> subject() {
    return Optional.ofNullable(subject);
  }

  /**
   * Formats a rich error message with location and offending input.
   *
   * <p>For structural errors with span and input, produces output like:
   *
   * <pre>
   * error: missing ':' separator (line 7)
   *   DTSTART;TZID=Europe/Amsterdam
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage());
    if (span != null) {
      sb.append(" (").append(span).append(")");
    }
    if (kind == ErrorKind.STRUCTURE && input != null) {
      sb.append("\n  ").append(input);
    }
    return sb.toString();
  }
}
