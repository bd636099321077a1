package io.calrecur;

/**
 * A non-fatal problem found while building the component tree.
 *
 * @param kind the error kind, always {@link ErrorKind#STRUCTURE} for parse diagnostics
 * @param message a human readable description
 * @param span the physical lines of the offending content line
 * @param line the offending logical line, may be null
 */
public record Diagnostic(ErrorKind kind, String message, Span span, String line) {

  /**
   * Creates a diagnostic from a structural exception.
   *
   * @param e the exception
   * @return the equivalent diagnostic
   */
  public static Diagnostic of(CalendarException e) {
    return new Diagnostic(e.kind(), e.getMessage(), e.span().orElse(null), e.input().orElse(null));
  }

  /**
   * Creates a structural diagnostic.
   *
   * @param message the message
   * @param span where it happened
   * @param line the offending line, may be null
   * @return a new diagnostic
   */
  public static Diagnostic structure(String message, Span span, String line) {
    return new Diagnostic(ErrorKind.STRUCTURE, message, span, line);
  }

  @Override
  public String toString() {
    return kind + ": " + message + (span == null ? "" : " (" + span + ")");
  }
}
