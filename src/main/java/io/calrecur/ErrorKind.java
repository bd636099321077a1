package io.calrecur;

/** The type of error that occurred during parsing, conversion or expansion. */
public enum ErrorKind {
  /** Structural error - malformed content line or mismatched BEGIN/END. */
  STRUCTURE("structure"),
  /** Conversion error - a raw property value cannot be coerced to its typed form. */
  CONVERSION("conversion"),
  /** Recurrence error - a rule definition is contradictory or out of range. */
  RECURRENCE("recurrence"),
  /** A property required by the caller is absent from the component. */
  MISSING_PROPERTY("missing-property");

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
