package io.calrecur.lexer;

/** The structural role of a content line. */
public enum LineKind {
  /** A {@code BEGIN:<type>} line opening a component. */
  BEGIN,
  /** An {@code END:<type>} line closing a component. */
  END,
  /** Any other line, carrying a property. */
  PROPERTY
}
