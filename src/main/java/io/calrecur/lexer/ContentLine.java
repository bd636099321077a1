package io.calrecur.lexer;

import io.calrecur.Span;
import io.calrecur.ast.Parameters;

/**
 * Represents a tokenized logical content line.
 *
 * @param kind whether the line opens, closes, or carries a property
 * @param name the upper-cased line name (BEGIN, END, or the property name)
 * @param parameters the parsed parameters
 * @param value the raw, unparsed value after the first unquoted colon
 * @param span the physical lines the line was read from
 */
public record ContentLine(
    LineKind kind, String name, Parameters parameters, String value, Span span) {

  /**
   * Returns the component type named by a BEGIN or END line.
   *
   * @return the trimmed value
   */
  public String componentName() {
    return value.trim();
  }
}
