package io.calrecur.lexer;

import io.calrecur.CalendarException;
import io.calrecur.Span;
import io.calrecur.ast.Parameters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits one logical content line into name, parameters and raw value.
 *
 * <p>Grammar: {@code name *(";" param) ":" value}, where {@code param = pname "=" pvalue *(","
 * pvalue)} and a parameter value is either quoted ({@code "..."}, may contain {@code ; : ,}) or a
 * run of characters up to the next {@code , ; :}. Unquoted values are accepted anywhere a quoted
 * one is allowed. A parameter with no {@code =} is kept with no values.
 */
public final class ContentLineLexer {
  private final String input;
  private final Span span;
  private int pos;

  private ContentLineLexer(String input, Span span) {
    this.input = input;
    this.span = span;
    this.pos = 0;
  }

  /**
   * Tokenizes a logical line.
   *
   * @param line the unfolded line
   * @return the tokenized content line
   * @throws CalendarException if the line has no name or no ':' separator
   */
  public static ContentLine tokenize(FoldedLine line) throws CalendarException {
    return new ContentLineLexer(line.text(), line.span()).doTokenize();
  }

  /**
   * Tokenizes a single line of text, mostly for tests.
   *
   * @param text the unfolded line
   * @return the tokenized content line
   * @throws CalendarException if the line has no name or no ':' separator
   */
  public static ContentLine tokenize(String text) throws CalendarException {
    return tokenize(new FoldedLine(text, Span.line(1)));
  }

  private ContentLine doTokenize() throws CalendarException {
    String name = lexName();
    if (name.isEmpty()) {
      throw CalendarException.structure("content line has no name", span, input);
    }

    Parameters.Builder params = Parameters.builder();
    while (pos < input.length() && input.charAt(pos) == ';') {
      pos++; // skip ';'
      lexParameter(params);
    }

    if (pos >= input.length() || input.charAt(pos) != ':') {
      throw CalendarException.structure("missing ':' separator", span, input);
    }
    String value = input.substring(pos + 1);

    LineKind kind =
        switch (name) {
          case "BEGIN" -> LineKind.BEGIN;
          case "END" -> LineKind.END;
          default -> LineKind.PROPERTY;
        };
    return new ContentLine(kind, name, params.build(), value, span);
  }

  private String lexName() {
    int start = pos;
    while (pos < input.length() && !isDelimiter(input.charAt(pos))) {
      pos++;
    }
    return input.substring(start, pos).trim().toUpperCase(Locale.ROOT);
  }

  private void lexParameter(Parameters.Builder params) throws CalendarException {
    int start = pos;
    while (pos < input.length() && !isDelimiter(input.charAt(pos)) && input.charAt(pos) != '=') {
      pos++;
    }
    String paramName = input.substring(start, pos).trim();
    if (pos >= input.length() || input.charAt(pos) != '=') {
      // Valueless parameter, tolerated for compatibility.
      if (!paramName.isEmpty()) {
        params.add(paramName, List.of());
      }
      return;
    }
    pos++; // skip '='

    List<String> values = new ArrayList<>();
    values.add(lexParameterValue());
    while (pos < input.length() && input.charAt(pos) == ',') {
      pos++;
      values.add(lexParameterValue());
    }
    if (!paramName.isEmpty()) {
      params.add(paramName, values);
    }
  }

  private String lexParameterValue() throws CalendarException {
    if (pos < input.length() && input.charAt(pos) == '"') {
      int close = input.indexOf('"', pos + 1);
      if (close < 0) {
        throw CalendarException.structure("unterminated quoted parameter value", span, input);
      }
      String quoted = input.substring(pos + 1, close);
      pos = close + 1;
      return quoted;
    }
    int start = pos;
    while (pos < input.length() && !isDelimiter(input.charAt(pos)) && input.charAt(pos) != ',') {
      pos++;
    }
    return input.substring(start, pos);
  }

  private static boolean isDelimiter(char c) {
    return c == ';' || c == ':';
  }
}
