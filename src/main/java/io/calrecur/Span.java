package io.calrecur;

/**
 * Represents a range of physical line numbers in the input.
 *
 * <p>A logical content line spans more than one physical line when it was folded.
 *
 * @param start the first physical line (1-based, inclusive)
 * @param end the last physical line (1-based, inclusive)
 */
public record Span(int start, int end) {
  /**
   * Creates a span covering a single physical line.
   *
   * @param line the 1-based line number
   * @return a single-line span
   */
  public static Span line(int line) {
    return new Span(line, line);
  }

  /**
   * Returns the number of physical lines covered by this span.
   *
   * @return the number of lines, at least 1
   */
  public int length() {
    return Math.max(1, end - start + 1);
  }

  @Override
  public String toString() {
    return start == end ? "line " + start : "lines " + start + "-" + end;
  }
}
