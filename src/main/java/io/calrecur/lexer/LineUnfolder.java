package io.calrecur.lexer;

import io.calrecur.Span;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Merges folded physical lines into logical content lines.
 *
 * <p>A physical line starting with a single space or horizontal tab continues the previous
 * logical line: that one whitespace character is dropped and the rest appended. Line terminators
 * may be LF, CRLF or a bare CR. Blank physical lines are skipped. A byte order mark at the
 * start of the document is dropped. No line length limit is enforced.
 *
 * <p>Lines are read one at a time on demand; the unfolder keeps a single physical line of
 * lookahead and never buffers the whole document.
 */
public final class LineUnfolder implements Iterator<FoldedLine> {
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final BufferedReader reader;
  private final StringBuilder current = new StringBuilder(75);
  private String lookahead;
  private int lookaheadLine;
  private int physicalLine;

  private LineUnfolder(Reader in) {
    this.reader = in instanceof BufferedReader br ? br : new BufferedReader(in);
    advance();
  }

  /**
   * Creates an unfolder over an in-memory document.
   *
   * @param text the raw document text
   * @return the unfolder
   */
  public static LineUnfolder of(String text) {
    return new LineUnfolder(new StringReader(text == null ? "" : text));
  }

  /**
   * Creates an unfolder over a character stream. The caller owns and closes the reader.
   *
   * @param in the reader supplying raw text
   * @return the unfolder
   */
  public static LineUnfolder of(Reader in) {
    return new LineUnfolder(in);
  }

  /**
   * Returns a lazy, sequential stream of the logical lines in the given text.
   *
   * @param text the raw document text
   * @return a stream of logical lines
   */
  public static Stream<FoldedLine> lines(String text) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            of(text), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  @Override
  public boolean hasNext() {
    return lookahead != null;
  }

  @Override
  public FoldedLine next() {
    if (lookahead == null) {
      throw new NoSuchElementException();
    }
    int first = lookaheadLine;
    current.setLength(0);
    current.append(lookahead);
    int last = first;
    readPhysical();
    while (lookahead != null && isContinuation(lookahead)) {
      current.append(lookahead, 1, lookahead.length());
      last = lookaheadLine;
      readPhysical();
    }
    skipBlank();
    return new FoldedLine(current.toString(), new Span(first, last));
  }

  private void advance() {
    readPhysical();
    skipBlank();
  }

  private void skipBlank() {
    while (lookahead != null && lookahead.isEmpty()) {
      readPhysical();
    }
  }

  private void readPhysical() {
    try {
      lookahead = reader.readLine();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    if (lookahead != null) {
      physicalLine++;
      lookaheadLine = physicalLine;
      if (physicalLine == 1 && !lookahead.isEmpty() && lookahead.charAt(0) == BYTE_ORDER_MARK) {
        lookahead = lookahead.substring(1);
      }
    }
  }

  private static boolean isContinuation(String line) {
    return !line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t');
  }
}
