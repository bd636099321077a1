package io.calrecur.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.calrecur.Span;
import java.io.StringReader;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class LineUnfolderTest {

  @Test
  void joinsContinuationLines() {
    String text =
        "DESCRIPTION:This is a lo\r\n ng description\r\n\tthat folds\r\nSUMMARY:Standup\r\n";
    List<FoldedLine> lines = LineUnfolder.lines(text).toList();

    assertEquals(2, lines.size());
    assertEquals("DESCRIPTION:This is a long descriptionthat folds", lines.get(0).text());
    assertEquals(new Span(1, 3), lines.get(0).span());
    assertEquals("SUMMARY:Standup", lines.get(1).text());
    assertEquals(Span.line(4), lines.get(1).span());
  }

  @Test
  void acceptsBareLineFeeds() {
    List<FoldedLine> lines = LineUnfolder.lines("A:1\n B\nC:2\n").toList();
    assertEquals(List.of("A:1B", "C:2"), lines.stream().map(FoldedLine::text).toList());
  }

  @Test
  void skipsBlankLines() {
    List<FoldedLine> lines = LineUnfolder.lines("A:1\r\n\r\n\r\nB:2").toList();
    assertEquals(2, lines.size());
    assertEquals(Span.line(4), lines.get(1).span());
  }

  @Test
  void readsFromReader() {
    LineUnfolder unfolder = LineUnfolder.of(new StringReader("BEGIN:VCALENDAR\r\nEND:VCALENDAR"));
    assertTrue(unfolder.hasNext());
    assertEquals("BEGIN:VCALENDAR", unfolder.next().text());
    assertEquals("END:VCALENDAR", unfolder.next().text());
    assertFalse(unfolder.hasNext());
    assertThrows(NoSuchElementException.class, unfolder::next);
  }

  @Test
  void dropsLeadingByteOrderMark() {
    List<FoldedLine> lines =
        LineUnfolder.lines("\uFEFFBEGIN:VCALENDAR\r\nX-NOTE:\uFEFFkept\r\nEND:VCALENDAR\r\n")
            .toList();

    assertEquals(
        List.of("BEGIN:VCALENDAR", "X-NOTE:\uFEFFkept", "END:VCALENDAR"),
        lines.stream().map(FoldedLine::text).toList());
    assertEquals(new Span(1, 1), lines.get(0).span());
  }

  @Test
  void emptyInputHasNoLines() {
    assertEquals(0, LineUnfolder.lines("").count());
    assertEquals(0, LineUnfolder.lines(null).count());
  }

  @Test
  void foldingRoundTrip() {
    String original =
        "DESCRIPTION:Quarterly planning; bring the roadmap, the budget draft and the hiring"
            + " plan. Dial-in details follow in a separate message.";
    for (int width : new int[] {10, 30, 74}) {
      StringBuilder folded = new StringBuilder();
      for (int i = 0; i < original.length(); i += width) {
        if (i > 0) {
          folded.append("\r\n ");
        }
        folded.append(original, i, Math.min(original.length(), i + width));
      }
      List<FoldedLine> lines = LineUnfolder.lines(folded.toString()).toList();
      assertEquals(1, lines.size(), "width " + width);
      assertEquals(original, lines.get(0).text(), "width " + width);
    }
  }
}
