package io.calrecur.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.calrecur.CalendarException;
import io.calrecur.ErrorKind;
import io.calrecur.Span;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContentLineLexerTest {

  @Test
  void splitsNameParametersAndValue() throws CalendarException {
    ContentLine line = ContentLineLexer.tokenize("DTSTART;TZID=Europe/Amsterdam:20240101T090000");
    assertEquals(LineKind.PROPERTY, line.kind());
    assertEquals("DTSTART", line.name());
    assertEquals("Europe/Amsterdam", line.parameters().first("tzid").orElseThrow());
    assertEquals("20240101T090000", line.value());
  }

  @Test
  void quotedParameterValuesKeepDelimiters() throws CalendarException {
    ContentLine line =
        ContentLineLexer.tokenize(
            "ATTENDEE;CN=\"Doe, Jane; PhD\";ROLE=REQ-PARTICIPANT:mailto:jane@example.com");
    assertEquals("Doe, Jane; PhD", line.parameters().first("CN").orElseThrow());
    assertEquals("REQ-PARTICIPANT", line.parameters().first("ROLE").orElseThrow());
    assertEquals("mailto:jane@example.com", line.value());
  }

  @Test
  void multiValuedParameters() throws CalendarException {
    ContentLine line =
        ContentLineLexer.tokenize("ATTENDEE;DELEGATED-TO=\"mailto:a@x\",\"mailto:b@x\":mailto:c@x");
    assertEquals(List.of("mailto:a@x", "mailto:b@x"), line.parameters().all("DELEGATED-TO"));
  }

  @Test
  void namesAreUpperCased() throws CalendarException {
    ContentLine line = ContentLineLexer.tokenize("summary:Lunch");
    assertEquals("SUMMARY", line.name());
    assertEquals("Lunch", line.value());
  }

  @Test
  void emptyValueIsAllowed() throws CalendarException {
    assertEquals("", ContentLineLexer.tokenize("DESCRIPTION:").value());
  }

  @Test
  void recognizesBeginAndEnd() throws CalendarException {
    ContentLine begin = ContentLineLexer.tokenize("BEGIN:VEVENT");
    assertEquals(LineKind.BEGIN, begin.kind());
    assertEquals("VEVENT", begin.componentName());
    assertEquals(LineKind.END, ContentLineLexer.tokenize("end:vevent").kind());
  }

  @Test
  void missingColonIsStructuralError() {
    FoldedLine folded = new FoldedLine("THIS LINE HAS NO SEPARATOR", Span.line(7));
    CalendarException e =
        assertThrows(CalendarException.class, () -> ContentLineLexer.tokenize(folded));
    assertEquals(ErrorKind.STRUCTURE, e.kind());
    assertEquals(Span.line(7), e.span().orElseThrow());
    assertEquals("THIS LINE HAS NO SEPARATOR", e.input().orElseThrow());
    assertTrue(e.displayRich().contains("line 7"));
  }

  @Test
  void unterminatedQuoteIsStructuralError() {
    CalendarException e =
        assertThrows(
            CalendarException.class, () -> ContentLineLexer.tokenize("ATTENDEE;CN=\"Doe:mailto:x"));
    assertEquals(ErrorKind.STRUCTURE, e.kind());
  }

  @Test
  void missingNameIsStructuralError() {
    assertThrows(CalendarException.class, () -> ContentLineLexer.tokenize(":value"));
  }
}
