package io.calrecur;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CalendarExceptionTest {

  @Test
  void structureErrorRendersLineAndInput() {
    CalendarException e =
        CalendarException.structure("missing ':' separator", Span.line(7), "DTSTART;TZID=X");
    assertEquals(
        "error: missing ':' separator (line 7)\n  DTSTART;TZID=X", e.displayRich());
  }

  @Test
  void conversionErrorNamesPropertyAndValue() {
    CalendarException e = CalendarException.conversion("DURATION", "P1X", "bad unit");
    assertEquals(ErrorKind.CONVERSION, e.kind());
    assertEquals("cannot convert DURATION value 'P1X': bad unit", e.getMessage());
    assertEquals("error: cannot convert DURATION value 'P1X': bad unit", e.displayRich());
    assertTrue(e.span().isEmpty());
  }

  @Test
  void kindsHaveStableNames() {
    assertEquals("missing-property", ErrorKind.MISSING_PROPERTY.value());
  }
}
