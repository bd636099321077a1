package io.calrecur.ast;

import static org.junit.jupiter.api.Assertions.*;

import io.calrecur.CalendarException;
import io.calrecur.ErrorKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecurrenceRuleTest {

  @Test
  void parsesFields() throws CalendarException {
    RecurrenceRule rule = RecurrenceRule.parse("FREQ=WEEKLY;INTERVAL=2;BYDAY=MO,-1FR;COUNT=10");
    assertEquals(Frequency.WEEKLY, rule.freq());
    assertEquals(2, rule.interval());
    assertEquals(10, rule.count());
    assertEquals(
        List.of(WeekdayNum.every(Weekday.MONDAY), new WeekdayNum(-1, Weekday.FRIDAY)),
        rule.byDay());
    assertEquals(Weekday.MONDAY, rule.weekStart());
    assertTrue(rule.isBounded());
  }

  @Test
  void keysAreCaseInsensitiveAndUnknownKeysIgnored() throws CalendarException {
    RecurrenceRule rule = RecurrenceRule.parse("freq=daily;x-name=whatever;wkst=su");
    assertEquals(Frequency.DAILY, rule.freq());
    assertEquals(Weekday.SUNDAY, rule.weekStart());
    assertFalse(rule.isBounded());
  }

  @Test
  void untilKeepsItsForm() throws CalendarException {
    DateTimeValue date = RecurrenceRule.parse("FREQ=DAILY;UNTIL=20240105").untilValue().get();
    assertTrue(date.isDate());
    DateTimeValue utc =
        RecurrenceRule.parse("FREQ=DAILY;UNTIL=20240105T000000Z").untilValue().get();
    assertEquals(DateTimeValue.Form.UTC, utc.form());
  }

  @Test
  void canonicalText() throws CalendarException {
    assertEquals(
        "FREQ=MONTHLY;COUNT=3;BYDAY=1MO",
        RecurrenceRule.parse("BYDAY=+1MO;COUNT=3;FREQ=MONTHLY").toString());
  }

  @Test
  void countWithUntilIsRejected() {
    CalendarException e =
        assertThrows(
            CalendarException.class,
            () -> RecurrenceRule.parse("FREQ=DAILY;COUNT=3;UNTIL=20240105T000000Z"));
    assertEquals(ErrorKind.RECURRENCE, e.kind());
  }

  @Test
  void outOfRangeValuesAreRejected() {
    for (String text :
        List.of(
            "FREQ=YEARLY;BYMONTH=13",
            "FREQ=MONTHLY;BYMONTHDAY=0",
            "FREQ=MONTHLY;BYMONTHDAY=32",
            "FREQ=DAILY;BYHOUR=24",
            "FREQ=YEARLY;BYWEEKNO=54",
            "FREQ=YEARLY;BYDAY=54MO",
            "FREQ=DAILY;INTERVAL=0",
            "FREQ=FORTNIGHTLY",
            "INTERVAL=2",
            "FREQ=WEEKLY;BYDAY=XX")) {
      CalendarException e =
          assertThrows(CalendarException.class, () -> RecurrenceRule.parse(text), text);
      assertEquals(ErrorKind.RECURRENCE, e.kind(), text);
      assertEquals(text, e.input().orElseThrow());
    }
  }

  @Test
  void negativeOffsetsAreAccepted() throws CalendarException {
    RecurrenceRule rule = RecurrenceRule.parse("FREQ=MONTHLY;BYMONTHDAY=-1,-31;BYSETPOS=-1");
    assertEquals(List.of(-1, -31), rule.byMonthDay());
    assertEquals(List.of(-1), rule.bySetPos());
  }
}
