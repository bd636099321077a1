package io.calrecur.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.calrecur.CalendarException;
import io.calrecur.ast.RecurrenceRule;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RecurrenceEvaluatorTest {
  private static final LocalDateTime JAN_1 = LocalDateTime.of(2024, 1, 1, 9, 0);

  private static RecurrenceRule rule(String text) throws CalendarException {
    return RecurrenceRule.parse(text);
  }

  @Test
  void unboundedRuleIsLazy() throws CalendarException {
    AtomicInteger pulled = new AtomicInteger();
    List<LocalDateTime> first =
        RecurrenceEvaluator.expand(rule("FREQ=SECONDLY"), JAN_1)
            .peek(t -> pulled.incrementAndGet())
            .limit(4)
            .toList();
    assertEquals(4, first.size());
    assertEquals(JAN_1.plusSeconds(3), first.get(3));
    assertEquals(4, pulled.get());
  }

  @Test
  void untilIsNeverExceeded() throws CalendarException {
    Iterator<LocalDateTime> it =
        RecurrenceEvaluator.iterator(rule("FREQ=DAILY;UNTIL=20240110T000000"), JAN_1);
    LocalDateTime last = null;
    int n = 0;
    while (it.hasNext()) {
      last = it.next();
      n++;
    }
    assertEquals(9, n);
    assertEquals(LocalDateTime.of(2024, 1, 9, 9, 0), last);
    assertFalse(it.hasNext());
    assertThrows(NoSuchElementException.class, it::next);
  }

  @Test
  void countIsExact() throws CalendarException {
    assertEquals(
        7, RecurrenceEvaluator.expand(rule("FREQ=WEEKLY;BYDAY=MO,FR;COUNT=7"), JAN_1).count());
  }

  @Test
  void impossibleRuleTerminates() throws CalendarException {
    assertTrue(
        RecurrenceEvaluator.expand(rule("FREQ=YEARLY;BYMONTH=2;BYMONTHDAY=30"), JAN_1)
            .findFirst()
            .isEmpty());
  }

  @Test
  void windowHintStopsUnboundedRule() throws CalendarException {
    List<LocalDateTime> inWindow =
        RecurrenceEvaluator.expand(
                rule("FREQ=DAILY"), JAN_1, LocalDateTime.of(2024, 1, 3, 9, 0))
            .toList();
    assertEquals(3, inWindow.size());
  }

  @Test
  void firstAfterResumesFromLastSeen() throws CalendarException {
    RecurrenceRule monthly = rule("FREQ=MONTHLY;BYDAY=1MO");
    LocalDateTime anchor = LocalDateTime.of(2024, 1, 1, 0, 0);
    assertEquals(
        LocalDateTime.of(2024, 2, 5, 0, 0),
        RecurrenceEvaluator.firstAfter(monthly, anchor, anchor).orElseThrow());
    assertEquals(
        LocalDateTime.of(2024, 3, 4, 0, 0),
        RecurrenceEvaluator.firstAfter(monthly, anchor, LocalDateTime.of(2024, 2, 5, 0, 0))
            .orElseThrow());
    assertTrue(
        RecurrenceEvaluator.firstAfter(rule("FREQ=DAILY;COUNT=2"), anchor, anchor.plusDays(1))
            .isEmpty());
  }

  @Test
  void expansionsAreIndependent() throws CalendarException {
    RecurrenceRule daily = rule("FREQ=DAILY;COUNT=3");
    Iterator<LocalDateTime> a = RecurrenceEvaluator.iterator(daily, JAN_1);
    Iterator<LocalDateTime> b = RecurrenceEvaluator.iterator(daily, JAN_1);
    a.next();
    a.next();
    assertEquals(JAN_1, b.next());
    assertEquals(JAN_1.plusDays(2), a.next());
  }

  @Test
  void ordinalIgnoredForWeeklyRules() throws CalendarException {
    List<LocalDateTime> out =
        RecurrenceEvaluator.expand(rule("FREQ=WEEKLY;BYDAY=2TU;COUNT=2"), JAN_1).toList();
    assertEquals(
        List.of(LocalDateTime.of(2024, 1, 2, 9, 0), LocalDateTime.of(2024, 1, 9, 9, 0)), out);
  }

  @Test
  void leapSecondIsClamped() throws CalendarException {
    assertEquals(
        LocalDateTime.of(2024, 1, 1, 9, 0, 59),
        RecurrenceEvaluator.expand(rule("FREQ=DAILY;BYSECOND=60;COUNT=1"), JAN_1)
            .findFirst()
            .orElseThrow());
  }
}
