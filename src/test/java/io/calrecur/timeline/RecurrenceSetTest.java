package io.calrecur.timeline;

import static org.junit.jupiter.api.Assertions.*;

import io.calrecur.CalendarException;
import io.calrecur.ErrorKind;
import io.calrecur.ast.Component;
import io.calrecur.ast.ComponentType;
import io.calrecur.ast.Parameters;
import io.calrecur.ast.Property;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecurrenceSetTest {

  private static Component dailyFromJan1(int count) {
    return Component.root(ComponentType.EVENT)
        .addProperty("UID", "series")
        .addProperty("DTSTART", "20240101T090000Z")
        .addProperty("DTEND", "20240101T100000Z")
        .addProperty("RRULE", "FREQ=DAILY;COUNT=" + count);
  }

  private static List<Instant> starts(RecurrenceSet set) {
    return set.resolve(null, null).map(ResolvedInstant::start).toList();
  }

  private static Instant at(String iso) {
    return Instant.parse(iso);
  }

  @Test
  void exdateRemovesInstance() throws CalendarException {
    Component master = dailyFromJan1(5).addProperty("EXDATE", "20240103T090000Z");
    List<Instant> starts = starts(RecurrenceSet.of(master));
    assertEquals(
        List.of(
            at("2024-01-01T09:00:00Z"),
            at("2024-01-02T09:00:00Z"),
            at("2024-01-04T09:00:00Z"),
            at("2024-01-05T09:00:00Z")),
        starts);
  }

  @Test
  void exdateInAnotherZoneMatchesSameInstant() throws CalendarException {
    Component master =
        Component.root(ComponentType.EVENT)
            .addProperty(
                new Property(
                    "DTSTART", Parameters.of("TZID", "Europe/Amsterdam"), "20240101T100000", null))
            .addProperty("RRULE", "FREQ=DAILY;COUNT=3")
            .addProperty("EXDATE", "20240102T090000Z");
    assertEquals(
        List.of(at("2024-01-01T09:00:00Z"), at("2024-01-03T09:00:00Z")),
        starts(RecurrenceSet.of(master)));
  }

  @Test
  void dateExdateRemovesWholeDay() throws CalendarException {
    Component master =
        dailyFromJan1(3)
            .addProperty(new Property("EXDATE", Parameters.of("VALUE", "DATE"), "20240102", null));
    assertEquals(2, starts(RecurrenceSet.of(master)).size());
  }

  @Test
  void exruleSubtractsWeekends() throws CalendarException {
    Component master =
        dailyFromJan1(14).addProperty("EXRULE", "FREQ=WEEKLY;BYDAY=SA,SU");
    List<Instant> starts = starts(RecurrenceSet.of(master));
    assertEquals(10, starts.size());
    assertFalse(starts.contains(at("2024-01-06T09:00:00Z")));
    assertFalse(starts.contains(at("2024-01-07T09:00:00Z")));
  }

  @Test
  void rdatesAreMergedAndDeduplicated() throws CalendarException {
    Component master =
        dailyFromJan1(2)
            .addProperty("RDATE", "20240102T090000Z,20231231T090000Z")
            .addProperty(
                new Property(
                    "RDATE", Parameters.of("VALUE", "PERIOD"), "20240110T120000Z/PT3H", null));
    List<ResolvedInstant> all = RecurrenceSet.of(master).resolve(null, null).toList();
    assertEquals(
        List.of(
            at("2023-12-31T09:00:00Z"),
            at("2024-01-01T09:00:00Z"),
            at("2024-01-02T09:00:00Z"),
            at("2024-01-10T12:00:00Z")),
        all.stream().map(ResolvedInstant::start).toList());
    assertEquals(Duration.ofHours(1), all.get(0).duration());
    assertEquals(Duration.ofHours(3), all.get(3).duration());
  }

  @Test
  void startIsIncludedEvenWhenRuleSkipsIt() throws CalendarException {
    Component master =
        Component.root(ComponentType.EVENT)
            .addProperty("DTSTART", "20240101T090000Z")
            .addProperty("RRULE", "FREQ=WEEKLY;BYDAY=WE;COUNT=2");
    assertEquals(
        List.of(
            at("2024-01-01T09:00:00Z"), at("2024-01-03T09:00:00Z"), at("2024-01-10T09:00:00Z")),
        starts(RecurrenceSet.of(master)));
  }

  @Test
  void utcUntilIsComparedInStartZone() throws CalendarException {
    Component master =
        Component.root(ComponentType.EVENT)
            .addProperty(
                new Property(
                    "DTSTART", Parameters.of("TZID", "America/New_York"), "20240101T090000", null))
            .addProperty("RRULE", "FREQ=DAILY;UNTIL=20240103T135959Z");
    assertEquals(
        List.of(at("2024-01-01T14:00:00Z"), at("2024-01-02T14:00:00Z")),
        starts(RecurrenceSet.of(master)));
  }

  @Test
  void overrideReplacesInstance() throws CalendarException {
    Component override =
        Component.root(ComponentType.EVENT)
            .addProperty("UID", "series")
            .addProperty("RECURRENCE-ID", "20240103T090000Z")
            .addProperty("DTSTART", "20240103T150000Z")
            .addProperty("DURATION", "PT30M");
    RecurrenceSet set =
        RecurrenceSet.of(dailyFromJan1(5), List.of(override), TimelineOptions.defaults());
    List<ResolvedInstant> all = set.resolve(null, null).toList();

    assertEquals(5, all.size());
    ResolvedInstant moved = all.get(2);
    assertEquals(at("2024-01-03T15:00:00Z"), moved.start());
    assertTrue(moved.overridden());
    assertSame(override, moved.source());
    assertEquals(Duration.ofMinutes(30), moved.duration());
    assertEquals(4, all.stream().filter(r -> !r.overridden()).count());
    assertFalse(all.stream().anyMatch(r -> r.start().equals(at("2024-01-03T09:00:00Z"))));
  }

  @Test
  void detachedOverrideIsKept() throws CalendarException {
    Component override =
        Component.root(ComponentType.EVENT)
            .addProperty("UID", "series")
            .addProperty("RECURRENCE-ID", "20240301T090000Z")
            .addProperty("DTSTART", "20240301T090000Z");
    RecurrenceSet set =
        RecurrenceSet.of(dailyFromJan1(2), List.of(override), TimelineOptions.defaults());
    List<ResolvedInstant> all = set.resolve(null, null).toList();
    assertEquals(3, all.size());
    assertTrue(all.get(2).overridden());
    assertEquals(Duration.ofHours(1), all.get(2).duration());
  }

  @Test
  void windowBoundsAreInclusive() throws CalendarException {
    RecurrenceSet set = RecurrenceSet.of(dailyFromJan1(5));
    assertEquals(
        List.of(at("2024-01-02T09:00:00Z"), at("2024-01-03T09:00:00Z")),
        set.resolve(at("2024-01-02T09:00:00Z"), at("2024-01-03T09:00:00Z"))
            .map(ResolvedInstant::start)
            .toList());
    assertThrows(
        IllegalArgumentException.class,
        () -> set.resolve(at("2024-01-03T00:00:00Z"), at("2024-01-02T00:00:00Z")));
  }

  @Test
  void unboundedSeriesResolvesLazily() throws CalendarException {
    Component master =
        Component.root(ComponentType.EVENT)
            .addProperty("DTSTART", "20240101T090000Z")
            .addProperty("RRULE", "FREQ=HOURLY");
    RecurrenceSet set = RecurrenceSet.of(master);
    assertEquals(
        at("2024-01-01T13:00:00Z"),
        set.resolve(null, null).skip(4).findFirst().orElseThrow().start());
    assertEquals(
        25, set.resolve(at("2024-01-02T00:00:00Z"), at("2024-01-03T00:00:00Z")).count());
  }

  @Test
  void invalidRuleIsRecordedAndIgnored() throws CalendarException {
    Component master =
        Component.root(ComponentType.EVENT)
            .addProperty("DTSTART", "20240101T090000Z")
            .addProperty("RRULE", "FREQ=DAILY;COUNT=2;UNTIL=20240110T000000Z")
            .addProperty("EXDATE", "yesterday");
    RecurrenceSet set = RecurrenceSet.of(master);
    assertEquals(List.of(at("2024-01-01T09:00:00Z")), starts(set));
    assertEquals(2, set.problems().size());
    assertEquals(ErrorKind.RECURRENCE, set.problems().get(0).kind());
    assertEquals(ErrorKind.CONVERSION, set.problems().get(1).kind());
  }

  @Test
  void missingStartIsAnError() {
    Component master = Component.root(ComponentType.EVENT).addProperty("RRULE", "FREQ=DAILY");
    CalendarException e =
        assertThrows(CalendarException.class, () -> RecurrenceSet.of(master));
    assertEquals(ErrorKind.MISSING_PROPERTY, e.kind());
  }

  @Test
  void allDaySeries() throws CalendarException {
    Component master =
        Component.root(ComponentType.EVENT)
            .addProperty("DTSTART", "20240101")
            .addProperty("RRULE", "FREQ=YEARLY;COUNT=2");
    List<ResolvedInstant> all = RecurrenceSet.of(master).resolve(null, null).toList();
    assertEquals(at("2025-01-01T00:00:00Z"), all.get(1).start());
    assertEquals(Duration.ofDays(1), all.get(1).duration());
  }
}
