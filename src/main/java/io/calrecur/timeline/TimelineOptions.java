package io.calrecur.timeline;

import io.calrecur.ast.DateTimeValue;
import io.calrecur.eval.SystemZoneResolver;
import io.calrecur.eval.ZoneResolver;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Settings for resolving occurrences.
 *
 * @param zoneResolver resolves offsets of TZID-bound values
 * @param floatingZone the zone assumed for floating and DATE values
 * @param inclusiveEnd whether a window's end bound is inclusive
 */
public record TimelineOptions(
    ZoneResolver zoneResolver, ZoneId floatingZone, boolean inclusiveEnd) {
  /** Fills in defaults for null components. */
  public TimelineOptions {
    zoneResolver = zoneResolver == null ? new SystemZoneResolver() : zoneResolver;
    floatingZone = floatingZone == null ? ZoneOffset.UTC : floatingZone;
  }

  /**
   * Returns the default options: JDK zone rules, floating values in UTC, exclusive window end.
   *
   * @return the default options
   */
  public static TimelineOptions defaults() {
    return new TimelineOptions(null, null, false);
  }

  /**
   * Returns a copy with the specified zone resolver.
   *
   * @param zoneResolver the resolver
   * @return a new TimelineOptions with the updated resolver
   */
  public TimelineOptions withZoneResolver(ZoneResolver zoneResolver) {
    return new TimelineOptions(zoneResolver, floatingZone, inclusiveEnd);
  }

  /**
   * Returns a copy with the specified floating zone.
   *
   * @param floatingZone the zone for floating and DATE values
   * @return a new TimelineOptions with the updated floating zone
   */
  public TimelineOptions withFloatingZone(ZoneId floatingZone) {
    return new TimelineOptions(zoneResolver, floatingZone, inclusiveEnd);
  }

  /**
   * Returns a copy with the specified end-bound inclusiveness.
   *
   * @param inclusiveEnd true to include occurrences starting exactly at the window end
   * @return a new TimelineOptions with the updated flag
   */
  public TimelineOptions withInclusiveEnd(boolean inclusiveEnd) {
    return new TimelineOptions(zoneResolver, floatingZone, inclusiveEnd);
  }

  /**
   * Maps a written date or date-time to an instant.
   *
   * @param value the value
   * @return the instant
   */
  public Instant toInstant(DateTimeValue value) {
    return switch (value.form()) {
      case UTC -> value.local().toInstant(ZoneOffset.UTC);
      case ZONED -> zoneResolver.toInstant(value.local(), value.tzid());
      case DATE, FLOATING -> value.local().atZone(floatingZone).toInstant();
    };
  }

  /**
   * Maps an instant to wall-clock time in the frame of a written value, the inverse of {@link
   * #toInstant(DateTimeValue)}.
   *
   * @param instant the instant
   * @param frame the value whose form and zone define the frame
   * @return the wall-clock time
   */
  public LocalDateTime toLocal(Instant instant, DateTimeValue frame) {
    return switch (frame.form()) {
      case UTC -> LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
      case ZONED -> zoneResolver.toLocal(instant, frame.tzid());
      case DATE, FLOATING -> LocalDateTime.ofInstant(instant, floatingZone);
    };
  }
}
