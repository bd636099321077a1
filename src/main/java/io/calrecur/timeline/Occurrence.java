package io.calrecur.timeline;

import io.calrecur.ast.Component;
import java.time.Duration;
import java.time.Instant;

/**
 * A concrete, dated instance of a component. Many occurrences may share one component.
 *
 * @param component the defining component: the series master, an override, or a single event
 * @param start the start instant
 * @param end the end instant, {@code start + duration}, capped at {@link Instant#MAX}
 * @param overridden whether a RECURRENCE-ID override replaced the original instance
 */
public record Occurrence(Component component, Instant start, Instant end, boolean overridden) {

  static Occurrence of(ResolvedInstant r) {
    return new Occurrence(r.source(), r.start(), endOf(r.start(), r.duration()), r.overridden());
  }

  /** Adds the duration to the start, saturating at {@link Instant#MIN} and {@link Instant#MAX}. */
  static Instant endOf(Instant start, Duration duration) {
    if (duration.compareTo(Duration.between(start, Instant.MAX)) > 0) {
      return Instant.MAX;
    }
    if (duration.compareTo(Duration.between(start, Instant.MIN)) < 0) {
      return Instant.MIN;
    }
    return start.plus(duration);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  /**
   * Checks whether the occurrence covers the instant. A zero-length occurrence covers only its
   * start.
   *
   * @param instant the instant
   * @return true if {@code start <= instant < end}, or the instant is a zero-length start
   */
  public boolean covers(Instant instant) {
    if (start.equals(end)) {
      return start.equals(instant);
    }
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  /**
   * Checks whether the occurrence shares time with the half-open range {@code [from, to)}. A null
   * bound leaves that side of the range open.
   *
   * @param from the range start, or null
   * @param to the range end, or null
   * @return true if the two overlap
   */
  public boolean overlaps(Instant from, Instant to) {
    boolean beforeEnd = to == null || start.isBefore(to);
    if (start.equals(end)) {
      return beforeEnd && (from == null || !start.isBefore(from));
    }
    return beforeEnd && (from == null || end.isAfter(from));
  }

  @Override
  public String toString() {
    return component.toString() + " @ " + start + (overridden ? " (overridden)" : "");
  }
}
