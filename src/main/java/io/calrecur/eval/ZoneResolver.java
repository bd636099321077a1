package io.calrecur.eval;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Resolves the UTC offset of a named zone at a given instant. Zone databases and DST transition
 * rules live behind this interface; the engine only asks for offsets.
 */
@FunctionalInterface
public interface ZoneResolver {

  /** How far around a wall time the offsets before and after a transition are sampled. */
  Duration TRANSITION_REACH = Duration.ofHours(18);

  /**
   * Returns the offset in force in the zone at the instant.
   *
   * @param zoneId the zone identifier, typically a TZID parameter value
   * @param instant the instant
   * @return the offset
   */
  ZoneOffset offsetAt(String zoneId, Instant instant);

  /**
   * Maps a wall-clock time in the zone to an instant. In an overlap the earlier offset wins; a
   * time in a gap is pushed forward by the gap length. At most one transition is assumed within
   * 18 hours of the wall time.
   *
   * @param local the wall-clock time
   * @param zoneId the zone identifier
   * @return the instant
   */
  default Instant toInstant(LocalDateTime local, String zoneId) {
    Instant asUtc = local.toInstant(ZoneOffset.UTC);
    ZoneOffset before = offsetAt(zoneId, asUtc.minus(TRANSITION_REACH));
    ZoneOffset after = offsetAt(zoneId, asUtc.plus(TRANSITION_REACH));
    Instant early = local.toInstant(before);
    if (before.equals(after) || offsetAt(zoneId, early).equals(before)) {
      return early;
    }
    Instant late = local.toInstant(after);
    if (offsetAt(zoneId, late).equals(after)) {
      return late;
    }
    return early;
  }

  /**
   * Maps an instant to the wall-clock time of the zone.
   *
   * @param instant the instant
   * @param zoneId the zone identifier
   * @return the wall-clock time
   */
  default LocalDateTime toLocal(Instant instant, String zoneId) {
    return LocalDateTime.ofInstant(instant, offsetAt(zoneId, instant));
  }
}
