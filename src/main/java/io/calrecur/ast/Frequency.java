package io.calrecur.ast;

import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/** The base cadence of a recurrence rule, finest first. */
public enum Frequency {
  SECONDLY(ChronoUnit.SECONDS),
  MINUTELY(ChronoUnit.MINUTES),
  HOURLY(ChronoUnit.HOURS),
  DAILY(ChronoUnit.DAYS),
  WEEKLY(ChronoUnit.WEEKS),
  MONTHLY(ChronoUnit.MONTHS),
  YEARLY(ChronoUnit.YEARS);

  private final ChronoUnit unit;

  Frequency(ChronoUnit unit) {
    this.unit = unit;
  }

  /**
   * Returns the temporal unit one cadence step advances by.
   *
   * @return the chrono unit
   */
  public ChronoUnit unit() {
    return unit;
  }

  /**
   * Checks whether this frequency is strictly coarser than another one.
   *
   * @param other the other frequency
   * @return true if this cadence is longer
   */
  public boolean isCoarserThan(Frequency other) {
    return compareTo(other) > 0;
  }

  /**
   * Parses a FREQ value (case insensitive).
   *
   * @param s the string to parse
   * @return the frequency if valid
   */
  public static Optional<Frequency> parse(String s) {
    try {
      return Optional.of(valueOf(s.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
