package io.calrecur.ast;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week with its two-letter recurrence code. */
public enum Weekday {
  MONDAY("MO"),
  TUESDAY("TU"),
  WEDNESDAY("WE"),
  THURSDAY("TH"),
  FRIDAY("FR"),
  SATURDAY("SA"),
  SUNDAY("SU");

  private final String code;

  Weekday(String code) {
    this.code = code;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return ordinal() + 1;
  }

  /**
   * Returns the two-letter code used in recurrence rules.
   *
   * @return the code, e.g. "MO"
   */
  public String code() {
    return code;
  }

  @Override
  public String toString() {
    return code;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.of(
          "MO", MONDAY,
          "TU", TUESDAY,
          "WE", WEDNESDAY,
          "TH", THURSDAY,
          "FR", FRIDAY,
          "SA", SATURDAY,
          "SU", SUNDAY);

  /**
   * Parses a two-letter weekday code (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toUpperCase(Locale.ROOT)));
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.of(number());
  }
}
