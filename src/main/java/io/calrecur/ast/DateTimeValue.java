package io.calrecur.ast;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

/**
 * A DATE or DATE-TIME value as written, before any zone resolution.
 *
 * @param local the wall-clock value; midnight for a DATE
 * @param form how the value is anchored in time
 * @param tzid the TZID parameter (only when form is ZONED)
 */
public record DateTimeValue(LocalDateTime local, Form form, String tzid) {

  /** How a value is anchored in time. */
  public enum Form {
    /** A calendar date without a time of day. */
    DATE,
    /** A wall-clock time not bound to any zone. */
    FLOATING,
    /** A UTC time, written with a trailing {@code Z}. */
    UTC,
    /** A wall-clock time in the zone named by a TZID parameter. */
    ZONED
  }

  /**
   * Creates a DATE value.
   *
   * @param date the date
   * @return a new date value
   */
  public static DateTimeValue date(LocalDate date) {
    return new DateTimeValue(date.atStartOfDay(), Form.DATE, null);
  }

  /**
   * Creates a floating DATE-TIME value.
   *
   * @param local the wall-clock time
   * @return a new floating value
   */
  public static DateTimeValue floating(LocalDateTime local) {
    return new DateTimeValue(local, Form.FLOATING, null);
  }

  /**
   * Creates a UTC DATE-TIME value.
   *
   * @param local the UTC wall-clock time
   * @return a new UTC value
   */
  public static DateTimeValue utc(LocalDateTime local) {
    return new DateTimeValue(local, Form.UTC, null);
  }

  /**
   * Creates a DATE-TIME value bound to a named zone.
   *
   * @param local the wall-clock time
   * @param tzid the zone identifier
   * @return a new zoned value
   */
  public static DateTimeValue zoned(LocalDateTime local, String tzid) {
    return new DateTimeValue(local, Form.ZONED, tzid);
  }

  /**
   * Returns a value of the same form and zone at a different wall-clock time.
   *
   * @param other the new wall-clock time
   * @return a new value
   */
  public DateTimeValue withLocal(LocalDateTime other) {
    LocalDateTime value = form == Form.DATE ? other.toLocalDate().atStartOfDay() : other;
    return new DateTimeValue(value, form, tzid);
  }

  /**
   * Returns the calendar date part.
   *
   * @return the date
   */
  public LocalDate date() {
    return local.toLocalDate();
  }

  /**
   * Returns the time of day; midnight for a DATE.
   *
   * @return the time
   */
  public LocalTime time() {
    return local.toLocalTime();
  }

  /**
   * Checks whether this is a DATE without time.
   *
   * @return true for DATE values
   */
  public boolean isDate() {
    return form == Form.DATE;
  }

  /**
   * Returns the TZID, if the value is zoned.
   *
   * @return the zone identifier, or empty
   */
  public Optional<String> zone() {
    return Optional.ofNullable(tzid);
  }

  @Override
  public String toString() {
    return switch (form) {
      case DATE -> date().toString();
      case FLOATING -> local.toString();
      case UTC -> local + "Z";
      case ZONED -> local + "[" + tzid + "]";
    };
  }
}
