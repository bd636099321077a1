package io.calrecur.ast;

import java.util.Locale;
import java.util.Map;

/** The typed form a raw property value converts to. */
public enum ValueType {
  /** A {@code YYYYMMDD} date, as {@link java.time.LocalDate}. */
  DATE,
  /** A DATE or DATE-TIME, as {@link DateTimeValue}. */
  DATE_TIME,
  /** A comma-separated list of DATE or DATE-TIME values, as {@code List<DateTimeValue>}. */
  DATE_TIME_LIST,
  /** A comma-separated list of periods, as {@code List<PeriodValue>}. */
  PERIOD_LIST,
  /** A signed duration, as {@link java.time.Duration}. */
  DURATION,
  /** A single integer, as {@link Integer}. */
  INTEGER,
  /** A comma-separated list of integers, as {@code List<Integer>}. */
  INTEGER_LIST,
  /** A comma or semicolon separated list of floats, as {@code List<Double>}. */
  FLOAT_LIST,
  /** Unescaped text, as {@link String}. */
  TEXT,
  /** A comma-separated list of unescaped texts, as {@code List<String>}. */
  TEXT_LIST,
  /** A recurrence rule, as {@link RecurrenceRule}. */
  RECUR;

  private static final Map<String, ValueType> BY_PROPERTY =
      Map.ofEntries(
          Map.entry("DTSTART", DATE_TIME),
          Map.entry("DTEND", DATE_TIME),
          Map.entry("DUE", DATE_TIME),
          Map.entry("DTSTAMP", DATE_TIME),
          Map.entry("CREATED", DATE_TIME),
          Map.entry("LAST-MODIFIED", DATE_TIME),
          Map.entry("COMPLETED", DATE_TIME),
          Map.entry("RECURRENCE-ID", DATE_TIME),
          Map.entry("RDATE", DATE_TIME_LIST),
          Map.entry("EXDATE", DATE_TIME_LIST),
          Map.entry("FREEBUSY", PERIOD_LIST),
          Map.entry("DURATION", DURATION),
          Map.entry("TRIGGER", DURATION),
          Map.entry("RRULE", RECUR),
          Map.entry("EXRULE", RECUR),
          Map.entry("SEQUENCE", INTEGER),
          Map.entry("PRIORITY", INTEGER),
          Map.entry("REPEAT", INTEGER),
          Map.entry("PERCENT-COMPLETE", INTEGER),
          Map.entry("GEO", FLOAT_LIST),
          Map.entry("CATEGORIES", TEXT_LIST),
          Map.entry("RESOURCES", TEXT_LIST));

  /**
   * Determines the natural typed form of a property from its name and VALUE parameter.
   *
   * @param name the property name
   * @param parameters the property parameters
   * @return the value type, TEXT when nothing more specific applies
   */
  public static ValueType forProperty(String name, Parameters parameters) {
    String upper = name.toUpperCase(Locale.ROOT);
    boolean list = upper.equals("RDATE") || upper.equals("EXDATE");
    String declared = parameters.first("VALUE").map(v -> v.toUpperCase(Locale.ROOT)).orElse("");
    switch (declared) {
      case "PERIOD":
        return PERIOD_LIST;
      case "DATE":
        return list ? DATE_TIME_LIST : DATE;
      case "DATE-TIME":
        return list ? DATE_TIME_LIST : DATE_TIME;
      case "DURATION":
        return DURATION;
      case "INTEGER":
        return INTEGER;
      case "RECUR":
        return RECUR;
      case "FLOAT":
        return FLOAT_LIST;
      default:
        break;
    }
    return BY_PROPERTY.getOrDefault(upper, TEXT);
  }
}
