package io.calrecur.ast;

import io.calrecur.CalendarException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Represents a parsed RRULE or EXRULE value.
 *
 * @param freq the base cadence
 * @param interval the number of cadence steps between periods, at least 1
 * @param count the number of occurrences to produce, 0 when unbounded by count
 * @param until the inclusive last instant, null when unbounded by date
 * @param bySecond BYSECOND values (0-59)
 * @param byMinute BYMINUTE values (0-59)
 * @param byHour BYHOUR values (0-23)
 * @param byDay BYDAY entries
 * @param byMonthDay BYMONTHDAY values (1..31 or -31..-1)
 * @param byYearDay BYYEARDAY values (1..366 or -366..-1)
 * @param byWeekNo BYWEEKNO values (1..53 or -53..-1)
 * @param byMonth BYMONTH values (1-12)
 * @param bySetPos BYSETPOS values (1..366 or -366..-1)
 * @param weekStart the WKST day, Monday by default
 */
public record RecurrenceRule(
    Frequency freq,
    int interval,
    int count,
    DateTimeValue until,
    List<Integer> bySecond,
    List<Integer> byMinute,
    List<Integer> byHour,
    List<WeekdayNum> byDay,
    List<Integer> byMonthDay,
    List<Integer> byYearDay,
    List<Integer> byWeekNo,
    List<Integer> byMonth,
    List<Integer> bySetPos,
    Weekday weekStart) {

  /** Creates a new RecurrenceRule with defensive copies of lists. */
  public RecurrenceRule {
    bySecond = copy(bySecond);
    byMinute = copy(byMinute);
    byHour = copy(byHour);
    byDay = byDay == null ? List.of() : List.copyOf(byDay);
    byMonthDay = copy(byMonthDay);
    byYearDay = copy(byYearDay);
    byWeekNo = copy(byWeekNo);
    byMonth = copy(byMonth);
    bySetPos = copy(bySetPos);
    weekStart = weekStart == null ? Weekday.MONDAY : weekStart;
  }

  /**
   * Creates a rule with just a frequency.
   *
   * @param freq the frequency
   * @return a new rule with interval 1 and no filters
   */
  public static RecurrenceRule of(Frequency freq) {
    return new RecurrenceRule(
        freq, 1, 0, null, null, null, null, null, null, null, null, null, null, null);
  }

  /**
   * Returns a copy with the specified until instant.
   *
   * @param until the until value
   * @return a new rule with the updated until
   */
  public RecurrenceRule withUntil(DateTimeValue until) {
    return new RecurrenceRule(
        freq, interval, count, until, bySecond, byMinute, byHour, byDay, byMonthDay, byYearDay,
        byWeekNo, byMonth, bySetPos, weekStart);
  }

  /**
   * Returns the until value, if any.
   *
   * @return the until value
   */
  public Optional<DateTimeValue> untilValue() {
    return Optional.ofNullable(until);
  }

  /**
   * Checks whether the rule terminates on its own.
   *
   * @return true when COUNT or UNTIL is set
   */
  public boolean isBounded() {
    return count > 0 || until != null;
  }

  /**
   * Parses a recurrence rule value such as {@code FREQ=WEEKLY;BYDAY=MO,WE;COUNT=10}.
   *
   * <p>Keys are case insensitive and unknown keys are ignored. A rule with both COUNT and UNTIL,
   * without FREQ, or with a by-field value out of range is rejected.
   *
   * @param text the rule text
   * @return the parsed rule
   * @throws CalendarException if the rule definition is invalid
   */
  public static RecurrenceRule parse(String text) throws CalendarException {
    if (text == null || text.isBlank()) {
      throw CalendarException.recurrence("empty recurrence rule", text);
    }

    Frequency freq = null;
    int interval = 1;
    int count = 0;
    boolean hasCount = false;
    DateTimeValue until = null;
    List<Integer> bySecond = null;
    List<Integer> byMinute = null;
    List<Integer> byHour = null;
    List<WeekdayNum> byDay = null;
    List<Integer> byMonthDay = null;
    List<Integer> byYearDay = null;
    List<Integer> byWeekNo = null;
    List<Integer> byMonth = null;
    List<Integer> bySetPos = null;
    Weekday weekStart = null;

    for (String part : text.trim().split(";")) {
      if (part.isBlank()) {
        continue;
      }
      int eq = part.indexOf('=');
      if (eq < 0) {
        throw CalendarException.recurrence("expected KEY=VALUE, got '" + part + "'", text);
      }
      String key = part.substring(0, eq).trim().toUpperCase(Locale.ROOT);
      String value = part.substring(eq + 1).trim();
      switch (key) {
        case "FREQ" ->
            freq =
                Frequency.parse(value)
                    .orElseThrow(() -> CalendarException.recurrence("unknown FREQ " + value, text));
        case "INTERVAL" -> {
          interval = parseInt(key, value, text);
          if (interval < 1) {
            throw CalendarException.recurrence("INTERVAL must be positive", text);
          }
        }
        case "COUNT" -> {
          count = parseInt(key, value, text);
          hasCount = true;
          if (count < 1) {
            throw CalendarException.recurrence("COUNT must be positive", text);
          }
        }
        case "UNTIL" -> {
          try {
            until = ValueConverter.parseDateTime(value, null);
          } catch (CalendarException e) {
            throw CalendarException.recurrence("invalid UNTIL " + value, text);
          }
        }
        case "BYSECOND" -> bySecond = parseInts(key, value, text, 0, 60, false);
        case "BYMINUTE" -> byMinute = parseInts(key, value, text, 0, 59, false);
        case "BYHOUR" -> byHour = parseInts(key, value, text, 0, 23, false);
        case "BYMONTHDAY" -> byMonthDay = parseInts(key, value, text, 1, 31, true);
        case "BYYEARDAY" -> byYearDay = parseInts(key, value, text, 1, 366, true);
        case "BYWEEKNO" -> byWeekNo = parseInts(key, value, text, 1, 53, true);
        case "BYMONTH" -> byMonth = parseInts(key, value, text, 1, 12, false);
        case "BYSETPOS" -> bySetPos = parseInts(key, value, text, 1, 366, true);
        case "BYDAY" -> byDay = parseByDay(value, text);
        case "WKST" ->
            weekStart =
                Weekday.parse(value)
                    .orElseThrow(() -> CalendarException.recurrence("unknown WKST " + value, text));
        default -> {
          // X-names and unsupported extensions are ignored.
        }
      }
    }

    if (freq == null) {
      throw CalendarException.recurrence("missing FREQ", text);
    }
    if (hasCount && until != null) {
      throw CalendarException.recurrence("COUNT and UNTIL are mutually exclusive", text);
    }
    return new RecurrenceRule(
        freq, interval, count, until, bySecond, byMinute, byHour, byDay, byMonthDay, byYearDay,
        byWeekNo, byMonth, bySetPos, weekStart);
  }

  private static int parseInt(String key, String value, String text) throws CalendarException {
    try {
      return Integer.parseInt(value.startsWith("+") ? value.substring(1) : value);
    } catch (NumberFormatException e) {
      throw CalendarException.recurrence(key + " is not a number: " + value, text);
    }
  }

  private static List<Integer> parseInts(
      String key, String value, String text, int min, int max, boolean signed)
      throws CalendarException {
    List<Integer> out = new ArrayList<>();
    for (String item : value.split(",")) {
      int n = parseInt(key, item.trim(), text);
      int magnitude = signed ? Math.abs(n) : n;
      if (magnitude < min || magnitude > max || (!signed && n < 0)) {
        throw CalendarException.recurrence(key + " value out of range: " + n, text);
      }
      out.add(n);
    }
    return out;
  }

  private static List<WeekdayNum> parseByDay(String value, String text) throws CalendarException {
    List<WeekdayNum> out = new ArrayList<>();
    for (String item : value.split(",")) {
      WeekdayNum wd =
          WeekdayNum.parse(item)
              .orElseThrow(() -> CalendarException.recurrence("invalid BYDAY " + item, text));
      if (Math.abs(wd.ordinal()) > 53) {
        throw CalendarException.recurrence("BYDAY ordinal out of range: " + item, text);
      }
      out.add(wd);
    }
    return out;
  }

  private static List<Integer> copy(List<Integer> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("FREQ=").append(freq);
    if (interval != 1) {
      sb.append(";INTERVAL=").append(interval);
    }
    if (count > 0) {
      sb.append(";COUNT=").append(count);
    }
    if (until != null) {
      sb.append(";UNTIL=").append(until);
    }
    append(sb, "BYMONTH", byMonth);
    append(sb, "BYWEEKNO", byWeekNo);
    append(sb, "BYYEARDAY", byYearDay);
    append(sb, "BYMONTHDAY", byMonthDay);
    append(sb, "BYDAY", byDay);
    append(sb, "BYHOUR", byHour);
    append(sb, "BYMINUTE", byMinute);
    append(sb, "BYSECOND", bySecond);
    append(sb, "BYSETPOS", bySetPos);
    if (weekStart != Weekday.MONDAY) {
      sb.append(";WKST=").append(weekStart.code());
    }
    return sb.toString();
  }

  private static void append(StringBuilder sb, String key, List<?> values) {
    if (values.isEmpty()) {
      return;
    }
    sb.append(';').append(key).append('=');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(values.get(i));
    }
  }
}
