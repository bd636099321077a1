package io.calrecur.ast;

import io.calrecur.CalendarException;
import io.calrecur.ErrorKind;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Converts raw property values into their typed forms. */
public final class ValueConverter {
  private static final Pattern DATE = Pattern.compile("(\\d{4})(\\d{2})(\\d{2})");
  private static final Pattern DATE_TIME =
      Pattern.compile("(\\d{4})(\\d{2})(\\d{2})T(\\d{2})(\\d{2})(\\d{2})(Z?)");
  private static final Pattern DURATION =
      Pattern.compile(
          "([+-])?P(?:(\\d+)W)?(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?");

  private ValueConverter() {}

  /**
   * Converts a raw value to the given type.
   *
   * @param type the target type
   * @param name the property name, used in error messages
   * @param raw the raw value
   * @param parameters the property parameters (TZID is honored for date-times)
   * @return the typed value
   * @throws CalendarException if the raw value does not match the type's grammar
   */
  public static Object convert(ValueType type, String name, String raw, Parameters parameters)
      throws CalendarException {
    if (raw == null) {
      throw CalendarException.conversion(name, "", "no value");
    }
    String tzid = parameters.first("TZID").orElse(null);
    try {
      return switch (type) {
        case DATE -> parseDate(raw.trim());
        case DATE_TIME -> parseDateTime(raw.trim(), tzid);
        case DATE_TIME_LIST -> parseDateTimeList(raw, tzid);
        case PERIOD_LIST -> parsePeriodList(raw, tzid);
        case DURATION -> parseDuration(raw.trim());
        case INTEGER -> parseInteger(raw.trim());
        case INTEGER_LIST -> parseIntegerList(raw);
        case FLOAT_LIST -> parseFloatList(raw);
        case TEXT -> unescape(raw);
        case TEXT_LIST -> splitText(raw);
        case RECUR -> RecurrenceRule.parse(raw);
      };
    } catch (CalendarException e) {
      if (e.kind() == ErrorKind.RECURRENCE || e.subject().filter(name::equals).isPresent()) {
        throw e;
      }
      throw CalendarException.conversion(name, raw, e.getMessage(), e);
    } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
      throw CalendarException.conversion(name, raw, e.getMessage(), e);
    }
  }

  /**
   * Parses a {@code YYYYMMDD} date.
   *
   * @param s the text
   * @return the date
   * @throws CalendarException if the text is not a valid date
   */
  public static LocalDate parseDate(String s) throws CalendarException {
    Matcher m = DATE.matcher(s);
    if (!m.matches()) {
      throw CalendarException.conversion("DATE", s, "expected YYYYMMDD");
    }
    try {
      return LocalDate.of(
          Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    } catch (DateTimeException e) {
      throw CalendarException.conversion("DATE", s, e.getMessage(), e);
    }
  }

  /**
   * Parses a DATE or DATE-TIME. An eight-digit value is a DATE; a trailing {@code Z} marks UTC,
   * otherwise the value is zoned when a TZID is given and floating when not.
   *
   * @param s the text
   * @param tzid the TZID parameter, may be null
   * @return the value
   * @throws CalendarException if the text is neither a date nor a date-time
   */
  public static DateTimeValue parseDateTime(String s, String tzid) throws CalendarException {
    if (s.length() == 8) {
      return DateTimeValue.date(parseDate(s));
    }
    Matcher m = DATE_TIME.matcher(s);
    if (!m.matches()) {
      throw CalendarException.conversion("DATE-TIME", s, "expected YYYYMMDDTHHMMSS[Z]");
    }
    LocalDateTime local;
    try {
      int second = Math.min(59, Integer.parseInt(m.group(6)));
      local =
          LocalDateTime.of(
              LocalDate.of(
                  Integer.parseInt(m.group(1)),
                  Integer.parseInt(m.group(2)),
                  Integer.parseInt(m.group(3))),
              LocalTime.of(Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)), second));
    } catch (DateTimeException e) {
      throw CalendarException.conversion("DATE-TIME", s, e.getMessage(), e);
    }
    if (!m.group(7).isEmpty()) {
      return DateTimeValue.utc(local);
    }
    if (tzid != null && !tzid.isBlank()) {
      return DateTimeValue.zoned(local, tzid);
    }
    return DateTimeValue.floating(local);
  }

  /**
   * Parses a signed duration such as {@code -P1W} or {@code P1DT2H30M}. Weeks and days are taken
   * as 7 and 1 times 24 hours.
   *
   * @param s the text
   * @return the duration
   * @throws CalendarException if the text is not a duration
   */
  public static Duration parseDuration(String s) throws CalendarException {
    Matcher m = DURATION.matcher(s);
    if (!m.matches() || s.endsWith("P") || s.endsWith("T")) {
      throw CalendarException.conversion("DURATION", s, "expected [+-]P[nW][nD][T[nH][nM][nS]]");
    }
    try {
      Duration d =
          Duration.ofDays(Math.addExact(Math.multiplyExact(7, group(m, 2)), group(m, 3)))
              .plusHours(group(m, 4))
              .plusMinutes(group(m, 5))
              .plusSeconds(group(m, 6));
      return "-".equals(m.group(1)) ? d.negated() : d;
    } catch (ArithmeticException | NumberFormatException e) {
      throw CalendarException.conversion("DURATION", s, "duration out of range", e);
    }
  }

  private static long group(Matcher m, int i) {
    String g = m.group(i);
    return g == null ? 0 : Long.parseLong(g);
  }

  private static Integer parseInteger(String s) {
    return Integer.valueOf(s.startsWith("+") ? s.substring(1) : s);
  }

  private static List<DateTimeValue> parseDateTimeList(String raw, String tzid)
      throws CalendarException {
    List<DateTimeValue> out = new ArrayList<>();
    for (String item : raw.split(",")) {
      if (!item.isBlank()) {
        out.add(parseDateTime(item.trim(), tzid));
      }
    }
    return List.copyOf(out);
  }

  private static List<PeriodValue> parsePeriodList(String raw, String tzid)
      throws CalendarException {
    List<PeriodValue> out = new ArrayList<>();
    for (String item : raw.split(",")) {
      if (item.isBlank()) {
        continue;
      }
      int slash = item.indexOf('/');
      if (slash < 0) {
        throw CalendarException.conversion("PERIOD", item, "expected start/end or start/duration");
      }
      DateTimeValue start = parseDateTime(item.substring(0, slash).trim(), tzid);
      String tail = item.substring(slash + 1).trim();
      if (tail.startsWith("P") || tail.startsWith("+") || tail.startsWith("-")) {
        out.add(new PeriodValue(start, null, parseDuration(tail)));
      } else {
        out.add(new PeriodValue(start, parseDateTime(tail, tzid), null));
      }
    }
    return List.copyOf(out);
  }

  private static List<Integer> parseIntegerList(String raw) {
    List<Integer> out = new ArrayList<>();
    for (String item : raw.split(",")) {
      if (!item.isBlank()) {
        out.add(parseInteger(item.trim()));
      }
    }
    return List.copyOf(out);
  }

  private static List<Double> parseFloatList(String raw) {
    List<Double> out = new ArrayList<>();
    for (String item : raw.split("[,;]")) {
      if (!item.isBlank()) {
        out.add(Double.valueOf(item.trim()));
      }
    }
    return List.copyOf(out);
  }

  /** Splits on unescaped commas, then unescapes each item. */
  private static List<String> splitText(String raw) {
    List<String> out = new ArrayList<>();
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == '\\' && i + 1 < raw.length()) {
        sb.append(c).append(raw.charAt(++i));
      } else if (c == ',') {
        out.add(unescape(sb.toString()));
        sb.setLength(0);
      } else {
        sb.append(c);
      }
    }
    out.add(unescape(sb.toString()));
    return List.copyOf(out);
  }

  /**
   * Removes TEXT escapes: {@code \n}, {@code \N}, {@code \,}, {@code \;} and {@code \\}.
   *
   * @param raw the escaped text
   * @return the plain text
   */
  public static String unescape(String raw) {
    if (raw.indexOf('\\') < 0) {
      return raw;
    }
    StringBuilder sb = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == '\\' && i + 1 < raw.length()) {
        char next = raw.charAt(++i);
        sb.append(next == 'n' || next == 'N' ? '\n' : next);
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
