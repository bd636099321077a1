package io.calrecur.ast;

import java.util.Optional;

/**
 * A BYDAY entry: a weekday with an optional ordinal, e.g. {@code MO}, {@code 1MO} or {@code -1FR}.
 *
 * @param ordinal the position within the month or year (negative counts from the end), 0 for
 *     every such weekday
 * @param day the weekday
 */
public record WeekdayNum(int ordinal, Weekday day) {

  /**
   * Creates an entry matching every occurrence of the weekday.
   *
   * @param day the weekday
   * @return a new entry without ordinal
   */
  public static WeekdayNum every(Weekday day) {
    return new WeekdayNum(0, day);
  }

  /**
   * Checks whether this entry carries an ordinal.
   *
   * @return true if the ordinal is non-zero
   */
  public boolean hasOrdinal() {
    return ordinal != 0;
  }

  /**
   * Parses a BYDAY entry.
   *
   * @param s the string to parse, e.g. "+2TU"
   * @return the entry if well formed; the ordinal range is checked by the rule
   */
  public static Optional<WeekdayNum> parse(String s) {
    String t = s.trim();
    if (t.length() < 2) {
      return Optional.empty();
    }
    Optional<Weekday> day = Weekday.parse(t.substring(t.length() - 2));
    if (day.isEmpty()) {
      return Optional.empty();
    }
    String num = t.substring(0, t.length() - 2);
    if (num.isEmpty()) {
      return Optional.of(every(day.get()));
    }
    try {
      int n = Integer.parseInt(num.startsWith("+") ? num.substring(1) : num);
      return n == 0 ? Optional.empty() : Optional.of(new WeekdayNum(n, day.get()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  @Override
  public String toString() {
    return (ordinal == 0 ? "" : Integer.toString(ordinal)) + day.code();
  }
}
