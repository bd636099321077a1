package io.calrecur.ast;

import java.util.Locale;
import java.util.Map;

/**
 * The type tag of a component.
 *
 * @param kind the closed variant
 * @param name the literal, upper-cased type name as written after BEGIN
 */
public record ComponentType(Kind kind, String name) {

  /** The closed set of component variants. */
  public enum Kind {
    /** VCALENDAR, the document root. */
    CALENDAR,
    /** VEVENT. */
    EVENT,
    /** VTODO. */
    TODO,
    /** VJOURNAL. */
    JOURNAL,
    /** VFREEBUSY. */
    FREE_BUSY,
    /** VTIMEZONE. */
    TIMEZONE,
    /** STANDARD or DAYLIGHT inside a VTIMEZONE. */
    TIMEZONE_RULE,
    /** VALARM. */
    ALARM,
    /** Any other name, kept literally. */
    UNRECOGNIZED
  }

  public static final ComponentType CALENDAR = new ComponentType(Kind.CALENDAR, "VCALENDAR");
  public static final ComponentType EVENT = new ComponentType(Kind.EVENT, "VEVENT");
  public static final ComponentType TODO = new ComponentType(Kind.TODO, "VTODO");
  public static final ComponentType JOURNAL = new ComponentType(Kind.JOURNAL, "VJOURNAL");
  public static final ComponentType FREE_BUSY = new ComponentType(Kind.FREE_BUSY, "VFREEBUSY");
  public static final ComponentType TIMEZONE = new ComponentType(Kind.TIMEZONE, "VTIMEZONE");
  public static final ComponentType STANDARD = new ComponentType(Kind.TIMEZONE_RULE, "STANDARD");
  public static final ComponentType DAYLIGHT = new ComponentType(Kind.TIMEZONE_RULE, "DAYLIGHT");
  public static final ComponentType ALARM = new ComponentType(Kind.ALARM, "VALARM");

  private static final Map<String, ComponentType> KNOWN =
      Map.of(
          "VCALENDAR", CALENDAR,
          "VEVENT", EVENT,
          "VTODO", TODO,
          "VJOURNAL", JOURNAL,
          "VFREEBUSY", FREE_BUSY,
          "VTIMEZONE", TIMEZONE,
          "STANDARD", STANDARD,
          "DAYLIGHT", DAYLIGHT,
          "VALARM", ALARM);

  /**
   * Resolves a type name (case insensitive). Unknown names yield an UNRECOGNIZED type carrying
   * the literal name.
   *
   * @param name the name after BEGIN or END
   * @return the component type
   */
  public static ComponentType of(String name) {
    String upper = name.trim().toUpperCase(Locale.ROOT);
    ComponentType known = KNOWN.get(upper);
    return known != null ? known : new ComponentType(Kind.UNRECOGNIZED, upper);
  }

  /**
   * Checks whether components of this type carry a schedulable time span and may recur.
   *
   * @return true for events, to-dos and journals
   */
  public boolean isSchedulable() {
    return switch (kind) {
      case EVENT, TODO, JOURNAL -> true;
      case CALENDAR, FREE_BUSY, TIMEZONE, TIMEZONE_RULE, ALARM, UNRECOGNIZED -> false;
    };
  }

  @Override
  public String toString() {
    return name;
  }
}
