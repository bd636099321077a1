package io.calrecur.ast;

import io.calrecur.CalendarException;
import io.calrecur.Span;
import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A named property of a component: raw value, parameters, and a lazily converted typed value.
 *
 * <p>The typed value is computed on the first typed read and memoized, including a conversion
 * failure. Each value type is converted at most once per property, also under concurrent reads.
 */
public final class Property {
  private final String name;
  private final Parameters parameters;
  private final String value;
  private final Span span;

  private final Map<ValueType, Conversion> memo = new EnumMap<>(ValueType.class);
  private int conversions;

  /**
   * Creates a property.
   *
   * @param name the property name, any case
   * @param parameters the parameters
   * @param value the raw value
   * @param span the physical lines it was read from, may be null
   */
  public Property(String name, Parameters parameters, String value, Span span) {
    this.name = name.toUpperCase(Locale.ROOT);
    this.parameters = parameters == null ? Parameters.empty() : parameters;
    this.value = value;
    this.span = span;
  }

  /**
   * Creates a property without parameters, mostly for tests.
   *
   * @param name the property name
   * @param value the raw value
   * @return the property
   */
  public static Property of(String name, String value) {
    return new Property(name, Parameters.empty(), value, null);
  }

  /**
   * Returns the upper-cased property name.
   *
   * @return the name
   */
  public String name() {
    return name;
  }

  /**
   * Returns the parameters.
   *
   * @return the parameters
   */
  public Parameters parameters() {
    return parameters;
  }

  /**
   * Returns the raw value exactly as read, escapes included.
   *
   * @return the raw value
   */
  public String value() {
    return value;
  }

  /**
   * Returns where the property was read from.
   *
   * @return the span, null for properties built in code
   */
  public Span span() {
    return span;
  }

  /**
   * Checks whether this property has the given name.
   *
   * @param other the name to compare, any case
   * @return true if the names match ignoring case
   */
  public boolean isNamed(String other) {
    return name.equalsIgnoreCase(other);
  }

  /**
   * Returns the natural value type of this property.
   *
   * @return the value type
   */
  public ValueType valueType() {
    return ValueType.forProperty(name, parameters);
  }

  /**
   * Returns the value converted to its natural type.
   *
   * @return the typed value
   * @throws CalendarException if the raw value cannot be converted
   */
  public Object typedValue() throws CalendarException {
    return typed(valueType());
  }

  /**
   * Returns the value converted to the given type, memoized.
   *
   * @param type the value type
   * @return the typed value
   * @throws CalendarException if the raw value cannot be converted
   */
  public Object typed(ValueType type) throws CalendarException {
    Conversion c;
    synchronized (this) {
      c = memo.get(type);
      if (c == null) {
        c = Conversion.run(type, this);
        conversions++;
        memo.put(type, c);
      }
    }
    return c.get();
  }

  /**
   * Returns the value as a DATE or DATE-TIME.
   *
   * @return the date-time value
   * @throws CalendarException if the raw value is not a date or date-time
   */
  public DateTimeValue asDateTime() throws CalendarException {
    return (DateTimeValue) typed(ValueType.DATE_TIME);
  }

  /**
   * Returns the value as a strict DATE.
   *
   * @return the date
   * @throws CalendarException if the raw value is not a date
   */
  public LocalDate asDate() throws CalendarException {
    return (LocalDate) typed(ValueType.DATE);
  }

  /**
   * Returns the value as a list of DATE or DATE-TIME values.
   *
   * @return the values
   * @throws CalendarException if any item is malformed
   */
  public List<DateTimeValue> asDateTimeList() throws CalendarException {
    return listOf(typed(ValueType.DATE_TIME_LIST), DateTimeValue.class);
  }

  /**
   * Returns the value as a list of periods.
   *
   * @return the periods
   * @throws CalendarException if any item is malformed
   */
  public List<PeriodValue> asPeriodList() throws CalendarException {
    return listOf(typed(ValueType.PERIOD_LIST), PeriodValue.class);
  }

  /**
   * Returns the value as a duration.
   *
   * @return the duration
   * @throws CalendarException if the raw value is not a duration
   */
  public Duration asDuration() throws CalendarException {
    return (Duration) typed(ValueType.DURATION);
  }

  /**
   * Returns the value as an integer.
   *
   * @return the integer
   * @throws CalendarException if the raw value is not an integer
   */
  public int asInteger() throws CalendarException {
    return (Integer) typed(ValueType.INTEGER);
  }

  /**
   * Returns the value as a list of integers.
   *
   * @return the integers
   * @throws CalendarException if any item is not an integer
   */
  public List<Integer> asIntegerList() throws CalendarException {
    return listOf(typed(ValueType.INTEGER_LIST), Integer.class);
  }

  /**
   * Returns the value as a list of floats.
   *
   * @return the floats
   * @throws CalendarException if any item is not a number
   */
  public List<Double> asFloatList() throws CalendarException {
    return listOf(typed(ValueType.FLOAT_LIST), Double.class);
  }

  /**
   * Returns the value as unescaped text.
   *
   * @return the text
   */
  public String asText() {
    return ValueConverter.unescape(value == null ? "" : value);
  }

  /**
   * Returns the value as a list of unescaped texts.
   *
   * @return the texts
   * @throws CalendarException never in practice, text lists always convert
   */
  public List<String> asTextList() throws CalendarException {
    return listOf(typed(ValueType.TEXT_LIST), String.class);
  }

  /**
   * Returns the value as a recurrence rule.
   *
   * @return the rule
   * @throws CalendarException if the rule definition is invalid
   */
  public RecurrenceRule asRecurrenceRule() throws CalendarException {
    return (RecurrenceRule) typed(ValueType.RECUR);
  }

  private static <T> List<T> listOf(Object value, Class<T> element) {
    return ((List<?>) value).stream().map(element::cast).toList();
  }

  /** Number of conversions actually performed, for cache verification. */
  synchronized int conversions() {
    return conversions;
  }

  @Override
  public String toString() {
    return name + (parameters.isEmpty() ? "" : parameters.toString()) + ":" + value;
  }

  /** The memoized outcome of one conversion. */
  private record Conversion(ValueType type, Object value, CalendarException error) {
    static Conversion run(ValueType type, Property p) {
      try {
        return new Conversion(
            type, ValueConverter.convert(type, p.name, p.value, p.parameters), null);
      } catch (CalendarException e) {
        return new Conversion(type, null, e);
      }
    }

    Object get() throws CalendarException {
      if (error != null) {
        throw error;
      }
      return value;
    }
  }
}
