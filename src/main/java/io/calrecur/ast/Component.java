package io.calrecur.ast;

import io.calrecur.CalendarException;
import io.calrecur.Span;
import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A BEGIN/END block: a typed node with ordered properties and ordered child components.
 *
 * <p>Duplicate property names are kept in insertion order. The parent link is a weak, non-owning
 * reference; the parent owns its children. Components are only mutated while the tree is built.
 */
public final class Component {
  private final ComponentType type;
  private final Span span;
  private final WeakReference<Component> parent;
  private final List<Property> properties = new ArrayList<>();
  private final List<Component> children = new ArrayList<>();

  private Component(ComponentType type, Component parent, Span span) {
    this.type = type;
    this.span = span;
    this.parent = parent == null ? null : new WeakReference<>(parent);
  }

  /**
   * Creates a root component.
   *
   * @param type the component type
   * @return a component without parent
   */
  public static Component root(ComponentType type) {
    return new Component(type, null, null);
  }

  /**
   * Creates a root component remembering where it was opened.
   *
   * @param type the component type
   * @param span the BEGIN line
   * @return a component without parent
   */
  public static Component root(ComponentType type, Span span) {
    return new Component(type, null, span);
  }

  /**
   * Creates a child of this component and appends it.
   *
   * @param childType the child's type
   * @param childSpan the BEGIN line, may be null
   * @return the new child
   */
  public Component addChild(ComponentType childType, Span childSpan) {
    Component child = new Component(childType, this, childSpan);
    children.add(child);
    return child;
  }

  /**
   * Appends a property, duplicates included.
   *
   * @param property the property
   * @return this component
   */
  public Component addProperty(Property property) {
    properties.add(property);
    return this;
  }

  /**
   * Appends a parameterless property.
   *
   * @param name the property name
   * @param value the raw value
   * @return this component
   */
  public Component addProperty(String name, String value) {
    return addProperty(Property.of(name, value));
  }

  public ComponentType type() {
    return type;
  }

  public Span span() {
    return span;
  }

  /**
   * Returns the parent, if it is still reachable.
   *
   * @return the parent, empty for the root
   */
  public Optional<Component> parent() {
    return parent == null ? Optional.empty() : Optional.ofNullable(parent.get());
  }

  /**
   * Returns all properties in insertion order.
   *
   * @return an unmodifiable view
   */
  public List<Property> properties() {
    return Collections.unmodifiableList(properties);
  }

  /**
   * Returns all properties with the given name, in insertion order.
   *
   * @param name the property name, any case
   * @return the matching properties
   */
  public List<Property> propertiesNamed(String name) {
    List<Property> out = new ArrayList<>();
    for (Property p : properties) {
      if (p.isNamed(name)) {
        out.add(p);
      }
    }
    return out;
  }

  /**
   * Returns the first property with the given name.
   *
   * @param name the property name, any case
   * @return the property, or empty
   */
  public Optional<Property> property(String name) {
    for (Property p : properties) {
      if (p.isNamed(name)) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the first property with the given name or fails.
   *
   * @param name the property name, any case
   * @return the property
   * @throws CalendarException if the property is absent
   */
  public Property requiredProperty(String name) throws CalendarException {
    return property(name).orElseThrow(() -> CalendarException.missingProperty(type.name(), name));
  }

  /**
   * Returns the typed value of the {@code index}-th property with the given name. The conversion
   * is done once per property and memoized.
   *
   * @param name the property name, any case
   * @param index the 0-based index among properties of that name
   * @return the typed value
   * @throws CalendarException if the property is absent or cannot be converted
   */
  public Object typed(String name, int index) throws CalendarException {
    List<Property> named = propertiesNamed(name);
    if (index < 0 || index >= named.size()) {
      throw CalendarException.missingProperty(type.name(), name + "[" + index + "]");
    }
    return named.get(index).typedValue();
  }

  /**
   * Returns the typed value of the first property with the given name.
   *
   * @param name the property name, any case
   * @return the typed value
   * @throws CalendarException if the property is absent or cannot be converted
   */
  public Object typed(String name) throws CalendarException {
    return typed(name, 0);
  }

  /**
   * Returns all child components in order.
   *
   * @return an unmodifiable view
   */
  public List<Component> children() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Returns the direct children of the given kind.
   *
   * @param kind the component kind
   * @return the matching children in order
   */
  public List<Component> childrenOfType(ComponentType.Kind kind) {
    List<Component> out = new ArrayList<>();
    for (Component c : children) {
      if (c.type.kind() == kind) {
        out.add(c);
      }
    }
    return out;
  }

  /**
   * Returns the direct children with the given type name.
   *
   * @param typeName the type name, e.g. "VEVENT" or an unrecognized "X-FOO"
   * @return the matching children in order
   */
  public List<Component> childrenOfType(String typeName) {
    ComponentType wanted = ComponentType.of(typeName);
    List<Component> out = new ArrayList<>();
    for (Component c : children) {
      if (c.type.equals(wanted)) {
        out.add(c);
      }
    }
    return out;
  }

  public Optional<String> uid() {
    return property("UID").map(Property::asText);
  }

  public Optional<String> summary() {
    return property("SUMMARY").map(Property::asText);
  }

  /**
   * Returns DTSTART.
   *
   * @return the start, or empty if absent
   * @throws CalendarException if DTSTART is malformed
   */
  public Optional<DateTimeValue> start() throws CalendarException {
    Optional<Property> p = property("DTSTART");
    return p.isPresent() ? Optional.of(p.get().asDateTime()) : Optional.empty();
  }

  /**
   * Returns the explicit end: DTEND, DUE for to-dos, DTSTART for journals.
   *
   * @return the end, or empty if none is written
   * @throws CalendarException if the end property is malformed
   */
  public Optional<DateTimeValue> end() throws CalendarException {
    String endName =
        switch (type.kind()) {
          case TODO -> "DUE";
          case JOURNAL -> "DTSTART";
          case CALENDAR, EVENT, FREE_BUSY, TIMEZONE, TIMEZONE_RULE, ALARM, UNRECOGNIZED -> "DTEND";
        };
    Optional<Property> p = property(endName);
    return p.isPresent() ? Optional.of(p.get().asDateTime()) : Optional.empty();
  }

  /**
   * Returns the DURATION property.
   *
   * @return the explicit duration, or empty
   * @throws CalendarException if DURATION is malformed
   */
  public Optional<Duration> explicitDuration() throws CalendarException {
    Optional<Property> p = property("DURATION");
    return p.isPresent() ? Optional.of(p.get().asDuration()) : Optional.empty();
  }

  /**
   * Computes the wall-clock duration: DURATION, else end minus start, else one day for an
   * all-day event, else zero.
   *
   * @return the duration
   * @throws CalendarException if a time property is malformed
   */
  public Duration duration() throws CalendarException {
    if (type.kind() == ComponentType.Kind.JOURNAL) {
      return Duration.ZERO;
    }
    Optional<Duration> explicit = explicitDuration();
    if (explicit.isPresent()) {
      return explicit.get();
    }
    Optional<DateTimeValue> start = start();
    Optional<DateTimeValue> end = end();
    if (start.isPresent() && end.isPresent()) {
      return Duration.between(start.get().local(), end.get().local());
    }
    if (start.isPresent() && start.get().isDate() && type.kind() == ComponentType.Kind.EVENT) {
      return Duration.ofDays(1);
    }
    return Duration.ZERO;
  }

  /**
   * Returns RECURRENCE-ID.
   *
   * @return the identified original instance, or empty
   * @throws CalendarException if RECURRENCE-ID is malformed
   */
  public Optional<DateTimeValue> recurrenceId() throws CalendarException {
    Optional<Property> p = property("RECURRENCE-ID");
    return p.isPresent() ? Optional.of(p.get().asDateTime()) : Optional.empty();
  }

  /**
   * Checks whether this component defines a recurrence set.
   *
   * @return true if it has an RRULE or RDATE
   */
  public boolean isRecurring() {
    return property("RRULE").isPresent() || property("RDATE").isPresent();
  }

  /**
   * Checks whether this component overrides one instance of a series.
   *
   * @return true if it has a RECURRENCE-ID
   */
  public boolean isOverride() {
    return property("RECURRENCE-ID").isPresent();
  }

  /**
   * Returns the type path from the root, e.g. {@code VCALENDAR/VEVENT/VALARM}.
   *
   * @return the path
   */
  public String path() {
    return parent().map(p -> p.path() + "/").orElse("") + type.name();
  }

  @Override
  public String toString() {
    return type.name()
        + uid().map(u -> "(" + u + ")").orElse("")
        + summary().map(s -> ": " + s).orElse("");
  }
}
