package io.calrecur.timeline;

import io.calrecur.CalendarException;
import io.calrecur.ErrorKind;
import io.calrecur.ast.Component;
import io.calrecur.ast.ComponentType;
import io.calrecur.ast.DateTimeValue;
import io.calrecur.ast.PeriodValue;
import io.calrecur.ast.Property;
import io.calrecur.eval.MergingIterator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes the occurrences of a set of components over time windows.
 *
 * <p>Events, to-dos and journals are grouped by UID: a component with a RECURRENCE-ID overrides
 * one instance of the series of the first component with the same UID and no RECURRENCE-ID. An
 * override with no such series is an occurrence of its own, marked overridden. Every FREEBUSY
 * period of a free/busy component is an occurrence. A VCALENDAR contributes its children.
 *
 * <p>Windows are inclusive at the start and, unless {@link TimelineOptions#inclusiveEnd()} is set,
 * exclusive at the end. Occurrences come out ascending by start; ties keep the order in which the
 * components were supplied. Queries are lazy and share no state, so a timeline can be queried
 * repeatedly and from several threads.
 *
 * <p>A component whose series cannot be resolved at all (no DTSTART, malformed DTSTART) is logged
 * and left out.
 */
public final class Timeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(Timeline.class);
  private static final Comparator<Occurrence> BY_START = Comparator.comparing(Occurrence::start);

  private final List<Source> sources;
  private final TimelineOptions options;

  /** A lazily resolved group of occurrences with starts in {@code [from, to]}. */
  @FunctionalInterface
  private interface Source {
    Stream<Occurrence> occurrences(Instant from, Instant to);
  }

  private Timeline(List<Source> sources, TimelineOptions options) {
    this.sources = List.copyOf(sources);
    this.options = options;
  }

  /**
   * Creates a timeline over the given components with default options.
   *
   * @param components calendars or schedulable components
   * @return a new timeline
   */
  public static Timeline of(List<Component> components) {
    return of(components, TimelineOptions.defaults());
  }

  /**
   * Creates a timeline over the given components.
   *
   * @param components calendars or schedulable components
   * @param options zone and window settings
   * @return a new timeline
   */
  public static Timeline of(List<Component> components, TimelineOptions options) {
    List<Component> flat = new ArrayList<>();
    for (Component c : components) {
      if (c.type().kind() == ComponentType.Kind.CALENDAR) {
        flat.addAll(c.children());
      } else {
        flat.add(c);
      }
    }

    Set<String> masterUids = new HashSet<>();
    Map<String, List<Component>> overridesByUid = new HashMap<>();
    for (Component c : flat) {
      if (!c.type().isSchedulable()) {
        continue;
      }
      Optional<String> uid = c.uid();
      if (uid.isEmpty()) {
        continue;
      }
      if (c.isOverride()) {
        overridesByUid.computeIfAbsent(uid.get(), k -> new ArrayList<>()).add(c);
      } else {
        masterUids.add(uid.get());
      }
    }

    List<Source> sources = new ArrayList<>();
    Set<String> claimed = new HashSet<>();
    for (Component c : flat) {
      switch (c.type().kind()) {
        case EVENT, TODO, JOURNAL -> {
          Optional<String> uid = c.uid();
          if (c.isOverride()) {
            if (uid.isEmpty() || !masterUids.contains(uid.get())) {
              orphan(c, options).ifPresent(sources::add);
            }
          } else {
            List<Component> overrides =
                uid.filter(claimed::add)
                    .map(u -> overridesByUid.getOrDefault(u, List.of()))
                    .orElse(List.of());
            series(c, overrides, options).ifPresent(sources::add);
          }
        }
        case FREE_BUSY -> sources.add(freeBusy(c, options));
        case CALENDAR, TIMEZONE, TIMEZONE_RULE, ALARM, UNRECOGNIZED -> {}
      }
    }
    return new Timeline(sources, options);
  }

  public TimelineOptions options() {
    return options;
  }

  /**
   * Returns the occurrences that start within the window.
   *
   * @param start the window start, inclusive, or null for no lower bound
   * @param end the window end, or null for no upper bound
   * @return an ascending stream of occurrences; infinite for an unbounded series and no end
   * @throws IllegalArgumentException if {@code start} is after {@code end}
   */
  public Stream<Occurrence> query(Instant start, Instant end) {
    checkWindow(start, end);
    Stream<Occurrence> all = merged(start, end);
    if (end != null && !options.inclusiveEnd()) {
      all = all.filter(o -> o.start().isBefore(end));
    }
    return all;
  }

  /**
   * Returns the occurrences that lie entirely within the window.
   *
   * @param start the window start, or null for no lower bound
   * @param end the window end, or null for no upper bound
   * @return an ascending stream of occurrences
   * @throws IllegalArgumentException if {@code start} is after {@code end}
   */
  public Stream<Occurrence> includes(Instant start, Instant end) {
    Stream<Occurrence> all = query(start, end);
    return end == null ? all : all.filter(o -> !o.end().isAfter(end));
  }

  /**
   * Returns the occurrences that share time with the window, including those that started before
   * it and are still running.
   *
   * @param start the window start, or null for no lower bound
   * @param end the window end, or null for no upper bound
   * @return an ascending stream of occurrences
   * @throws IllegalArgumentException if {@code start} is after {@code end}
   */
  public Stream<Occurrence> overlapping(Instant start, Instant end) {
    checkWindow(start, end);
    return merged(null, end).filter(o -> o.overlaps(start, end));
  }

  /**
   * Returns the first {@code count} occurrences that start strictly after the instant.
   *
   * @param instant the exclusive lower bound
   * @param count the maximum number of occurrences
   * @return up to {@code count} occurrences in ascending order
   */
  public List<Occurrence> startingAfter(Instant instant, int count) {
    return merged(instant, null)
        .filter(o -> o.start().isAfter(instant))
        .limit(count)
        .toList();
  }

  /**
   * Returns the occurrences in progress at the instant.
   *
   * @param instant the instant
   * @return the covering occurrences in ascending order
   */
  public Stream<Occurrence> at(Instant instant) {
    return merged(null, instant).filter(o -> o.covers(instant));
  }

  private Stream<Occurrence> merged(Instant from, Instant to) {
    List<Iterator<Occurrence>> its = new ArrayList<>(sources.size());
    for (Source source : sources) {
      its.add(source.occurrences(from, to).iterator());
    }
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            MergingIterator.merge(its, BY_START), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  private static void checkWindow(Instant start, Instant end) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new IllegalArgumentException("window start " + start + " is after end " + end);
    }
  }

  private static Optional<Source> series(
      Component master, List<Component> overrides, TimelineOptions options) {
    try {
      RecurrenceSet set = RecurrenceSet.of(master, overrides, options);
      return Optional.of((from, to) -> set.resolve(from, to).map(Occurrence::of));
    } catch (CalendarException e) {
      skipped(master, e);
      return Optional.empty();
    }
  }

  private static Optional<Source> orphan(Component override, TimelineOptions options) {
    try {
      Optional<DateTimeValue> start = override.start();
      DateTimeValue first = start.isPresent() ? start.get() : override.recurrenceId().get();
      Instant at = options.toInstant(first);
      Occurrence occurrence =
          new Occurrence(override, at, Occurrence.endOf(at, override.duration()), true);
      return Optional.of(fixed(List.of(occurrence)));
    } catch (CalendarException e) {
      skipped(override, e);
      return Optional.empty();
    }
  }

  private static Source freeBusy(Component c, TimelineOptions options) {
    List<Occurrence> busy = new ArrayList<>();
    for (Property p : c.propertiesNamed("FREEBUSY")) {
      try {
        for (PeriodValue period : p.asPeriodList()) {
          Instant start = options.toInstant(period.start());
          busy.add(new Occurrence(c, start, Occurrence.endOf(start, period.length()), false));
        }
      } catch (CalendarException e) {
        LOGGER.warn("Ignoring FREEBUSY of {}: {}", c, e.getMessage());
      }
    }
    busy.sort(BY_START);
    return fixed(busy);
  }

  private static Source fixed(List<Occurrence> occurrences) {
    return (from, to) ->
        occurrences.stream()
            .filter(o -> from == null || !o.start().isBefore(from))
            .filter(o -> to == null || !o.start().isAfter(to));
  }

  private static void skipped(Component c, CalendarException e) {
    if (e.kind() == ErrorKind.MISSING_PROPERTY) {
      LOGGER.debug("Skipping {}: {}", c.path(), e.getMessage());
    } else {
      LOGGER.warn("Skipping {}: {}", c.path(), e.getMessage());
    }
  }
}
