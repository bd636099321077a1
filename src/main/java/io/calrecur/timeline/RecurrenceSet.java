package io.calrecur.timeline;

import io.calrecur.CalendarException;
import io.calrecur.ast.Component;
import io.calrecur.ast.DateTimeValue;
import io.calrecur.ast.PeriodValue;
import io.calrecur.ast.Property;
import io.calrecur.ast.RecurrenceRule;
import io.calrecur.ast.ValueType;
import io.calrecur.eval.MergingIterator;
import io.calrecur.eval.RecurrenceEvaluator;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The recurrence set of one component: the instants defined by DTSTART, RRULE and RDATE, minus
 * those of EXRULE and EXDATE, with RECURRENCE-ID overrides spliced in.
 *
 * <h2>Resolution</h2>
 *
 * <ol>
 *   <li>DTSTART, every RDATE and every RRULE expansion are merged into one ascending sequence;
 *       equal instants collapse to the first.
 *   <li>Instants produced by an EXRULE or listed in an EXDATE are dropped. A DATE-valued EXDATE on
 *       a timed series drops every instance on that date.
 *   <li>Instants equal to an override's RECURRENCE-ID are dropped, and every override is merged
 *       back in at its own start, marked overridden. Overrides that match no generated instant
 *       are kept.
 * </ol>
 *
 * <p>Instants are compared after mapping to UTC, so an EXDATE written in another zone still
 * matches. A UTC UNTIL is converted into DTSTART's frame before expansion.
 *
 * <p>A malformed RRULE, EXRULE, RDATE or EXDATE is logged, recorded in {@link #problems()} and
 * contributes nothing; the rest of the set still resolves. Resolution is lazy and every call
 * starts afresh, so an unbounded set may be resolved repeatedly and concurrently.
 */
public final class RecurrenceSet {
  private static final Logger LOGGER = LoggerFactory.getLogger(RecurrenceSet.class);
  private static final Comparator<ResolvedInstant> BY_START =
      Comparator.comparing(ResolvedInstant::start);

  private final Component master;
  private final TimelineOptions options;
  private final DateTimeValue anchor;
  private final Duration duration;
  private final List<RecurrenceRule> rules = new ArrayList<>();
  private final List<RecurrenceRule> exclusionRules = new ArrayList<>();
  private final List<ResolvedInstant> additions = new ArrayList<>();
  private final Set<Instant> excludedInstants = new HashSet<>();
  private final Set<LocalDate> excludedDates = new HashSet<>();
  private final Set<Instant> overrideKeys = new HashSet<>();
  private final List<ResolvedInstant> overrides = new ArrayList<>();
  private final List<CalendarException> problems = new ArrayList<>();

  private RecurrenceSet(Component master, List<Component> overridden, TimelineOptions options)
      throws CalendarException {
    this.master = master;
    this.options = options;
    this.anchor =
        master
            .start()
            .orElseThrow(() -> CalendarException.missingProperty(master.type().name(), "DTSTART"));
    this.duration = master.duration();

    for (Property p : master.propertiesNamed("RRULE")) {
      rule(p).ifPresent(rules::add);
    }
    for (Property p : master.propertiesNamed("EXRULE")) {
      rule(p).ifPresent(exclusionRules::add);
    }
    for (Property p : master.propertiesNamed("RDATE")) {
      try {
        addDates(p);
      } catch (CalendarException e) {
        problem(e);
      }
    }
    additions.sort(BY_START);
    for (Property p : master.propertiesNamed("EXDATE")) {
      try {
        for (DateTimeValue v : p.asDateTimeList()) {
          if (v.isDate() && !anchor.isDate()) {
            excludedDates.add(v.date());
          } else {
            excludedInstants.add(options.toInstant(v));
          }
        }
      } catch (CalendarException e) {
        problem(e);
      }
    }
    for (Component o : overridden) {
      try {
        addOverride(o);
      } catch (CalendarException e) {
        problem(e);
      }
    }
    overrides.sort(BY_START);
  }

  /**
   * Builds the recurrence set of a component with default options and no overrides.
   *
   * @param master the component
   * @return the recurrence set
   * @throws CalendarException if DTSTART is missing or malformed
   */
  public static RecurrenceSet of(Component master) throws CalendarException {
    return of(master, List.of(), TimelineOptions.defaults());
  }

  /**
   * Builds the recurrence set of a component.
   *
   * @param master the series master
   * @param overrides components with a RECURRENCE-ID that replace instances of the series
   * @param options zone and window settings
   * @return the recurrence set
   * @throws CalendarException if DTSTART is missing or malformed, or the duration is malformed
   */
  public static RecurrenceSet of(
      Component master, List<Component> overrides, TimelineOptions options)
      throws CalendarException {
    return new RecurrenceSet(master, overrides, options);
  }

  public Component master() {
    return master;
  }

  /**
   * Returns the errors of the properties that were left out of the set.
   *
   * @return the recorded problems, in property order
   */
  public List<CalendarException> problems() {
    return Collections.unmodifiableList(problems);
  }

  /**
   * Resolves the instants that start within {@code [from, to]}. Either bound may be null for an
   * open end; with no upper bound an unbounded series yields an infinite stream.
   *
   * @param from the earliest start, inclusive, or null
   * @param to the latest start, inclusive, or null
   * @return an ascending stream of instants
   * @throws IllegalArgumentException if {@code from} is after {@code to}
   */
  public Stream<ResolvedInstant> resolve(Instant from, Instant to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("window start " + from + " is after end " + to);
    }
    List<Iterator<ResolvedInstant>> sources = new ArrayList<>();
    sources.add(additions.iterator());
    sources.add(List.of(instance(anchor.local())).iterator());
    for (RecurrenceRule rule : rules) {
      sources.add(
          RecurrenceEvaluator.expand(rule, anchor.local()).map(this::instance).iterator());
    }
    Stream<ResolvedInstant> base = stream(MergingIterator.merge(sources, BY_START));
    Stream<ResolvedInstant> moved = overrides.stream();
    if (to != null) {
      base = base.takeWhile(r -> !r.start().isAfter(to));
      moved = moved.filter(r -> !r.start().isAfter(to));
    }
    Exclusions exclusions = new Exclusions();
    Iterator<ResolvedInstant> kept =
        base.filter(new FirstPerStart())
            .filter(r -> !exclusions.excludes(r.start()) && !overrideKeys.contains(r.start()))
            .iterator();
    Stream<ResolvedInstant> all =
        stream(MergingIterator.merge(List.of(kept, moved.iterator()), BY_START));
    return from == null ? all : all.filter(r -> !r.start().isBefore(from));
  }

  private ResolvedInstant instance(LocalDateTime local) {
    return new ResolvedInstant(options.toInstant(anchor.withLocal(local)), duration, false, master);
  }

  private Optional<RecurrenceRule> rule(Property p) {
    try {
      return Optional.of(rebase(p.asRecurrenceRule()));
    } catch (CalendarException e) {
      problem(e);
      return Optional.empty();
    }
  }

  /** Moves a UTC UNTIL into the anchor's wall-clock frame. */
  private RecurrenceRule rebase(RecurrenceRule rule) {
    Optional<DateTimeValue> until = rule.untilValue();
    if (until.isEmpty()
        || until.get().form() != DateTimeValue.Form.UTC
        || anchor.form() == DateTimeValue.Form.UTC) {
      return rule;
    }
    LocalDateTime local = options.toLocal(options.toInstant(until.get()), anchor);
    return rule.withUntil(DateTimeValue.floating(local));
  }

  private void addDates(Property p) throws CalendarException {
    if (p.valueType() == ValueType.PERIOD_LIST) {
      for (PeriodValue period : p.asPeriodList()) {
        additions.add(
            new ResolvedInstant(
                options.toInstant(period.start()), period.length(), false, master));
      }
      return;
    }
    for (DateTimeValue v : p.asDateTimeList()) {
      additions.add(new ResolvedInstant(options.toInstant(v), duration, false, master));
    }
  }

  private void addOverride(Component o) throws CalendarException {
    DateTimeValue id =
        o.recurrenceId()
            .orElseThrow(() -> CalendarException.missingProperty(o.type().name(), "RECURRENCE-ID"));
    overrideKeys.add(options.toInstant(id));
    Optional<DateTimeValue> start = o.start();
    boolean ownLength =
        o.explicitDuration().isPresent() || (start.isPresent() && o.end().isPresent());
    overrides.add(
        new ResolvedInstant(
            options.toInstant(start.orElse(id)), ownLength ? o.duration() : duration, true, o));
  }

  private void problem(CalendarException e) {
    problems.add(e);
    LOGGER.warn("Ignoring {} of {}: {}", e.subject().orElse("value"), master, e.getMessage());
  }

  private static <T> Stream<T> stream(Iterator<T> it) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /** Passes the first instant of each run of equal starts. */
  private static final class FirstPerStart implements Predicate<ResolvedInstant> {
    private Instant last;

    @Override
    public boolean test(ResolvedInstant r) {
      boolean first = !r.start().equals(last);
      last = r.start();
      return first;
    }
  }

  /** Membership test for exclusions, walked forward with ascending queries. */
  private final class Exclusions {
    private final List<Iterator<Instant>> expansions = new ArrayList<>();
    private final List<Instant> heads = new ArrayList<>();

    Exclusions() {
      for (RecurrenceRule rule : exclusionRules) {
        Iterator<Instant> it =
            RecurrenceEvaluator.expand(rule, anchor.local())
                .map(t -> options.toInstant(anchor.withLocal(t)))
                .iterator();
        expansions.add(it);
        heads.add(it.hasNext() ? it.next() : null);
      }
    }

    boolean excludes(Instant t) {
      if (excludedInstants.contains(t)) {
        return true;
      }
      if (!excludedDates.isEmpty()
          && excludedDates.contains(options.toLocal(t, anchor).toLocalDate())) {
        return true;
      }
      boolean hit = false;
      for (int i = 0; i < expansions.size(); i++) {
        Iterator<Instant> it = expansions.get(i);
        Instant head = heads.get(i);
        while (head != null && head.isBefore(t)) {
          head = it.hasNext() ? it.next() : null;
        }
        heads.set(i, head);
        hit |= t.equals(head);
      }
      return hit;
    }
  }
}
