package io.calrecur.eval;

import io.calrecur.ast.DateTimeValue;
import io.calrecur.ast.Frequency;
import io.calrecur.ast.RecurrenceRule;
import io.calrecur.ast.Weekday;
import io.calrecur.ast.WeekdayNum;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.TreeSet;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Expands recurrence rules into ascending sequences of wall-clock start times.
 *
 * <h2>Algorithm</h2>
 *
 * <p>The rule's FREQ and INTERVAL define a cadence of periods starting at the period that holds
 * the anchor (a year, month, week starting on WKST, day, hour, minute or second). For each period
 * the evaluator lists every day of the period that passes the day-level by-fields (BYMONTH,
 * BYWEEKNO, BYYEARDAY, BYMONTHDAY, BYDAY) and crosses it with the times of day built from BYHOUR,
 * BYMINUTE and BYSECOND. A by-field coarser than FREQ therefore restricts candidates and one that
 * is finer expands them. Missing day and time fields default to the anchor's, so {@code
 * FREQ=MONTHLY} repeats on the anchor's day of month. BYSETPOS then picks positions from the
 * period's full, sorted candidate set. Candidates before the anchor are dropped, and generation
 * stops at UNTIL, after COUNT results, or never.
 *
 * <p>BYDAY ordinals count within the month for MONTHLY (and YEARLY with BYMONTH) and within the
 * year for YEARLY; for finer frequencies the ordinal is ignored. An ordinal that does not exist in
 * a period, such as a fifth Monday, simply yields nothing for that period.
 *
 * <h2>Laziness</h2>
 *
 * <p>Every call builds a fresh iterator that computes one period at a time on demand, so
 * unbounded rules are safe to consume with {@code limit} or {@code takeWhile}, and repeated or
 * concurrent expansions share no state.
 *
 * <h2>Iteration Safety Limit</h2>
 *
 * <p>MAX_BARREN_YEARS (400): a rule whose periods produce no candidate for 400 years of cadence
 * (for example {@code BYMONTH=2;BYMONTHDAY=30}) is treated as exhausted.
 *
 * <p>All evaluation is zone-naive; callers map results to instants.
 */
public final class RecurrenceEvaluator {
  /** Years of barren periods after which a rule is treated as exhausted. */
  private static final int MAX_BARREN_YEARS = 400;

  private RecurrenceEvaluator() {}

  /**
   * Returns a lazy stream of the rule's start times at or after the anchor.
   *
   * @param rule the recurrence rule
   * @param anchor the first instance (DTSTART) in wall-clock time
   * @return an ascending, duplicate-free stream
   */
  public static Stream<LocalDateTime> expand(RecurrenceRule rule, LocalDateTime anchor) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            iterator(rule, anchor), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns a lazy stream of the rule's start times, stopping after {@code windowEndHint}.
   *
   * @param rule the recurrence rule
   * @param anchor the first instance in wall-clock time
   * @param windowEndHint the last time of interest (inclusive)
   * @return an ascending stream bounded by the hint
   */
  public static Stream<LocalDateTime> expand(
      RecurrenceRule rule, LocalDateTime anchor, LocalDateTime windowEndHint) {
    return expand(rule, anchor).takeWhile(t -> !t.isAfter(windowEndHint));
  }

  /**
   * Computes the first start time strictly after the given time, so that a consumer can resume
   * from the last instant it saw.
   *
   * @param rule the recurrence rule
   * @param anchor the first instance in wall-clock time
   * @param after the exclusive lower bound
   * @return the next start time, or empty if the rule is exhausted
   */
  public static Optional<LocalDateTime> firstAfter(
      RecurrenceRule rule, LocalDateTime anchor, LocalDateTime after) {
    return expand(rule, anchor).filter(t -> t.isAfter(after)).findFirst();
  }

  /**
   * Returns a fresh iterator over the rule's start times.
   *
   * @param rule the recurrence rule
   * @param anchor the first instance in wall-clock time
   * @return a new iterator
   */
  public static Iterator<LocalDateTime> iterator(RecurrenceRule rule, LocalDateTime anchor) {
    return new RuleIterator(new Plan(rule, anchor), anchor);
  }

  /** The rule with anchor-derived defaults filled in. */
  private static final class Plan {
    final Frequency freq;
    final int interval;
    final int count;
    final LocalDateTime until;
    final DayOfWeek weekStart;
    final List<Integer> months;
    final List<Integer> weekNos;
    final List<Integer> yearDays;
    final List<Integer> monthDays;
    final List<WeekdayNum> days;
    final List<Integer> hours;
    final List<Integer> minutes;
    final List<Integer> seconds;
    final List<Integer> setPos;

    Plan(RecurrenceRule r, LocalDateTime anchor) {
      freq = r.freq();
      interval = Math.max(1, r.interval());
      count = r.count();
      until = r.untilValue().map(Plan::untilBound).orElse(null);
      weekStart = r.weekStart().toDayOfWeek();
      weekNos = r.byWeekNo();
      yearDays = r.byYearDay();
      setPos = r.bySetPos();

      boolean dayFields =
          !r.byWeekNo().isEmpty()
              || !r.byYearDay().isEmpty()
              || !r.byMonthDay().isEmpty()
              || !r.byDay().isEmpty();
      List<Integer> m = r.byMonth();
      List<Integer> md = r.byMonthDay();
      List<WeekdayNum> d = r.byDay();
      if (!dayFields) {
        switch (freq) {
          case YEARLY -> {
            if (m.isEmpty()) {
              m = List.of(anchor.getMonthValue());
            }
            md = List.of(anchor.getDayOfMonth());
          }
          case MONTHLY -> md = List.of(anchor.getDayOfMonth());
          case WEEKLY ->
              d = List.of(WeekdayNum.every(Weekday.fromDayOfWeek(anchor.getDayOfWeek())));
          default -> {}
        }
      }
      months = m;
      monthDays = md;
      days = d;

      hours = timeField(r.byHour(), anchor.getHour(), Frequency.HOURLY);
      minutes = timeField(r.byMinute(), anchor.getMinute(), Frequency.MINUTELY);
      // A leap second (60) is clamped to 59, as DATE-TIME parsing does.
      seconds =
          timeField(r.bySecond(), anchor.getSecond(), Frequency.SECONDLY).stream()
              .map(v -> Math.min(v, 59))
              .distinct()
              .toList();
    }

    /** For fields at or coarser than FREQ the anchor value fills in; finer ones only restrict. */
    private List<Integer> timeField(List<Integer> given, int anchorValue, Frequency own) {
      if (!given.isEmpty()) {
        return given.stream().sorted().distinct().toList();
      }
      return freq.isCoarserThan(own) ? List.of(anchorValue) : List.of();
    }

    private static LocalDateTime untilBound(DateTimeValue until) {
      return until.isDate() ? until.date().atTime(LocalTime.MAX) : until.local();
    }

    boolean matchesDay(LocalDate date) {
      if (!months.isEmpty() && !months.contains(date.getMonthValue())) {
        return false;
      }
      if (!weekNos.isEmpty() && !matchesWeekNo(date)) {
        return false;
      }
      if (!yearDays.isEmpty()
          && !matchesSigned(yearDays, date.getDayOfYear(), date.lengthOfYear())) {
        return false;
      }
      if (!monthDays.isEmpty()
          && !matchesSigned(monthDays, date.getDayOfMonth(), date.lengthOfMonth())) {
        return false;
      }
      return days.isEmpty() || matchesWeekday(date);
    }

    private boolean matchesWeekday(LocalDate date) {
      Weekday wd = Weekday.fromDayOfWeek(date.getDayOfWeek());
      for (WeekdayNum entry : days) {
        if (entry.day() != wd) {
          continue;
        }
        if (!entry.hasOrdinal() || !ordinalsApply()) {
          return true;
        }
        boolean inMonth = freq == Frequency.MONTHLY || !months.isEmpty();
        int position = inMonth ? date.getDayOfMonth() : date.getDayOfYear();
        int length = inMonth ? date.lengthOfMonth() : date.lengthOfYear();
        int fromStart = (position - 1) / 7 + 1;
        int fromEnd = -((length - position) / 7 + 1);
        if (entry.ordinal() == fromStart || entry.ordinal() == fromEnd) {
          return true;
        }
      }
      return false;
    }

    private boolean ordinalsApply() {
      return (freq == Frequency.MONTHLY || freq == Frequency.YEARLY) && weekNos.isEmpty();
    }

    private boolean matchesWeekNo(LocalDate date) {
      int year = date.getYear();
      LocalDate start = weekOneStart(year);
      if (date.isBefore(start)) {
        year--;
        start = weekOneStart(year);
      } else {
        LocalDate next = weekOneStart(year + 1);
        if (!date.isBefore(next)) {
          year++;
          start = next;
        }
      }
      int weeksInYear = (int) (ChronoUnit.DAYS.between(start, weekOneStart(year + 1)) / 7);
      int weekNo = (int) (ChronoUnit.DAYS.between(start, date) / 7) + 1;
      return matchesSigned(weekNos, weekNo, weeksInYear);
    }

    /** Week 1 is the first week starting on WKST with at least four days in the year. */
    private LocalDate weekOneStart(int year) {
      LocalDate jan1 = LocalDate.of(year, 1, 1);
      int offset = (weekStart.getValue() - jan1.getDayOfWeek().getValue() + 7) % 7;
      LocalDate firstWeekStart = jan1.plusDays(offset);
      return offset >= 4 ? firstWeekStart.minusDays(7) : firstWeekStart;
    }

    private static boolean matchesSigned(List<Integer> values, int position, int length) {
      for (int v : values) {
        if (v > 0 ? v == position : length + v + 1 == position) {
          return true;
        }
      }
      return false;
    }
  }

  /** Produces one period's candidates at a time. */
  private static final class RuleIterator implements Iterator<LocalDateTime> {
    private final Plan plan;
    private final LocalDateTime anchor;
    private final ArrayDeque<LocalDateTime> buffer = new ArrayDeque<>();
    private final LocalDate weekZero;
    private final YearMonth monthZero;
    private long period;
    private int emitted;
    private boolean done;
    private LocalDate lastProductive;

    RuleIterator(Plan plan, LocalDateTime anchor) {
      this.plan = plan;
      this.anchor = anchor;
      LocalDate date = anchor.toLocalDate();
      int back = (date.getDayOfWeek().getValue() - plan.weekStart.getValue() + 7) % 7;
      this.weekZero = date.minusDays(back);
      this.monthZero = YearMonth.from(anchor);
      this.lastProductive = date;
    }

    @Override
    public boolean hasNext() {
      while (buffer.isEmpty() && !done) {
        fill();
      }
      return !buffer.isEmpty();
    }

    @Override
    public LocalDateTime next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      LocalDateTime next = buffer.poll();
      emitted++;
      if (plan.count > 0 && emitted >= plan.count) {
        done = true;
        buffer.clear();
      }
      return next;
    }

    private void fill() {
      LocalDateTime periodStart = periodStart(period);
      if (plan.until != null && periodStart.toLocalDate().isAfter(plan.until.toLocalDate())) {
        done = true;
        return;
      }
      if (periodStart.toLocalDate().isAfter(lastProductive.plusYears(MAX_BARREN_YEARS))) {
        done = true;
        return;
      }

      List<LocalDateTime> candidates = candidates(periodStart);
      if (candidates.isEmpty()) {
        return;
      }
      for (LocalDateTime c : selectPositions(candidates)) {
        if (c.isBefore(anchor)) {
          continue;
        }
        if (plan.until != null && c.isAfter(plan.until)) {
          done = true;
          return;
        }
        buffer.add(c);
        lastProductive = c.toLocalDate();
      }
    }

    private LocalDateTime periodStart(long k) {
      long steps = k * plan.interval;
      return switch (plan.freq) {
        case YEARLY -> LocalDate.of(anchor.getYear() + (int) steps, 1, 1).atStartOfDay();
        case MONTHLY -> monthZero.plusMonths(steps).atDay(1).atStartOfDay();
        case WEEKLY -> weekZero.plusWeeks(steps).atStartOfDay();
        case DAILY -> anchor.toLocalDate().plusDays(steps).atStartOfDay();
        case HOURLY, MINUTELY, SECONDLY -> anchor.plus(steps, plan.freq.unit());
      };
    }

    /** Lists the period's candidates in ascending order and advances to the next period. */
    private List<LocalDateTime> candidates(LocalDateTime periodStart) {
      List<LocalDateTime> out = new ArrayList<>();
      switch (plan.freq) {
        case YEARLY, MONTHLY, WEEKLY, DAILY -> {
          LocalDate first = periodStart.toLocalDate();
          LocalDate end =
              switch (plan.freq) {
                case YEARLY -> first.plusYears(1);
                case MONTHLY -> first.plusMonths(1);
                case WEEKLY -> first.plusWeeks(1);
                default -> first.plusDays(1);
              };
          List<LocalTime> times = times(plan.hours, plan.minutes, plan.seconds);
          for (LocalDate d = first; d.isBefore(end); d = d.plusDays(1)) {
            if (plan.matchesDay(d)) {
              for (LocalTime t : times) {
                out.add(d.atTime(t));
              }
            }
          }
          period++;
        }
        case HOURLY, MINUTELY, SECONDLY -> subDaily(periodStart, out);
      }
      return out;
    }

    private void subDaily(LocalDateTime periodStart, List<LocalDateTime> out) {
      LocalDate date = periodStart.toLocalDate();
      if (!plan.matchesDay(date)) {
        skipTo(periodStart, date.plusDays(1).atStartOfDay());
        return;
      }
      int hour = periodStart.getHour();
      if (!restricts(plan.hours, hour, Frequency.HOURLY)) {
        skipTo(periodStart, periodStart.truncatedTo(ChronoUnit.HOURS).plusHours(1));
        return;
      }
      List<Integer> hourList = List.of(hour);
      List<Integer> minuteList = plan.minutes;
      List<Integer> secondList = plan.seconds;
      if (plan.freq != Frequency.HOURLY) {
        int minute = periodStart.getMinute();
        if (!restricts(plan.minutes, minute, Frequency.MINUTELY)) {
          skipTo(periodStart, periodStart.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1));
          return;
        }
        minuteList = List.of(minute);
        if (plan.freq == Frequency.SECONDLY) {
          int second = periodStart.getSecond();
          if (!restricts(plan.seconds, second, Frequency.SECONDLY)) {
            period++;
            return;
          }
          secondList = List.of(second);
        }
      }
      for (LocalTime t : times(hourList, minuteList, secondList)) {
        out.add(date.atTime(t));
      }
      period++;
    }

    /** A field equal to or finer than FREQ only restricts; an empty list allows everything. */
    private boolean restricts(List<Integer> values, int value, Frequency field) {
      if (plan.freq.isCoarserThan(field)) {
        return true;
      }
      return values.isEmpty() || values.contains(value);
    }

    /** Advances to the first period starting at or after {@code boundary}. */
    private void skipTo(LocalDateTime periodStart, LocalDateTime boundary) {
      long stepSeconds = plan.freq.unit().getDuration().getSeconds() * plan.interval;
      long gap = ChronoUnit.SECONDS.between(periodStart, boundary);
      period += Math.max(1, (gap + stepSeconds - 1) / stepSeconds);
    }

    private static List<LocalTime> times(
        List<Integer> hours, List<Integer> minutes, List<Integer> seconds) {
      List<LocalTime> out = new ArrayList<>();
      for (int h : hours) {
        for (int m : minutes) {
          for (int s : seconds) {
            out.add(LocalTime.of(h, m, s));
          }
        }
      }
      return out;
    }

    private List<LocalDateTime> selectPositions(List<LocalDateTime> candidates) {
      if (plan.setPos.isEmpty()) {
        return candidates;
      }
      TreeSet<LocalDateTime> picked = new TreeSet<>();
      int n = candidates.size();
      for (int pos : plan.setPos) {
        int idx = pos > 0 ? pos - 1 : n + pos;
        if (idx >= 0 && idx < n) {
          picked.add(candidates.get(idx));
        }
      }
      return new ArrayList<>(picked);
    }
  }
}
