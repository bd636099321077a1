package io.calrecur.ast;

import java.time.Duration;

/**
 * A PERIOD value: an explicit start with either an explicit end or a duration.
 *
 * @param start the period start
 * @param end the explicit end, null when the period was written with a duration
 * @param duration the duration, null when the period was written with an explicit end
 */
public record PeriodValue(DateTimeValue start, DateTimeValue end, Duration duration) {

  /**
   * Returns the length of the period as written. An explicit end is measured in wall-clock time
   * of the start's frame.
   *
   * @return the length
   */
  public Duration length() {
    if (duration != null) {
      return duration;
    }
    return Duration.between(start.local(), end.local());
  }
}
