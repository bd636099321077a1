package io.calrecur.timeline;

import io.calrecur.ast.Component;
import java.time.Duration;
import java.time.Instant;

/**
 * One member of a resolved recurrence set.
 *
 * @param start the start instant
 * @param duration how long this instance lasts
 * @param overridden whether the instance comes from a RECURRENCE-ID override
 * @param source the component that defines this instance: the master, or the override
 */
public record ResolvedInstant(
    Instant start, Duration duration, boolean overridden, Component source) {}
