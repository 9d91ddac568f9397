package com.compass.calendar.domain.recurrence;

import java.time.Instant;

/**
 * Whether an occurrence falling exactly on a rule's {@code until} is part of the series.
 */
public enum UntilBoundary {
    INCLUSIVE,
    EXCLUSIVE;

    boolean admits(Instant candidate, Instant until) {
        return this == INCLUSIVE ? !candidate.isAfter(until) : candidate.isBefore(until);
    }
}
