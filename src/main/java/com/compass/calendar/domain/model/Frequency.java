package com.compass.calendar.domain.model;

import java.time.temporal.ChronoUnit;

/**
 * Repeat frequency of a recurrence rule.
 * Each frequency advances the series by {@code unitsPerStep * interval} of its unit.
 */
public enum Frequency {
    DAILY(ChronoUnit.DAYS, 1),
    WEEKLY(ChronoUnit.DAYS, 7),
    BIWEEKLY(ChronoUnit.DAYS, 14),
    MONTHLY(ChronoUnit.MONTHS, 1),
    YEARLY(ChronoUnit.YEARS, 1);

    private final ChronoUnit unit;
    private final int unitsPerStep;

    Frequency(ChronoUnit unit, int unitsPerStep) {
        this.unit = unit;
        this.unitsPerStep = unitsPerStep;
    }

    public ChronoUnit unit() {
        return unit;
    }

    public long unitsFor(int interval) {
        return (long) unitsPerStep * interval;
    }

    /**
     * Monthly and yearly steps can land on a day-of-month the target month does not have.
     */
    public boolean isCalendarBased() {
        return unit == ChronoUnit.MONTHS || unit == ChronoUnit.YEARS;
    }
}
