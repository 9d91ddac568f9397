package com.compass.calendar.application;

/**
 * Stages a write request moves through. {@link #COMMITTING} is the only successful end;
 * a failure at any stage ends in {@link #ROLLING_BACK}.
 */
public enum LifecycleStage {
    VALIDATING,
    PERSISTING,
    EXPANDING,
    PERSISTING_OCCURRENCES,
    PERSISTING_REMINDERS,
    SHIFTING_EXCEPTIONS,
    COMMITTING,
    ROLLING_BACK
}
