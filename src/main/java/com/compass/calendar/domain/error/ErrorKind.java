package com.compass.calendar.domain.error;

public enum ErrorKind {
    /** Malformed event, rule or reminder fields, or an operation the target does not support. */
    VALIDATION,
    /** Event, occurrence exception or reminder absent. */
    NOT_FOUND,
    /** Begin or commit failure. */
    TRANSACTION,
    /** Underlying storage failure. */
    REPOSITORY
}
