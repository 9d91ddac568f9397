package com.compass.calendar.domain.model;

public enum OccurrenceStatus {
    UPCOMING,
    CANCELLED,
    COMPLETED
}
