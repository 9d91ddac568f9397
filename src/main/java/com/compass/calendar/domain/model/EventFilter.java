package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository-level selection of events. {@code page} is 1-based.
 */
public record EventFilter(
        UUID ownerId,
        Instant rangeStart,
        Instant rangeEnd,
        EventType eventType,
        int page,
        int pageSize
) {
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
