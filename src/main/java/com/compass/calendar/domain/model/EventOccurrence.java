package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.UUID;

public record EventOccurrence(
        UUID id,
        UUID eventId,
        Instant occurrenceTime,
        OccurrenceStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    /**
     * An occurrence computed on demand, never stored.
     */
    public static EventOccurrence generated(UUID eventId, Instant occurrenceTime) {
        return new EventOccurrence(null, eventId, occurrenceTime, OccurrenceStatus.UPCOMING, null, null);
    }
}
