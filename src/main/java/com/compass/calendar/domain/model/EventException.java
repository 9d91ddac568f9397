package com.compass.calendar.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-occurrence override or deletion, keyed by (eventId, originalTime).
 * Null override fields mean "inherit from the event".
 */
public record EventException(
        UUID id,
        UUID eventId,
        Instant originalTime,
        Instant overrideStartTime,
        Instant overrideEndTime,
        String overrideTitle,
        String overrideDescription,
        String overrideLocation,
        String overrideColor,
        Transparency overrideTransparency,
        boolean deleted,
        Instant createdAt,
        Instant updatedAt
) {
    public static EventException anchoredAt(UUID id, UUID eventId, Instant originalTime, Instant now) {
        return new EventException(id, eventId, originalTime, null, null, null, null, null, null, null,
                false, now, now);
    }

    public boolean hasTimeOverride() {
        return overrideStartTime != null || overrideEndTime != null;
    }

    /**
     * Moves the override start/end by {@code delta}; fields without an override stay null.
     */
    public EventException shiftedBy(Duration delta, Instant now) {
        return new EventException(id, eventId, originalTime,
                overrideStartTime == null ? null : overrideStartTime.plus(delta),
                overrideEndTime == null ? null : overrideEndTime.plus(delta),
                overrideTitle, overrideDescription, overrideLocation, overrideColor, overrideTransparency,
                deleted, createdAt, now);
    }

    /**
     * Copies the non-null fields of {@code request} onto this exception.
     */
    public EventException withOverrides(OccurrenceOverride request, Instant now) {
        return new EventException(id, eventId, originalTime,
                request.startTime() != null ? request.startTime() : overrideStartTime,
                request.endTime() != null ? request.endTime() : overrideEndTime,
                request.title() != null ? request.title() : overrideTitle,
                request.description() != null ? request.description() : overrideDescription,
                request.location() != null ? request.location() : overrideLocation,
                request.color() != null ? request.color() : overrideColor,
                request.transparency() != null ? request.transparency() : overrideTransparency,
                deleted, createdAt, now);
    }

    public EventException markedDeleted(Instant now) {
        return new EventException(id, eventId, originalTime, overrideStartTime, overrideEndTime,
                overrideTitle, overrideDescription, overrideLocation, overrideColor, overrideTransparency,
                true, createdAt, now);
    }
}
