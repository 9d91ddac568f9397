package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An occurrence as presented to callers after exceptions are applied.
 * {@code originalTime} is the identity of the instance; {@code occurrenceTime} is where it is shown.
 */
public record ResolvedOccurrence(
        UUID eventId,
        Instant originalTime,
        Instant occurrenceTime,
        Instant endTime,
        OccurrenceStatus status,
        String title,
        String description,
        String location,
        String color,
        Transparency transparency,
        boolean modified
) {
    public static ResolvedOccurrence unchanged(EventOccurrence occurrence) {
        return new ResolvedOccurrence(occurrence.eventId(), occurrence.occurrenceTime(),
                occurrence.occurrenceTime(), null, occurrence.status(),
                null, null, null, null, null, false);
    }

    public static ResolvedOccurrence overridden(EventOccurrence occurrence, EventException exception) {
        Instant presented = exception.overrideStartTime() != null
                ? exception.overrideStartTime()
                : occurrence.occurrenceTime();
        return new ResolvedOccurrence(occurrence.eventId(), occurrence.occurrenceTime(), presented,
                exception.overrideEndTime(), occurrence.status(),
                exception.overrideTitle(), exception.overrideDescription(), exception.overrideLocation(),
                exception.overrideColor(), exception.overrideTransparency(), true);
    }
}
