package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.OccurrenceStatus;
import com.compass.calendar.domain.model.ResolvedOccurrence;
import com.compass.calendar.domain.model.Transparency;
import java.time.Instant;
import java.util.UUID;

/**
 * One occurrence after exceptions are applied. Override fields are null when not overridden.
 */
public record OccurrenceResponse(
        UUID event_id,
        Instant original_time,
        Instant occurrence_time,
        Instant end_time,
        OccurrenceStatus status,
        String title,
        String description,
        String location,
        String color,
        Transparency transparency,
        boolean modified
) {
    public static OccurrenceResponse fromOccurrence(ResolvedOccurrence occurrence) {
        return new OccurrenceResponse(
                occurrence.eventId(),
                occurrence.originalTime(),
                occurrence.occurrenceTime(),
                occurrence.endTime(),
                occurrence.status(),
                occurrence.title(),
                occurrence.description(),
                occurrence.location(),
                occurrence.color(),
                occurrence.transparency(),
                occurrence.modified()
        );
    }
}
