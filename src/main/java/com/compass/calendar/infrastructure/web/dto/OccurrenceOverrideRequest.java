package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.OccurrenceOverride;
import com.compass.calendar.domain.model.Transparency;
import java.time.Instant;

public record OccurrenceOverrideRequest(
        Instant start_time,
        Instant end_time,
        String title,
        String description,
        String location,
        String color,
        Transparency transparency
) {
    public OccurrenceOverride toDomain() {
        return new OccurrenceOverride(start_time, end_time, title, description, location, color, transparency);
    }
}
