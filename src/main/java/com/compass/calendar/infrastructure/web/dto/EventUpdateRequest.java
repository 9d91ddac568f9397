package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.Transparency;
import com.compass.calendar.domain.model.UpdateEventRequest;
import java.time.Instant;

/**
 * Fields left out of the body keep their stored value.
 */
public record EventUpdateRequest(
        String title,
        String description,
        EventType event_type,
        Instant start_time,
        Instant end_time,
        Boolean is_all_day,
        String location,
        String color,
        Transparency transparency
) {
    public UpdateEventRequest toDomain() {
        return new UpdateEventRequest(title, description, event_type, start_time, end_time,
                is_all_day, location, color, transparency);
    }
}
