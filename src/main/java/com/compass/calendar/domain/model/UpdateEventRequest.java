package com.compass.calendar.domain.model;

import java.time.Instant;

/**
 * Partial update of an event. Null fields are left unchanged.
 */
public record UpdateEventRequest(
        String title,
        String description,
        EventType eventType,
        Instant startTime,
        Instant endTime,
        Boolean allDay,
        String location,
        String color,
        Transparency transparency
) {
    public boolean changesSchedule() {
        return startTime != null || endTime != null;
    }
}
