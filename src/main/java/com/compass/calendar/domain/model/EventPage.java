package com.compass.calendar.domain.model;

import java.util.List;

public record EventPage(
        List<CalendarEvent> events,
        long total
) {
    public EventPage {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
