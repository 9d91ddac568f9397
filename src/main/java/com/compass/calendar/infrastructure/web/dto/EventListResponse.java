package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.EventPage;
import java.util.List;

public record EventListResponse(
        List<EventResponse> events,
        long total
) {
    public static EventListResponse fromPage(EventPage page) {
        return new EventListResponse(
                page.events().stream().map(EventResponse::fromEvent).toList(),
                page.total()
        );
    }
}
