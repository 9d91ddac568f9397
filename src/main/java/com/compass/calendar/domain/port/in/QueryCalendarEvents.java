package com.compass.calendar.domain.port.in;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventPage;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.ResolvedOccurrence;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface QueryCalendarEvents {

    CalendarEvent getEventById(UUID id);

    /**
     * Events of an owner in {@code [rangeStart, rangeEnd]}; recurring events carry their
     * occurrences in that range with exceptions applied.
     *
     * @param eventType optional type filter, null for all types
     * @param page 1-based page number
     * @param pageSize page size, null for the configured default
     */
    EventPage listEvents(UUID ownerId, Instant rangeStart, Instant rangeEnd,
                         EventType eventType, int page, Integer pageSize);

    /**
     * Stored occurrences of one event in {@code [start, end]} with exceptions applied.
     */
    List<ResolvedOccurrence> listOccurrences(UUID eventId, Instant start, Instant end);
}
