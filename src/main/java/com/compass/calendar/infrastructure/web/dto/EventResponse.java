package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.Transparency;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record EventResponse(
        UUID id,
        UUID user_id,
        String title,
        String description,
        EventType event_type,
        Instant start_time,
        Instant end_time,
        boolean is_all_day,
        String location,
        String color,
        Transparency transparency,
        Instant created_at,
        Instant updated_at,
        List<RecurrenceRuleDto> recurrence_rules,
        List<ReminderResponse> reminders,
        List<OccurrenceResponse> occurrences
) {
    public static EventResponse fromEvent(CalendarEvent event) {
        return new EventResponse(
                event.id(),
                event.ownerId(),
                event.title(),
                event.description(),
                event.eventType(),
                event.startTime(),
                event.endTime(),
                event.allDay(),
                event.location(),
                event.color(),
                event.transparency(),
                event.createdAt(),
                event.updatedAt(),
                event.recurrenceRules().stream().map(RecurrenceRuleDto::fromRule).toList(),
                event.reminders().stream().map(ReminderResponse::fromReminder).toList(),
                event.occurrences().stream().map(OccurrenceResponse::fromOccurrence).toList()
        );
    }
}
