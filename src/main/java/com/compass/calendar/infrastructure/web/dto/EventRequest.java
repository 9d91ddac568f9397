package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CreateEventRequest;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.Transparency;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record EventRequest(
        String title,
        String description,
        EventType event_type,
        Instant start_time,
        Instant end_time,
        boolean is_all_day,
        String location,
        String color,
        Transparency transparency,
        RecurrenceRuleDto recurrence_rule,
        List<ReminderRequestDto> reminders
) {
    public CreateEventRequest toDomain() {
        if (reminders != null && reminders.stream().anyMatch(Objects::isNull)) {
            throw CalendarException.validation("event", "reminders", "Reminders must not contain null entries");
        }
        return new CreateEventRequest(
                title,
                description,
                event_type,
                start_time,
                end_time,
                is_all_day,
                location,
                color,
                transparency,
                recurrence_rule == null ? null : recurrence_rule.toDomain(),
                reminders == null ? List.of() : reminders.stream().map(ReminderRequestDto::toDomain).toList()
        );
    }
}
