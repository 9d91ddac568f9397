package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything needed to create an event, optionally with a recurrence rule and reminders.
 */
public record CreateEventRequest(
        String title,
        String description,
        EventType eventType,
        Instant startTime,
        Instant endTime,
        boolean allDay,
        String location,
        String color,
        Transparency transparency,
        RecurrenceRuleRequest recurrenceRule,
        List<ReminderRequest> reminders
) {
    public CreateEventRequest {
        reminders = reminders == null ? List.of() : List.copyOf(reminders);
    }
}
