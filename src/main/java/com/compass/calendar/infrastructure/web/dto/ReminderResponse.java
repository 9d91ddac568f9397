package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.ReminderMethod;
import java.util.UUID;

public record ReminderResponse(
        UUID id,
        UUID event_id,
        int minutes_before,
        ReminderMethod method
) {
    public static ReminderResponse fromReminder(EventReminder reminder) {
        return new ReminderResponse(reminder.id(), reminder.eventId(), reminder.minutesBefore(), reminder.method());
    }
}
