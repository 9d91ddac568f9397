package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CalendarEvent(
        UUID id,
        UUID ownerId,
        String title,
        String description,
        EventType eventType,
        Instant startTime,
        Instant endTime,
        boolean allDay,
        String location,
        String color,
        Transparency transparency,
        Instant createdAt,
        Instant updatedAt,
        List<RecurrenceRule> recurrenceRules,
        List<EventReminder> reminders,
        List<ResolvedOccurrence> occurrences
) {
    public CalendarEvent {
        recurrenceRules = recurrenceRules == null ? List.of() : List.copyOf(recurrenceRules);
        reminders = reminders == null ? List.of() : List.copyOf(reminders);
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public boolean isRecurring() {
        return !recurrenceRules.isEmpty();
    }

    /**
     * The rule that drives expansion. The schema allows several, only the first is used.
     */
    public RecurrenceRule primaryRule() {
        return recurrenceRules.isEmpty() ? null : recurrenceRules.get(0);
    }

    public CalendarEvent withAttachments(List<RecurrenceRule> rules, List<EventReminder> eventReminders) {
        return new CalendarEvent(id, ownerId, title, description, eventType, startTime, endTime,
                allDay, location, color, transparency, createdAt, updatedAt,
                rules, eventReminders, occurrences);
    }

    public CalendarEvent withOccurrences(List<ResolvedOccurrence> resolved) {
        return new CalendarEvent(id, ownerId, title, description, eventType, startTime, endTime,
                allDay, location, color, transparency, createdAt, updatedAt,
                recurrenceRules, reminders, resolved);
    }
}
