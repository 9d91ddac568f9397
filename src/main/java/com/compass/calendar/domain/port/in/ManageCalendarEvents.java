package com.compass.calendar.domain.port.in;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.CreateEventRequest;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.OccurrenceOverride;
import com.compass.calendar.domain.model.ReminderRequest;
import com.compass.calendar.domain.model.UpdateEventRequest;
import java.time.Instant;
import java.util.UUID;

/**
 * Write side of the calendar: events, single occurrences and reminders.
 * Every operation is all-or-nothing; failures are reported as {@code CalendarException}.
 */
public interface ManageCalendarEvents {

    CalendarEvent createEvent(CreateEventRequest request, UUID ownerId);

    /**
     * Apply a partial update. When a recurring event's schedule moves, time overrides of its
     * future exceptions move by the same amount.
     */
    CalendarEvent updateEvent(UUID id, UpdateEventRequest request);

    void deleteEvent(UUID id);

    /**
     * Override fields of the occurrence originally scheduled at {@code originalTime}.
     */
    void updateOccurrence(UUID eventId, Instant originalTime, OccurrenceOverride request);

    /**
     * Suppress the occurrence originally scheduled at {@code originalTime}. Idempotent.
     */
    void deleteOccurrence(UUID eventId, Instant originalTime);

    EventReminder addReminder(UUID eventId, ReminderRequest request);

    void updateReminder(UUID id, ReminderRequest request);

    void deleteReminder(UUID id);
}
