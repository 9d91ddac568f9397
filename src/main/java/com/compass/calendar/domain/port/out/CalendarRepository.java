package com.compass.calendar.domain.port.out;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventFilter;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventPage;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.RecurrenceRule;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository port for the calendar aggregate
 * This is the contract that infrastructure must implement.
 * Storage failures surface as {@code CalendarException} of kind {@code REPOSITORY}.
 */
public interface CalendarRepository {

    /**
     * Open a transaction. Writes issued through the returned handle are applied together on
     * {@link CalendarTransaction#commit()} and discarded on rollback or close.
     */
    CalendarTransaction beginTransaction();

    void createEvent(CalendarEvent event);

    void updateEvent(CalendarEvent event);

    /**
     * Delete the event and everything attached to it.
     * @return false if no such event existed
     */
    boolean deleteEvent(UUID id);

    /**
     * Find an event with its recurrence rules and reminders attached
     */
    Optional<CalendarEvent> findEventById(UUID id);

    /**
     * Events of one owner overlapping the filter range, with rules and reminders attached.
     * A recurring event overlaps when its series span (start to until) does.
     */
    EventPage findEvents(EventFilter filter);

    void createRecurrenceRule(RecurrenceRule rule);

    void createOccurrence(EventOccurrence occurrence);

    /**
     * Stored occurrences with {@code start <= occurrenceTime <= end}, ordered by time
     */
    List<EventOccurrence> findOccurrences(UUID eventId, Instant start, Instant end);

    void createException(EventException exception);

    void updateException(EventException exception);

    /**
     * Exceptions with {@code start <= originalTime <= end}
     */
    List<EventException> findExceptions(UUID eventId, Instant start, Instant end);

    void createReminder(EventReminder reminder);

    /**
     * @return false if no such reminder existed
     */
    boolean updateReminder(EventReminder reminder);

    /**
     * @return false if no such reminder existed
     */
    boolean deleteReminder(UUID id);
}
