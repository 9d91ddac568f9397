package com.compass.calendar.domain.port.out;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.RecurrenceRule;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A transaction scoped to one write request.
 * Use in try-with-resources: {@link #close()} rolls back unless {@link #commit()} succeeded.
 */
public interface CalendarTransaction extends AutoCloseable {

    void createEvent(CalendarEvent event);

    void updateEvent(CalendarEvent event);

    void createRecurrenceRule(RecurrenceRule rule);

    void createOccurrence(EventOccurrence occurrence);

    void createReminder(EventReminder reminder);

    void createException(EventException exception);

    void updateException(EventException exception);

    List<EventException> findExceptions(UUID eventId, Instant start, Instant end);

    void commit();

    void rollback();

    boolean isCompleted();

    @Override
    default void close() {
        if (!isCompleted()) {
            rollback();
        }
    }
}
