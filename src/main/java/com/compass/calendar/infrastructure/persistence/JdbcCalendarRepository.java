package com.compass.calendar.infrastructure.persistence;

import static com.compass.calendar.infrastructure.persistence.CalendarRowMappers.toDb;
import static com.compass.calendar.infrastructure.persistence.CalendarRowMappers.toIntegerArray;
import static com.compass.calendar.infrastructure.persistence.CalendarRowMappers.toTextArray;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventFilter;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventPage;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.RecurrenceRule;
import com.compass.calendar.domain.port.out.CalendarRepository;
import com.compass.calendar.domain.port.out.CalendarTransaction;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * PostgreSQL implementation of CalendarRepository.
 * Rules, occurrences, exceptions and reminders are removed with their event by ON DELETE CASCADE.
 */
@Repository
public class JdbcCalendarRepository implements CalendarRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCalendarRepository.class);

    private static final String EVENT_COLUMNS = """
            e.id, e.owner_id, e.title, e.description, e.event_type, e.start_time, e.end_time,
            e.is_all_day, e.location, e.color, e.transparency, e.created_at, e.updated_at
            """;

    // Plain overlap, or a recurring series whose span (start to until) overlaps the range
    private static final String OVERLAP_CLAUSE = """
            e.owner_id = ?::uuid
              AND (
                    (e.start_time <= ? AND e.end_time >= ?)
                 OR EXISTS (
                        SELECT 1 FROM recurrence_rules r
                        WHERE r.event_id = e.id
                          AND e.start_time <= ?
                          AND (r.until_time IS NULL OR r.until_time >= ?)
                    )
              )
            """;

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;

    public JdbcCalendarRepository(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionManager = transactionManager;
    }

    @Override
    public CalendarTransaction beginTransaction() {
        try {
            TransactionStatus status = transactionManager.getTransaction(new DefaultTransactionDefinition());
            return new JdbcCalendarTransaction(this, transactionManager, status);
        } catch (TransactionException e) {
            logger.error("Could not begin transaction", e);
            throw CalendarException.transaction("Failed to begin transaction", e);
        }
    }

    @Override
    public void createEvent(CalendarEvent event) {
        String sql = """
            INSERT INTO calendar_events (
                id, owner_id, title, description, event_type, start_time, end_time,
                is_all_day, location, color, transparency, created_at, updated_at
            ) VALUES (?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        execute("event", "create event " + event.id(), () -> jdbcTemplate.update(sql,
                event.id().toString(),
                event.ownerId().toString(),
                event.title(),
                event.description(),
                toDb(event.eventType()),
                toDb(event.startTime()),
                toDb(event.endTime()),
                event.allDay(),
                event.location(),
                event.color(),
                toDb(event.transparency()),
                toDb(event.createdAt()),
                toDb(event.updatedAt())));
    }

    @Override
    public void updateEvent(CalendarEvent event) {
        String sql = """
            UPDATE calendar_events
            SET title = ?, description = ?, event_type = ?, start_time = ?, end_time = ?,
                is_all_day = ?, location = ?, color = ?, transparency = ?, updated_at = ?
            WHERE id = ?::uuid
            """;

        int updated = execute("event", "update event " + event.id(), () -> jdbcTemplate.update(sql,
                event.title(),
                event.description(),
                toDb(event.eventType()),
                toDb(event.startTime()),
                toDb(event.endTime()),
                event.allDay(),
                event.location(),
                event.color(),
                toDb(event.transparency()),
                toDb(event.updatedAt()),
                event.id().toString()));

        if (updated == 0) {
            throw CalendarException.notFound("event", event.id());
        }
    }

    @Override
    public boolean deleteEvent(UUID id) {
        int deleted = execute("event", "delete event " + id,
                () -> jdbcTemplate.update("DELETE FROM calendar_events WHERE id = ?::uuid", id.toString()));
        logger.debug("Delete of event {} removed {} rows", id, deleted);
        return deleted > 0;
    }

    @Override
    public Optional<CalendarEvent> findEventById(UUID id) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM calendar_events e WHERE e.id = ?::uuid";

        List<CalendarEvent> found = execute("event", "find event " + id,
                () -> jdbcTemplate.query(sql, CalendarRowMappers.EVENT, id.toString()));

        return found.stream().findFirst().map(this::attach);
    }

    @Override
    public EventPage findEvents(EventFilter filter) {
        List<Object> args = new ArrayList<>(List.of(
                filter.ownerId().toString(),
                toDb(filter.rangeEnd()),
                toDb(filter.rangeStart()),
                toDb(filter.rangeEnd()),
                toDb(filter.rangeStart())));

        StringBuilder where = new StringBuilder(OVERLAP_CLAUSE);
        if (filter.eventType() != null) {
            where.append(" AND e.event_type = ?");
            args.add(toDb(filter.eventType()));
        }

        String countSql = "SELECT COUNT(*) FROM calendar_events e WHERE " + where;
        Long total = execute("event", "count events",
                () -> jdbcTemplate.queryForObject(countSql, Long.class, args.toArray()));

        String pageSql = "SELECT " + EVENT_COLUMNS + " FROM calendar_events e WHERE " + where
                + " ORDER BY e.start_time, e.id LIMIT ? OFFSET ?";
        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(filter.pageSize());
        pageArgs.add(filter.offset());

        List<CalendarEvent> events = execute("event", "list events",
                () -> jdbcTemplate.query(pageSql, CalendarRowMappers.EVENT, pageArgs.toArray()));

        return new EventPage(events.stream().map(this::attach).toList(), total == null ? 0 : total);
    }

    @Override
    public void createRecurrenceRule(RecurrenceRule rule) {
        String sql = """
            INSERT INTO recurrence_rules (
                id, event_id, freq, repeat_interval, by_day, by_month, by_month_day,
                occurrence_count, until_time, created_at, updated_at
            ) VALUES (?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        execute("recurrence_rule", "create rule for event " + rule.eventId(), () -> jdbcTemplate.update(sql,
                rule.id().toString(),
                rule.eventId().toString(),
                toDb(rule.frequency()),
                rule.interval(),
                toTextArray(rule.byDay()),
                toIntegerArray(rule.byMonth()),
                toIntegerArray(rule.byMonthDay()),
                rule.count(),
                toDb(rule.until()),
                toDb(rule.createdAt()),
                toDb(rule.updatedAt())));
    }

    @Override
    public void createOccurrence(EventOccurrence occurrence) {
        String sql = """
            INSERT INTO event_occurrences (id, event_id, occurrence_time, status, created_at, updated_at)
            VALUES (?::uuid, ?::uuid, ?, ?, ?, ?)
            """;

        execute("occurrence", "create occurrence for event " + occurrence.eventId(), () -> jdbcTemplate.update(sql,
                occurrence.id().toString(),
                occurrence.eventId().toString(),
                toDb(occurrence.occurrenceTime()),
                toDb(occurrence.status()),
                toDb(occurrence.createdAt()),
                toDb(occurrence.updatedAt())));
    }

    @Override
    public List<EventOccurrence> findOccurrences(UUID eventId, Instant start, Instant end) {
        String sql = """
            SELECT id, event_id, occurrence_time, status, created_at, updated_at
            FROM event_occurrences
            WHERE event_id = ?::uuid
              AND occurrence_time >= ?
              AND occurrence_time <= ?
            ORDER BY occurrence_time
            """;

        return execute("occurrence", "find occurrences of event " + eventId,
                () -> jdbcTemplate.query(sql, CalendarRowMappers.OCCURRENCE,
                        eventId.toString(), toDb(start), toDb(end)));
    }

    @Override
    public void createException(EventException exception) {
        String sql = """
            INSERT INTO event_exceptions (
                id, event_id, original_time, is_deleted, override_start_time, override_end_time,
                override_title, override_description, override_location, override_color,
                override_transparency, created_at, updated_at
            ) VALUES (?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        execute("exception", "create exception for event " + exception.eventId(), () -> jdbcTemplate.update(sql,
                exception.id().toString(),
                exception.eventId().toString(),
                toDb(exception.originalTime()),
                exception.deleted(),
                toDb(exception.overrideStartTime()),
                toDb(exception.overrideEndTime()),
                exception.overrideTitle(),
                exception.overrideDescription(),
                exception.overrideLocation(),
                exception.overrideColor(),
                toDb(exception.overrideTransparency()),
                toDb(exception.createdAt()),
                toDb(exception.updatedAt())));
    }

    @Override
    public void updateException(EventException exception) {
        String sql = """
            UPDATE event_exceptions
            SET is_deleted = ?, override_start_time = ?, override_end_time = ?, override_title = ?,
                override_description = ?, override_location = ?, override_color = ?,
                override_transparency = ?, updated_at = ?
            WHERE id = ?::uuid
            """;

        execute("exception", "update exception " + exception.id(), () -> jdbcTemplate.update(sql,
                exception.deleted(),
                toDb(exception.overrideStartTime()),
                toDb(exception.overrideEndTime()),
                exception.overrideTitle(),
                exception.overrideDescription(),
                exception.overrideLocation(),
                exception.overrideColor(),
                toDb(exception.overrideTransparency()),
                toDb(exception.updatedAt()),
                exception.id().toString()));
    }

    @Override
    public List<EventException> findExceptions(UUID eventId, Instant start, Instant end) {
        String sql = """
            SELECT id, event_id, original_time, is_deleted, override_start_time, override_end_time,
                   override_title, override_description, override_location, override_color,
                   override_transparency, created_at, updated_at
            FROM event_exceptions
            WHERE event_id = ?::uuid
              AND original_time >= ?
              AND original_time <= ?
            ORDER BY original_time
            """;

        return execute("exception", "find exceptions of event " + eventId,
                () -> jdbcTemplate.query(sql, CalendarRowMappers.EXCEPTION,
                        eventId.toString(), toDb(start), toDb(end)));
    }

    @Override
    public void createReminder(EventReminder reminder) {
        String sql = """
            INSERT INTO event_reminders (id, event_id, minutes_before, method, created_at, updated_at)
            VALUES (?::uuid, ?::uuid, ?, ?, ?, ?)
            """;

        execute("reminder", "create reminder for event " + reminder.eventId(), () -> jdbcTemplate.update(sql,
                reminder.id().toString(),
                reminder.eventId().toString(),
                reminder.minutesBefore(),
                toDb(reminder.method()),
                toDb(reminder.createdAt()),
                toDb(reminder.updatedAt())));
    }

    @Override
    public boolean updateReminder(EventReminder reminder) {
        String sql = """
            UPDATE event_reminders
            SET minutes_before = ?, method = ?, updated_at = ?
            WHERE id = ?::uuid
            """;

        int updated = execute("reminder", "update reminder " + reminder.id(), () -> jdbcTemplate.update(sql,
                reminder.minutesBefore(),
                toDb(reminder.method()),
                toDb(reminder.updatedAt()),
                reminder.id().toString()));
        return updated > 0;
    }

    @Override
    public boolean deleteReminder(UUID id) {
        int deleted = execute("reminder", "delete reminder " + id,
                () -> jdbcTemplate.update("DELETE FROM event_reminders WHERE id = ?::uuid", id.toString()));
        return deleted > 0;
    }

    // ===== Private Helper Methods =====

    private CalendarEvent attach(CalendarEvent event) {
        String rulesSql = """
            SELECT id, event_id, freq, repeat_interval, by_day, by_month, by_month_day,
                   occurrence_count, until_time, created_at, updated_at
            FROM recurrence_rules
            WHERE event_id = ?::uuid
            ORDER BY created_at, id
            """;
        String remindersSql = """
            SELECT id, event_id, minutes_before, method, created_at, updated_at
            FROM event_reminders
            WHERE event_id = ?::uuid
            ORDER BY minutes_before, id
            """;

        List<RecurrenceRule> rules = execute("recurrence_rule", "load rules of event " + event.id(),
                () -> jdbcTemplate.query(rulesSql, CalendarRowMappers.RULE, event.id().toString()));
        List<EventReminder> reminders = execute("reminder", "load reminders of event " + event.id(),
                () -> jdbcTemplate.query(remindersSql, CalendarRowMappers.REMINDER, event.id().toString()));

        return event.withAttachments(rules, reminders);
    }

    private <T> T execute(String entity, String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            logger.error("Database error while trying to {}", action, e);
            throw CalendarException.repository(entity, "Failed to " + action, e);
        }
    }
}
