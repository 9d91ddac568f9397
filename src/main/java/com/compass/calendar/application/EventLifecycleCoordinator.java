package com.compass.calendar.application;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.CreateEventRequest;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.OccurrenceOverride;
import com.compass.calendar.domain.model.OccurrenceStatus;
import com.compass.calendar.domain.model.RecurrenceRule;
import com.compass.calendar.domain.model.RecurrenceRuleRequest;
import com.compass.calendar.domain.model.ReminderRequest;
import com.compass.calendar.domain.model.Transparency;
import com.compass.calendar.domain.model.UpdateEventRequest;
import com.compass.calendar.domain.port.in.ManageCalendarEvents;
import com.compass.calendar.domain.port.out.CalendarRepository;
import com.compass.calendar.domain.port.out.CalendarTransaction;
import com.compass.calendar.domain.recurrence.RecurrenceExpander;
import com.compass.calendar.infrastructure.config.CalendarProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every calendar write as one request-scoped transaction.
 *
 * <p>Input is validated before the transaction opens. Inside it, the first failure aborts the
 * request and the transaction handle rolls back on close, so partial writes are never visible.
 */
@Service
public class EventLifecycleCoordinator implements ManageCalendarEvents {

    private static final Logger logger = LoggerFactory.getLogger(EventLifecycleCoordinator.class);

    private final CalendarRepository repository;
    private final RecurrenceExpander expander;
    private final CalendarValidator validator;
    private final CalendarProperties properties;
    private final Clock clock;

    public EventLifecycleCoordinator(CalendarRepository repository,
                                     RecurrenceExpander expander,
                                     CalendarValidator validator,
                                     CalendarProperties properties,
                                     Clock clock) {
        this.repository = repository;
        this.expander = expander;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CalendarEvent createEvent(CreateEventRequest request, UUID ownerId) {
        Instant now = clock.instant();
        UUID eventId = UUID.randomUUID();

        CalendarEvent event = new CalendarEvent(
                eventId, ownerId, request.title(), request.description(),
                request.eventType() != null ? request.eventType() : EventType.NONE,
                request.startTime(), request.endTime(), request.allDay(),
                request.location(), request.color(),
                request.transparency() != null ? request.transparency() : Transparency.OPAQUE,
                now, now, List.of(), List.of(), List.of());
        validator.validateEvent(event);

        RecurrenceRule rule = null;
        if (request.recurrenceRule() != null) {
            rule = toRule(request.recurrenceRule(), eventId, now);
            validator.validateRule(rule, event);
        }

        List<EventReminder> reminders = new ArrayList<>();
        for (ReminderRequest reminderRequest : request.reminders()) {
            EventReminder reminder = toReminder(UUID.randomUUID(), eventId, reminderRequest, now);
            validator.validateReminder(reminder);
            reminders.add(reminder);
        }

        RecurrenceRule recurrenceRule = rule;
        int occurrenceCount = inTransaction("Create event", eventId, (tx, progress) -> {
            progress.enter(LifecycleStage.PERSISTING);
            tx.createEvent(event);

            int created = 0;
            if (recurrenceRule != null) {
                tx.createRecurrenceRule(recurrenceRule);

                progress.enter(LifecycleStage.EXPANDING);
                List<Instant> occurrenceTimes = expander.expand(event, recurrenceRule);

                progress.enter(LifecycleStage.PERSISTING_OCCURRENCES);
                for (Instant occurrenceTime : occurrenceTimes) {
                    tx.createOccurrence(new EventOccurrence(UUID.randomUUID(), eventId, occurrenceTime,
                            OccurrenceStatus.UPCOMING, now, now));
                    created++;
                }
            }

            progress.enter(LifecycleStage.PERSISTING_REMINDERS);
            for (EventReminder reminder : reminders) {
                tx.createReminder(reminder);
            }
            return created;
        });

        logger.info("Created event {} for owner {} with {} occurrences and {} reminders",
                eventId, ownerId, occurrenceCount, reminders.size());
        return event.withAttachments(recurrenceRule == null ? List.of() : List.of(recurrenceRule), reminders);
    }

    @Override
    public CalendarEvent updateEvent(UUID id, UpdateEventRequest request) {
        CalendarEvent existing = repository.findEventById(id)
                .orElseThrow(() -> CalendarException.notFound("event", id));

        // measured against the stored start, before any field is applied
        Duration delta = request.startTime() != null
                ? Duration.between(existing.startTime(), request.startTime())
                : Duration.ZERO;

        Instant now = clock.instant();
        CalendarEvent updated = applyUpdate(existing, request, now);
        validator.validateEvent(updated);

        int shifted = inTransaction("Update event", id, (tx, progress) -> {
            progress.enter(LifecycleStage.PERSISTING);
            tx.updateEvent(updated);

            if (!updated.isRecurring() || !request.changesSchedule() || delta.isZero()) {
                return 0;
            }

            progress.enter(LifecycleStage.SHIFTING_EXCEPTIONS);
            Instant lookaheadEnd = now.atZone(ZoneOffset.UTC)
                    .plus(properties.getExceptionShiftLookahead())
                    .toInstant();
            int count = 0;
            for (EventException exception : tx.findExceptions(id, now, lookaheadEnd)) {
                if (exception.hasTimeOverride()) {
                    tx.updateException(exception.shiftedBy(delta, now));
                    count++;
                }
            }
            return count;
        });

        logger.info("Updated event {} (shifted {} exception overrides by {})", id, shifted, delta);
        return updated;
    }

    @Override
    public void deleteEvent(UUID id) {
        if (!repository.deleteEvent(id)) {
            throw CalendarException.notFound("event", id);
        }
        logger.info("Deleted event {}", id);
    }

    @Override
    public void updateOccurrence(UUID eventId, Instant originalTime, OccurrenceOverride request) {
        CalendarEvent event = requireOccurrence(eventId, originalTime);
        Instant now = clock.instant();

        boolean created = inTransaction("Update occurrence", eventId, (tx, progress) -> {
            progress.enter(LifecycleStage.PERSISTING);
            Optional<EventException> existing = findException(tx, eventId, originalTime);
            if (existing.isPresent()) {
                tx.updateException(existing.get().withOverrides(request, now));
                return false;
            }
            tx.createException(EventException.anchoredAt(UUID.randomUUID(), eventId, originalTime, now)
                    .withOverrides(request, now));
            return true;
        });

        logger.info("{} exception for occurrence {} of event {}",
                created ? "Created" : "Updated", originalTime, event.id());
    }

    @Override
    public void deleteOccurrence(UUID eventId, Instant originalTime) {
        requireOccurrence(eventId, originalTime);
        Instant now = clock.instant();

        inTransaction("Delete occurrence", eventId, (tx, progress) -> {
            progress.enter(LifecycleStage.PERSISTING);
            Optional<EventException> existing = findException(tx, eventId, originalTime);
            if (existing.isPresent()) {
                tx.updateException(existing.get().markedDeleted(now));
            } else {
                tx.createException(EventException.anchoredAt(UUID.randomUUID(), eventId, originalTime, now)
                        .markedDeleted(now));
            }
            return null;
        });

        logger.info("Deleted occurrence {} of event {}", originalTime, eventId);
    }

    @Override
    public EventReminder addReminder(UUID eventId, ReminderRequest request) {
        Instant now = clock.instant();
        EventReminder reminder = toReminder(UUID.randomUUID(), eventId, request, now);
        validator.validateReminder(reminder);

        if (repository.findEventById(eventId).isEmpty()) {
            throw CalendarException.notFound("event", eventId);
        }
        repository.createReminder(reminder);

        logger.info("Added reminder {} to event {}", reminder.id(), eventId);
        return reminder;
    }

    @Override
    public void updateReminder(UUID id, ReminderRequest request) {
        EventReminder reminder = toReminder(id, null, request, clock.instant());
        validator.validateReminder(reminder);

        if (!repository.updateReminder(reminder)) {
            throw CalendarException.notFound("reminder", id);
        }
        logger.info("Updated reminder {}", id);
    }

    @Override
    public void deleteReminder(UUID id) {
        if (!repository.deleteReminder(id)) {
            throw CalendarException.notFound("reminder", id);
        }
        logger.info("Deleted reminder {}", id);
    }

    // ===== Private Helper Methods =====

    private <T> T inTransaction(String operation, UUID target, TransactionWork<T> work) {
        Progress progress = new Progress();
        try (CalendarTransaction tx = repository.beginTransaction()) {
            T result = work.execute(tx, progress);
            progress.enter(LifecycleStage.COMMITTING);
            tx.commit();
            return result;
        } catch (RuntimeException e) {
            LifecycleStage failedAt = progress.stage;
            progress.enter(LifecycleStage.ROLLING_BACK);
            logger.error("{} {} failed during {}, transaction rolled back", operation, target, failedAt, e);
            throw e;
        }
    }

    /**
     * Loads the event and checks that {@code originalTime} is one of its occurrences, either
     * stored or produced by its rule.
     */
    private CalendarEvent requireOccurrence(UUID eventId, Instant originalTime) {
        CalendarEvent event = repository.findEventById(eventId)
                .orElseThrow(() -> CalendarException.notFound("event", eventId));
        if (!event.isRecurring()) {
            throw CalendarException.validation("event", "recurrenceRules",
                    "Cannot change a single occurrence of a non-recurring event");
        }
        if (originalTime == null) {
            throw CalendarException.validation("occurrence", "originalTime", "Original time is required");
        }

        boolean generated = expander.expandThrough(event, event.primaryRule(), originalTime).contains(originalTime);
        if (!generated && repository.findOccurrences(eventId, originalTime, originalTime).isEmpty()) {
            logger.warn("Rejected occurrence {} of event {}: not part of the series", originalTime, eventId);
            throw CalendarException.validation("occurrence", "originalTime",
                    "No occurrence of event " + eventId + " at " + originalTime);
        }
        return event;
    }

    private Optional<EventException> findException(CalendarTransaction tx, UUID eventId, Instant originalTime) {
        return tx.findExceptions(eventId, originalTime, originalTime).stream()
                .filter(exception -> exception.originalTime().equals(originalTime))
                .findFirst();
    }

    private CalendarEvent applyUpdate(CalendarEvent event, UpdateEventRequest request, Instant now) {
        return new CalendarEvent(
                event.id(),
                event.ownerId(),
                request.title() != null ? request.title() : event.title(),
                request.description() != null ? request.description() : event.description(),
                request.eventType() != null ? request.eventType() : event.eventType(),
                request.startTime() != null ? request.startTime() : event.startTime(),
                request.endTime() != null ? request.endTime() : event.endTime(),
                request.allDay() != null ? request.allDay() : event.allDay(),
                request.location() != null ? request.location() : event.location(),
                request.color() != null ? request.color() : event.color(),
                request.transparency() != null ? request.transparency() : event.transparency(),
                event.createdAt(),
                now,
                event.recurrenceRules(),
                event.reminders(),
                List.of());
    }

    private RecurrenceRule toRule(RecurrenceRuleRequest request, UUID eventId, Instant now) {
        if (containsNull(request.byMonth()) || containsNull(request.byMonthDay())) {
            throw CalendarException.validation("recurrenceRule",
                    containsNull(request.byMonth()) ? "byMonth" : "byMonthDay", "Filter values must not be null");
        }
        Set<String> byDay = request.byDay() == null ? Set.of() : request.byDay().stream()
                .map(day -> day == null ? "" : day.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return new RecurrenceRule(
                UUID.randomUUID(),
                eventId,
                request.frequency(),
                request.interval() != null ? request.interval() : 1,
                byDay,
                request.byMonth(),
                request.byMonthDay(),
                request.count(),
                request.until(),
                now,
                now);
    }

    private static boolean containsNull(Set<Integer> values) {
        return values != null && values.stream().anyMatch(value -> value == null);
    }

    private EventReminder toReminder(UUID id, UUID eventId, ReminderRequest request, Instant now) {
        if (request.minutesBefore() == null) {
            throw CalendarException.validation("reminder", "minutesBefore", "Minutes before is required");
        }
        return new EventReminder(id, eventId, request.minutesBefore(), request.method(), now, now);
    }

    @FunctionalInterface
    private interface TransactionWork<T> {
        T execute(CalendarTransaction tx, Progress progress);
    }

    private static final class Progress {
        private LifecycleStage stage = LifecycleStage.VALIDATING;

        void enter(LifecycleStage next) {
            logger.debug("{} -> {}", stage, next);
            stage = next;
        }
    }
}
