package com.compass.calendar.support;

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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Map-backed repository for application tests.
 * Transactional writes are buffered and only applied on commit.
 */
public class InMemoryCalendarRepository implements CalendarRepository {

    private final Map<UUID, CalendarEvent> events = new LinkedHashMap<>();
    private final Map<UUID, RecurrenceRule> rules = new LinkedHashMap<>();
    private final Map<UUID, EventOccurrence> occurrences = new LinkedHashMap<>();
    private final Map<UUID, EventException> exceptions = new LinkedHashMap<>();
    private final Map<UUID, EventReminder> reminders = new LinkedHashMap<>();

    private int commits;
    private int rollbacks;
    private int occurrenceWritesBeforeFailure = -1;

    /**
     * Make the transactional occurrence write number {@code writes + 1} fail with a repository error.
     */
    public void failOccurrenceWritesAfter(int writes) {
        this.occurrenceWritesBeforeFailure = writes;
    }

    public int commits() {
        return commits;
    }

    public int rollbacks() {
        return rollbacks;
    }

    public int eventCount() {
        return events.size();
    }

    public List<RecurrenceRule> storedRules() {
        return List.copyOf(rules.values());
    }

    public List<EventOccurrence> storedOccurrences() {
        return List.copyOf(occurrences.values());
    }

    public List<EventException> storedExceptions() {
        return List.copyOf(exceptions.values());
    }

    public List<EventReminder> storedReminders() {
        return List.copyOf(reminders.values());
    }

    @Override
    public CalendarTransaction beginTransaction() {
        return new InMemoryTransaction();
    }

    @Override
    public void createEvent(CalendarEvent event) {
        events.put(event.id(), event.withAttachments(List.of(), List.of()));
    }

    @Override
    public void updateEvent(CalendarEvent event) {
        if (!events.containsKey(event.id())) {
            throw CalendarException.notFound("event", event.id());
        }
        events.put(event.id(), event.withAttachments(List.of(), List.of()).withOccurrences(List.of()));
    }

    @Override
    public boolean deleteEvent(UUID id) {
        if (events.remove(id) == null) {
            return false;
        }
        rules.values().removeIf(rule -> rule.eventId().equals(id));
        occurrences.values().removeIf(occurrence -> occurrence.eventId().equals(id));
        exceptions.values().removeIf(exception -> exception.eventId().equals(id));
        reminders.values().removeIf(reminder -> reminder.eventId().equals(id));
        return true;
    }

    @Override
    public Optional<CalendarEvent> findEventById(UUID id) {
        return Optional.ofNullable(events.get(id)).map(this::attach);
    }

    @Override
    public EventPage findEvents(EventFilter filter) {
        List<CalendarEvent> matching = events.values().stream()
                .filter(event -> event.ownerId().equals(filter.ownerId()))
                .filter(event -> filter.eventType() == null || event.eventType() == filter.eventType())
                .map(this::attach)
                .filter(event -> overlaps(event, filter.rangeStart(), filter.rangeEnd()))
                .sorted(Comparator.comparing(CalendarEvent::startTime))
                .toList();

        List<CalendarEvent> page = matching.stream()
                .skip(filter.offset())
                .limit(filter.pageSize())
                .toList();
        return new EventPage(page, matching.size());
    }

    @Override
    public void createRecurrenceRule(RecurrenceRule rule) {
        rules.put(rule.id(), rule);
    }

    @Override
    public void createOccurrence(EventOccurrence occurrence) {
        boolean duplicate = occurrences.values().stream()
                .anyMatch(existing -> existing.eventId().equals(occurrence.eventId())
                        && existing.occurrenceTime().equals(occurrence.occurrenceTime()));
        if (duplicate) {
            throw CalendarException.repository("occurrence", "Duplicate occurrence " + occurrence.occurrenceTime(), null);
        }
        occurrences.put(occurrence.id(), occurrence);
    }

    @Override
    public List<EventOccurrence> findOccurrences(UUID eventId, Instant start, Instant end) {
        return occurrences.values().stream()
                .filter(occurrence -> occurrence.eventId().equals(eventId))
                .filter(occurrence -> within(occurrence.occurrenceTime(), start, end))
                .sorted(Comparator.comparing(EventOccurrence::occurrenceTime))
                .toList();
    }

    @Override
    public void createException(EventException exception) {
        boolean duplicate = exceptions.values().stream()
                .anyMatch(existing -> existing.eventId().equals(exception.eventId())
                        && existing.originalTime().equals(exception.originalTime()));
        if (duplicate) {
            throw CalendarException.repository("exception", "Duplicate exception " + exception.originalTime(), null);
        }
        exceptions.put(exception.id(), exception);
    }

    @Override
    public void updateException(EventException exception) {
        exceptions.put(exception.id(), exception);
    }

    @Override
    public List<EventException> findExceptions(UUID eventId, Instant start, Instant end) {
        return exceptions.values().stream()
                .filter(exception -> exception.eventId().equals(eventId))
                .filter(exception -> within(exception.originalTime(), start, end))
                .toList();
    }

    @Override
    public void createReminder(EventReminder reminder) {
        reminders.put(reminder.id(), reminder);
    }

    @Override
    public boolean updateReminder(EventReminder reminder) {
        EventReminder existing = reminders.get(reminder.id());
        if (existing == null) {
            return false;
        }
        reminders.put(reminder.id(), new EventReminder(existing.id(), existing.eventId(),
                reminder.minutesBefore(), reminder.method(), existing.createdAt(), reminder.updatedAt()));
        return true;
    }

    @Override
    public boolean deleteReminder(UUID id) {
        return reminders.remove(id) != null;
    }

    // ===== Private Helper Methods =====

    private CalendarEvent attach(CalendarEvent event) {
        List<RecurrenceRule> eventRules = rules.values().stream()
                .filter(rule -> rule.eventId().equals(event.id()))
                .toList();
        List<EventReminder> eventReminders = reminders.values().stream()
                .filter(reminder -> reminder.eventId().equals(event.id()))
                .toList();
        return event.withAttachments(eventRules, eventReminders);
    }

    private static boolean overlaps(CalendarEvent event, Instant start, Instant end) {
        if (!event.startTime().isAfter(end) && !event.endTime().isBefore(start)) {
            return true;
        }
        RecurrenceRule rule = event.primaryRule();
        return rule != null
                && !event.startTime().isAfter(end)
                && (rule.until() == null || !rule.until().isBefore(start));
    }

    private static boolean within(Instant time, Instant start, Instant end) {
        return !time.isBefore(start) && !time.isAfter(end);
    }

    private class InMemoryTransaction implements CalendarTransaction {

        private final List<Runnable> pending = new ArrayList<>();
        private int occurrenceWrites;
        private boolean completed;

        @Override
        public void createEvent(CalendarEvent event) {
            pending.add(() -> InMemoryCalendarRepository.this.createEvent(event));
        }

        @Override
        public void updateEvent(CalendarEvent event) {
            if (!events.containsKey(event.id())) {
                throw CalendarException.notFound("event", event.id());
            }
            pending.add(() -> InMemoryCalendarRepository.this.updateEvent(event));
        }

        @Override
        public void createRecurrenceRule(RecurrenceRule rule) {
            pending.add(() -> InMemoryCalendarRepository.this.createRecurrenceRule(rule));
        }

        @Override
        public void createOccurrence(EventOccurrence occurrence) {
            if (occurrenceWritesBeforeFailure >= 0 && occurrenceWrites >= occurrenceWritesBeforeFailure) {
                throw CalendarException.repository("occurrence", "Simulated write failure", null);
            }
            occurrenceWrites++;
            pending.add(() -> InMemoryCalendarRepository.this.createOccurrence(occurrence));
        }

        @Override
        public void createReminder(EventReminder reminder) {
            pending.add(() -> InMemoryCalendarRepository.this.createReminder(reminder));
        }

        @Override
        public void createException(EventException exception) {
            pending.add(() -> InMemoryCalendarRepository.this.createException(exception));
        }

        @Override
        public void updateException(EventException exception) {
            pending.add(() -> InMemoryCalendarRepository.this.updateException(exception));
        }

        @Override
        public List<EventException> findExceptions(UUID eventId, Instant start, Instant end) {
            return InMemoryCalendarRepository.this.findExceptions(eventId, start, end);
        }

        @Override
        public void commit() {
            pending.forEach(Runnable::run);
            pending.clear();
            completed = true;
            commits++;
        }

        @Override
        public void rollback() {
            pending.clear();
            completed = true;
            rollbacks++;
        }

        @Override
        public boolean isCompleted() {
            return completed;
        }
    }
}
