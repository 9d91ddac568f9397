package com.compass.calendar.application;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventFilter;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventPage;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.ResolvedOccurrence;
import com.compass.calendar.domain.port.in.QueryCalendarEvents;
import com.compass.calendar.domain.port.out.CalendarRepository;
import com.compass.calendar.domain.recurrence.ExceptionResolver;
import com.compass.calendar.domain.recurrence.RecurrenceExpander;
import com.compass.calendar.infrastructure.config.CalendarProperties;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read side of the calendar.
 *
 * <p>{@link #listEvents} re-expands recurring events over the requested range instead of
 * trusting stored occurrences, so it does not depend on how far the series was materialized.
 * {@link #listOccurrences} reads the stored rows; the two can disagree once a series runs
 * past its materialization horizon.
 */
@Service
public class OccurrenceQueryService implements QueryCalendarEvents {

    private static final Logger logger = LoggerFactory.getLogger(OccurrenceQueryService.class);

    private final CalendarRepository repository;
    private final RecurrenceExpander expander;
    private final ExceptionResolver resolver;
    private final CalendarValidator validator;
    private final CalendarProperties properties;

    public OccurrenceQueryService(CalendarRepository repository,
                                  RecurrenceExpander expander,
                                  ExceptionResolver resolver,
                                  CalendarValidator validator,
                                  CalendarProperties properties) {
        this.repository = repository;
        this.expander = expander;
        this.resolver = resolver;
        this.validator = validator;
        this.properties = properties;
    }

    @Override
    public CalendarEvent getEventById(UUID id) {
        return repository.findEventById(id)
                .orElseThrow(() -> CalendarException.notFound("event", id));
    }

    @Override
    public EventPage listEvents(UUID ownerId, Instant rangeStart, Instant rangeEnd,
                                EventType eventType, int page, Integer pageSize) {
        logger.debug("Listing events of {} from {} to {}", ownerId, rangeStart, rangeEnd);

        if (ownerId == null) {
            throw CalendarException.validation("event", "ownerId", "Owner is required");
        }
        validator.validateRange(rangeStart, rangeEnd);
        int size = pageSize != null ? pageSize : properties.getDefaultPageSize();
        validator.validatePage(page, size, properties.getMaxPageSize());

        EventPage matching = repository.findEvents(
                new EventFilter(ownerId, rangeStart, rangeEnd, eventType, page, size));

        List<CalendarEvent> events = matching.events().stream()
                .map(event -> event.isRecurring() ? withOccurrences(event, rangeStart, rangeEnd) : event)
                .toList();

        logger.debug("Found {} events ({} total)", events.size(), matching.total());
        return new EventPage(events, matching.total());
    }

    @Override
    public List<ResolvedOccurrence> listOccurrences(UUID eventId, Instant start, Instant end) {
        validator.validateRange(start, end);
        if (repository.findEventById(eventId).isEmpty()) {
            throw CalendarException.notFound("event", eventId);
        }

        List<EventOccurrence> stored = repository.findOccurrences(eventId, start, end);
        List<EventException> exceptions = repository.findExceptions(eventId, start, end);
        return resolver.resolve(stored, exceptions);
    }

    private CalendarEvent withOccurrences(CalendarEvent event, Instant rangeStart, Instant rangeEnd) {
        List<EventOccurrence> generated = expander.expandThrough(event, event.primaryRule(), rangeEnd).stream()
                .filter(time -> !time.isBefore(rangeStart))
                .map(time -> EventOccurrence.generated(event.id(), time))
                .toList();

        List<EventException> exceptions = repository.findExceptions(event.id(), rangeStart, rangeEnd);
        List<ResolvedOccurrence> resolved = resolver.resolve(generated, exceptions);

        logger.debug("Event {}: {} generated, {} exceptions, {} resolved occurrences in range",
                event.id(), generated.size(), exceptions.size(), resolved.size());
        return event.withOccurrences(resolved);
    }
}
