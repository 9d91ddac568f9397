package com.compass.calendar.infrastructure.web;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventPage;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.ResolvedOccurrence;
import com.compass.calendar.domain.port.in.ManageCalendarEvents;
import com.compass.calendar.domain.port.in.QueryCalendarEvents;
import com.compass.calendar.infrastructure.web.dto.EventListResponse;
import com.compass.calendar.infrastructure.web.dto.EventRequest;
import com.compass.calendar.infrastructure.web.dto.EventResponse;
import com.compass.calendar.infrastructure.web.dto.EventUpdateRequest;
import com.compass.calendar.infrastructure.web.dto.OccurrenceOverrideRequest;
import com.compass.calendar.infrastructure.web.dto.OccurrenceResponse;
import com.compass.calendar.infrastructure.web.dto.ReminderRequestDto;
import com.compass.calendar.infrastructure.web.dto.ReminderResponse;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.constraints.NotNull;

/**
 * HTTP adapter for the calendar. Errors are rendered by {@link CalendarExceptionHandler}.
 */
@RestController
@RequestMapping("/api/calendar")
public class CalendarController {

    private static final Logger logger = LoggerFactory.getLogger(CalendarController.class);

    static final String USER_HEADER = "X-User-Id";

    private final ManageCalendarEvents manageEvents;
    private final QueryCalendarEvents queryEvents;

    public CalendarController(ManageCalendarEvents manageEvents, QueryCalendarEvents queryEvents) {
        this.manageEvents = manageEvents;
        this.queryEvents = queryEvents;
    }

    @PostMapping("/events")
    public ResponseEntity<EventResponse> createEvent(
            @RequestHeader(USER_HEADER) UUID ownerId,
            @RequestBody EventRequest request
    ) {
        logger.info("Creating event '{}' for user {}", request.title(), ownerId);

        CalendarEvent event = manageEvents.createEvent(request.toDomain(), ownerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEvent(event));
    }

    @GetMapping("/events")
    public ResponseEntity<EventListResponse> listEvents(
            @RequestHeader(USER_HEADER) UUID ownerId,

            @RequestParam("start_time")
            @NotNull
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant startTime,

            @RequestParam("end_time")
            @NotNull
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant endTime,

            @RequestParam(value = "event_type", required = false) EventType eventType,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "page_size", required = false) Integer pageSize
    ) {
        logger.info("Listing events of user {} from {} to {}", ownerId, startTime, endTime);

        EventPage result = queryEvents.listEvents(ownerId, startTime, endTime, eventType, page, pageSize);

        logger.info("Found {} events ({} total)", result.events().size(), result.total());
        return ResponseEntity.ok(EventListResponse.fromPage(result));
    }

    @GetMapping("/events/{id}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(EventResponse.fromEvent(queryEvents.getEventById(id)));
    }

    @PutMapping("/events/{id}")
    public ResponseEntity<EventResponse> updateEvent(
            @PathVariable("id") UUID id,
            @RequestBody EventUpdateRequest request
    ) {
        logger.info("Updating event {}", id);
        return ResponseEntity.ok(EventResponse.fromEvent(manageEvents.updateEvent(id, request.toDomain())));
    }

    @DeleteMapping("/events/{id}")
    public ResponseEntity<Void> deleteEvent(@PathVariable("id") UUID id) {
        logger.info("Deleting event {}", id);
        manageEvents.deleteEvent(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/events/{id}/occurrences")
    public ResponseEntity<Void> updateOccurrence(
            @PathVariable("id") UUID id,

            @RequestParam("original_time")
            @NotNull
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant originalTime,

            @RequestBody OccurrenceOverrideRequest request
    ) {
        logger.info("Overriding occurrence {} of event {}", originalTime, id);
        manageEvents.updateOccurrence(id, originalTime, request.toDomain());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/events/{id}/occurrences")
    public ResponseEntity<Void> deleteOccurrence(
            @PathVariable("id") UUID id,

            @RequestParam("original_time")
            @NotNull
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant originalTime
    ) {
        logger.info("Deleting occurrence {} of event {}", originalTime, id);
        manageEvents.deleteOccurrence(id, originalTime);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/events/{id}/occurrences")
    public ResponseEntity<List<OccurrenceResponse>> listOccurrences(
            @PathVariable("id") UUID id,

            @RequestParam("start_time")
            @NotNull
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant startTime,

            @RequestParam("end_time")
            @NotNull
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant endTime
    ) {
        List<ResolvedOccurrence> occurrences = queryEvents.listOccurrences(id, startTime, endTime);
        return ResponseEntity.ok(occurrences.stream().map(OccurrenceResponse::fromOccurrence).toList());
    }

    @PostMapping("/events/{id}/reminders")
    public ResponseEntity<ReminderResponse> addReminder(
            @PathVariable("id") UUID id,
            @RequestBody ReminderRequestDto request
    ) {
        logger.info("Adding reminder to event {}", id);

        EventReminder reminder = manageEvents.addReminder(id, request.toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReminderResponse.fromReminder(reminder));
    }

    @PutMapping("/reminders/{id}")
    public ResponseEntity<Void> updateReminder(
            @PathVariable("id") UUID id,
            @RequestBody ReminderRequestDto request
    ) {
        manageEvents.updateReminder(id, request.toDomain());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/reminders/{id}")
    public ResponseEntity<Void> deleteReminder(@PathVariable("id") UUID id) {
        manageEvents.deleteReminder(id);
        return ResponseEntity.noContent().build();
    }
}
