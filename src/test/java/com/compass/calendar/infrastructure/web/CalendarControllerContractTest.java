package com.compass.calendar.infrastructure.web;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.CreateEventRequest;
import com.compass.calendar.domain.model.EventPage;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.Frequency;
import com.compass.calendar.domain.model.OccurrenceOverride;
import com.compass.calendar.domain.model.OccurrenceStatus;
import com.compass.calendar.domain.model.RecurrenceRule;
import com.compass.calendar.domain.model.ReminderMethod;
import com.compass.calendar.domain.model.ResolvedOccurrence;
import com.compass.calendar.domain.model.Transparency;
import com.compass.calendar.domain.port.in.ManageCalendarEvents;
import com.compass.calendar.domain.port.in.QueryCalendarEvents;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CalendarController.class)
class CalendarControllerContractTest {

    private static final UUID OWNER = UUID.fromString("7d3f5a2e-1c4b-4d8e-9f01-23456789abcd");
    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ManageCalendarEvents manageEvents;

    @MockBean
    private QueryCalendarEvents queryEvents;

    @Test
    void shouldCreateEventAndReturnCreated() throws Exception {
        // Given
        CalendarEvent event = recurringEvent();
        when(manageEvents.createEvent(any(), eq(OWNER))).thenReturn(event);

        String body = """
            {
              "title": "Standup",
              "event_type": "MEETING",
              "start_time": "2024-01-01T09:00:00Z",
              "end_time": "2024-01-01T09:15:00Z",
              "recurrence_rule": {"frequency": "WEEKLY", "interval": 1, "by_day": ["MO"], "count": 3},
              "reminders": [{"minutes_before": 10, "method": "PUSH"}]
            }
            """;

        // When & Then
        mockMvc.perform(post("/api/calendar/events")
                        .header("X-User-Id", OWNER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.id", is(event.id().toString())))
                .andExpect(jsonPath("$.user_id", is(OWNER.toString())))
                .andExpect(jsonPath("$.title", is("Standup")))
                .andExpect(jsonPath("$.start_time", is("2024-01-01T09:00:00Z")))
                .andExpect(jsonPath("$.recurrence_rules", hasSize(1)))
                .andExpect(jsonPath("$.recurrence_rules[0].frequency", is("WEEKLY")));

        ArgumentCaptor<CreateEventRequest> captor = ArgumentCaptor.forClass(CreateEventRequest.class);
        verify(manageEvents).createEvent(captor.capture(), eq(OWNER));
        CreateEventRequest request = captor.getValue();
        assertThat(request.eventType()).isEqualTo(EventType.MEETING);
        assertThat(request.recurrenceRule().frequency()).isEqualTo(Frequency.WEEKLY);
        assertThat(request.recurrenceRule().byDay()).containsExactly("MO");
        assertThat(request.reminders()).hasSize(1);
    }

    @Test
    void shouldReturnBadRequestWhenUserHeaderIsMissing() throws Exception {
        // When & Then
        mockMvc.perform(post("/api/calendar/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Standup\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind", is("VALIDATION")))
                .andExpect(jsonPath("$.field", is("X-User-Id")));

        verifyNoInteractions(manageEvents);
    }

    @Test
    void shouldRejectNullReminderEntry() throws Exception {
        // Given
        String body = """
            {
              "title": "Dentist",
              "start_time": "2024-01-01T09:00:00Z",
              "end_time": "2024-01-01T10:00:00Z",
              "reminders": [null]
            }
            """;

        // When & Then
        mockMvc.perform(post("/api/calendar/events")
                        .header("X-User-Id", OWNER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind", is("VALIDATION")))
                .andExpect(jsonPath("$.field", is("reminders")));

        verifyNoInteractions(manageEvents);
    }

    @Test
    void shouldMapValidationErrorToBadRequest() throws Exception {
        // Given
        when(manageEvents.createEvent(any(), any()))
                .thenThrow(CalendarException.validation("event", "title", "Title must not be empty"));

        // When & Then
        mockMvc.perform(post("/api/calendar/events")
                        .header("X-User-Id", OWNER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind", is("VALIDATION")))
                .andExpect(jsonPath("$.entity", is("event")))
                .andExpect(jsonPath("$.field", is("title")))
                .andExpect(jsonPath("$.message", is("Title must not be empty")));
    }

    @Test
    void shouldListEventsWithOccurrences() throws Exception {
        // Given
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-31T23:59:59Z");
        CalendarEvent event = recurringEvent().withOccurrences(List.of(
                new ResolvedOccurrence(UUID.randomUUID(), Instant.parse("2024-01-08T09:00:00Z"),
                        Instant.parse("2024-01-08T11:00:00Z"), null, OccurrenceStatus.UPCOMING,
                        "Moved standup", null, null, null, null, true)));
        when(queryEvents.listEvents(OWNER, start, end, EventType.MEETING, 1, 20))
                .thenReturn(new EventPage(List.of(event), 1));

        // When & Then
        mockMvc.perform(get("/api/calendar/events")
                        .header("X-User-Id", OWNER.toString())
                        .param("start_time", "2024-01-01T00:00:00Z")
                        .param("end_time", "2024-01-31T23:59:59Z")
                        .param("event_type", "MEETING")
                        .param("page_size", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(1)))
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].occurrences", hasSize(1)))
                .andExpect(jsonPath("$.events[0].occurrences[0].original_time", is("2024-01-08T09:00:00Z")))
                .andExpect(jsonPath("$.events[0].occurrences[0].occurrence_time", is("2024-01-08T11:00:00Z")))
                .andExpect(jsonPath("$.events[0].occurrences[0].modified", is(true)));
    }

    @Test
    void shouldReturnBadRequestWhenRangeIsMissingOrMalformed() throws Exception {
        // When & Then
        mockMvc.perform(get("/api/calendar/events")
                        .header("X-User-Id", OWNER.toString())
                        .param("end_time", "2024-01-31T23:59:59Z"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/calendar/events")
                        .header("X-User-Id", OWNER.toString())
                        .param("start_time", "yesterday")
                        .param("end_time", "2024-01-31T23:59:59Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field", is("start_time")));

        verifyNoInteractions(queryEvents);
    }

    @Test
    void shouldMapNotFoundToNotFound() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        when(queryEvents.getEventById(id)).thenThrow(CalendarException.notFound("event", id));

        // When & Then
        mockMvc.perform(get("/api/calendar/events/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind", is("NOT_FOUND")))
                .andExpect(jsonPath("$.entity", is("event")));
    }

    @Test
    void shouldMapRepositoryAndTransactionErrorsToServerError() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        doThrow(CalendarException.repository("event", "Failed to delete event", new RuntimeException("boom")))
                .when(manageEvents).deleteEvent(id);
        doThrow(CalendarException.transaction("Failed to commit transaction", null))
                .when(manageEvents).deleteOccurrence(eq(id), any());

        // When & Then
        mockMvc.perform(delete("/api/calendar/events/{id}", id))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind", is("REPOSITORY")));

        mockMvc.perform(delete("/api/calendar/events/{id}/occurrences", id)
                        .param("original_time", "2024-01-08T09:00:00Z"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind", is("TRANSACTION")));
    }

    @Test
    void shouldUpdateOccurrenceAndReturnNoContent() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        Instant original = Instant.parse("2024-01-08T09:00:00Z");

        // When & Then
        mockMvc.perform(put("/api/calendar/events/{id}/occurrences", id)
                        .param("original_time", "2024-01-08T09:00:00Z")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start_time\": \"2024-01-08T11:00:00Z\", \"title\": \"Moved\"}"))
                .andExpect(status().isNoContent());

        verify(manageEvents).updateOccurrence(id, original,
                new OccurrenceOverride(Instant.parse("2024-01-08T11:00:00Z"), null, "Moved", null, null, null, null));
    }

    @Test
    void shouldListStoredOccurrences() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-07T00:00:00Z");
        when(queryEvents.listOccurrences(id, start, end)).thenReturn(List.of(
                new ResolvedOccurrence(id, Instant.parse("2024-01-01T09:00:00Z"), Instant.parse("2024-01-01T09:00:00Z"),
                        null, OccurrenceStatus.COMPLETED, null, null, null, null, null, false)));

        // When & Then
        mockMvc.perform(get("/api/calendar/events/{id}/occurrences", id)
                        .param("start_time", "2024-01-01T00:00:00Z")
                        .param("end_time", "2024-01-07T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].status", is("COMPLETED")))
                .andExpect(jsonPath("$[0].modified", is(false)));
    }

    @Test
    void shouldManageReminders() throws Exception {
        // Given
        UUID eventId = UUID.randomUUID();
        EventReminder reminder = new EventReminder(UUID.randomUUID(), eventId, 30, ReminderMethod.EMAIL, CREATED, CREATED);
        when(manageEvents.addReminder(eq(eventId), any())).thenReturn(reminder);

        // When & Then
        mockMvc.perform(post("/api/calendar/events/{id}/reminders", eventId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minutes_before\": 30, \"method\": \"email\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is(reminder.id().toString())))
                .andExpect(jsonPath("$.event_id", is(eventId.toString())))
                .andExpect(jsonPath("$.minutes_before", is(30)))
                .andExpect(jsonPath("$.method", is("EMAIL")));

        mockMvc.perform(put("/api/calendar/reminders/{id}", reminder.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minutes_before\": 5, \"method\": \"SMS\"}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(delete("/api/calendar/reminders/{id}", reminder.id()))
                .andExpect(status().isNoContent());

        verify(manageEvents).updateReminder(eq(reminder.id()), any());
        verify(manageEvents).deleteReminder(reminder.id());
    }

    private CalendarEvent recurringEvent() {
        UUID id = UUID.randomUUID();
        RecurrenceRule rule = new RecurrenceRule(UUID.randomUUID(), id, Frequency.WEEKLY, 1,
                Set.of("MO"), Set.of(), Set.of(), 3, null, CREATED, CREATED);
        return new CalendarEvent(id, OWNER, "Standup", null, EventType.MEETING,
                Instant.parse("2024-01-01T09:00:00Z"), Instant.parse("2024-01-01T09:15:00Z"),
                false, null, null, Transparency.OPAQUE, CREATED, CREATED, List.of(rule), List.of(), List.of());
    }
}
