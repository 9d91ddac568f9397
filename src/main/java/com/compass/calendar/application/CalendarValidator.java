package com.compass.calendar.application;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.RecurrenceRule;
import java.time.Instant;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Field checks run before any write reaches the repository.
 */
@Component
public class CalendarValidator {

    static final Set<String> WEEKDAYS = Set.of("MO", "TU", "WE", "TH", "FR", "SA", "SU");

    public void validateEvent(CalendarEvent event) {
        if (event.ownerId() == null) {
            throw CalendarException.validation("event", "ownerId", "Owner is required");
        }
        if (event.title() == null || event.title().isBlank()) {
            throw CalendarException.validation("event", "title", "Title must not be empty");
        }
        if (event.startTime() == null) {
            throw CalendarException.validation("event", "startTime", "Start time is required");
        }
        if (event.endTime() == null) {
            throw CalendarException.validation("event", "endTime", "End time is required");
        }
        if (event.endTime().isBefore(event.startTime())) {
            throw CalendarException.validation("event", "endTime", "End time must not be before start time");
        }
    }

    public void validateRule(RecurrenceRule rule, CalendarEvent event) {
        if (rule.frequency() == null) {
            throw CalendarException.validation("recurrenceRule", "frequency", "Frequency is required");
        }
        if (rule.interval() < 1) {
            throw CalendarException.validation("recurrenceRule", "interval", "Interval must be at least 1");
        }
        for (String day : rule.byDay()) {
            if (!WEEKDAYS.contains(day)) {
                throw CalendarException.validation("recurrenceRule", "byDay", "Unknown weekday: " + day);
            }
        }
        for (Integer month : rule.byMonth()) {
            if (month == null || month < 1 || month > 12) {
                throw CalendarException.validation("recurrenceRule", "byMonth", "Month must be within 1-12: " + month);
            }
        }
        for (Integer day : rule.byMonthDay()) {
            if (day == null || day < 1 || day > 31) {
                throw CalendarException.validation("recurrenceRule", "byMonthDay", "Day of month must be within 1-31: " + day);
            }
        }
        if (rule.count() != null && rule.count() < 1) {
            throw CalendarException.validation("recurrenceRule", "count", "Count must be at least 1");
        }
        if (rule.until() != null && rule.until().isBefore(event.startTime())) {
            throw CalendarException.validation("recurrenceRule", "until", "Until must not be before the event start");
        }
    }

    public void validateReminder(EventReminder reminder) {
        if (reminder.minutesBefore() < 0) {
            throw CalendarException.validation("reminder", "minutesBefore", "Minutes before must not be negative");
        }
        if (reminder.method() == null) {
            throw CalendarException.validation("reminder", "method", "Delivery method is required");
        }
    }

    public void validateRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw CalendarException.validation("range", start == null ? "start" : "end", "Range bounds are required");
        }
        if (start.isAfter(end)) {
            throw CalendarException.validation("range", "start", "Range start must not be after range end");
        }
    }

    public void validatePage(int page, int pageSize, int maxPageSize) {
        if (page < 1) {
            throw CalendarException.validation("page", "page", "Page must be at least 1");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw CalendarException.validation("page", "pageSize", "Page size must be within 1-" + maxPageSize);
        }
    }
}
