package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A repeating schedule attached to one event.
 * {@code byDay} holds two-letter upper-case weekday abbreviations ({@code MO} .. {@code SU}).
 * {@code count} and {@code until} are both optional; when absent the expander falls back to a
 * default horizon.
 */
public record RecurrenceRule(
        UUID id,
        UUID eventId,
        Frequency frequency,
        int interval,
        Set<String> byDay,
        Set<Integer> byMonth,
        Set<Integer> byMonthDay,
        Integer count,
        Instant until,
        Instant createdAt,
        Instant updatedAt
) {
    public RecurrenceRule {
        byDay = byDay == null ? Set.of() : Set.copyOf(byDay);
        byMonth = byMonth == null ? Set.of() : Set.copyOf(byMonth);
        byMonthDay = byMonthDay == null ? Set.of() : Set.copyOf(byMonthDay);
    }
}
