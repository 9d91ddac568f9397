package com.compass.calendar.domain.model;

import java.time.Instant;

/**
 * Fields that may be overridden on a single occurrence. Null fields keep their current value.
 */
public record OccurrenceOverride(
        Instant startTime,
        Instant endTime,
        String title,
        String description,
        String location,
        String color,
        Transparency transparency
) {}
