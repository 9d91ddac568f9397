package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.UUID;

public record EventReminder(
        UUID id,
        UUID eventId,
        int minutesBefore,
        ReminderMethod method,
        Instant createdAt,
        Instant updatedAt
) {}
