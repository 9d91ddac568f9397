package com.compass.calendar.domain.model;

public record ReminderRequest(
        Integer minutesBefore,
        ReminderMethod method
) {}
