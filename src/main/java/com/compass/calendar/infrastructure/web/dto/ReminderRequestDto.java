package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.ReminderMethod;
import com.compass.calendar.domain.model.ReminderRequest;

public record ReminderRequestDto(
        Integer minutes_before,
        ReminderMethod method
) {
    public ReminderRequest toDomain() {
        return new ReminderRequest(minutes_before, method);
    }
}
