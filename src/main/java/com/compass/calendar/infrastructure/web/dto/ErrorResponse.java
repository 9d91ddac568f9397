package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.error.ErrorKind;

public record ErrorResponse(
        ErrorKind kind,
        String entity,
        String field,
        String message
) {
    public static ErrorResponse fromException(CalendarException e) {
        return new ErrorResponse(e.getKind(), e.getEntity(), e.getField(), e.getMessage());
    }
}
