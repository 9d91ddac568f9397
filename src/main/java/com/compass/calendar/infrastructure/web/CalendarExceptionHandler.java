package com.compass.calendar.infrastructure.web;

import com.compass.calendar.domain.error.CalendarException;
import com.compass.calendar.domain.error.ErrorKind;
import com.compass.calendar.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps calendar failures to HTTP statuses with a {@link ErrorResponse} body
 */
@RestControllerAdvice
public class CalendarExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CalendarExceptionHandler.class);

    @ExceptionHandler(CalendarException.class)
    public ResponseEntity<ErrorResponse> handleCalendarException(CalendarException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            logger.error("Request failed with {} error on {}", e.getKind(), e.getEntity(), e);
        } else {
            logger.warn("Request rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.fromException(e));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return badRequest("request", e.getParameterName(), e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return badRequest("request", e.getHeaderName(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest("request", e.getName(), "Invalid value for " + e.getName() + ": " + e.getValue());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return badRequest("request", null, "Malformed request body");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case TRANSACTION, REPOSITORY -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> badRequest(String entity, String field, String message) {
        logger.warn("Bad request: {}", message);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorKind.VALIDATION, entity, field, message));
    }
}
