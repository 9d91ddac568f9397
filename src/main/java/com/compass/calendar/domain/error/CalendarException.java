package com.compass.calendar.domain.error;

/**
 * Exception thrown when a calendar operation fails.
 * Carries the {@link ErrorKind} plus the entity (and, for validation, the field) that triggered it.
 */
public class CalendarException extends RuntimeException {

    private final ErrorKind kind;
    private final String entity;
    private final String field;

    public CalendarException(ErrorKind kind, String entity, String field, String message) {
        super(message);
        this.kind = kind;
        this.entity = entity;
        this.field = field;
    }

    public CalendarException(ErrorKind kind, String entity, String field, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.entity = entity;
        this.field = field;
    }

    public static CalendarException validation(String entity, String field, String message) {
        return new CalendarException(ErrorKind.VALIDATION, entity, field, message);
    }

    public static CalendarException notFound(String entity, Object id) {
        return new CalendarException(ErrorKind.NOT_FOUND, entity, null, entity + " not found: " + id);
    }

    public static CalendarException transaction(String message, Throwable cause) {
        return new CalendarException(ErrorKind.TRANSACTION, "transaction", null, message, cause);
    }

    public static CalendarException repository(String entity, String message, Throwable cause) {
        return new CalendarException(ErrorKind.REPOSITORY, entity, null, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getEntity() {
        return entity;
    }

    public String getField() {
        return field;
    }
}
