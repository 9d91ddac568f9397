package com.compass.calendar.domain.model;

/**
 * Whether an event blocks time (opaque) or shows the owner as free (transparent).
 */
public enum Transparency {
    OPAQUE,
    TRANSPARENT
}
