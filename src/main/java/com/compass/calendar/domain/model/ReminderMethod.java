package com.compass.calendar.domain.model;

public enum ReminderMethod {
    EMAIL,
    PUSH,
    SMS
}
