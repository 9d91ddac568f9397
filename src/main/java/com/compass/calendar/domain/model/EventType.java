package com.compass.calendar.domain.model;

public enum EventType {
    NONE,
    TASK,
    MEETING,
    TODO,
    HOLIDAY,
    REMINDER
}
