package com.compass.calendar.domain.model;

import java.time.Instant;
import java.util.Set;

public record RecurrenceRuleRequest(
        Frequency frequency,
        Integer interval,
        Set<String> byDay,
        Set<Integer> byMonth,
        Set<Integer> byMonthDay,
        Integer count,
        Instant until
) {}
