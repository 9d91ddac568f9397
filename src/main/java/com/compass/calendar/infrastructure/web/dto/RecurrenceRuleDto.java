package com.compass.calendar.infrastructure.web.dto;

import com.compass.calendar.domain.model.Frequency;
import com.compass.calendar.domain.model.RecurrenceRule;
import com.compass.calendar.domain.model.RecurrenceRuleRequest;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record RecurrenceRuleDto(
        UUID id,
        Frequency frequency,
        Integer interval,
        Set<String> by_day,
        Set<Integer> by_month,
        Set<Integer> by_month_day,
        Integer count,
        Instant until
) {
    public static RecurrenceRuleDto fromRule(RecurrenceRule rule) {
        return new RecurrenceRuleDto(
                rule.id(),
                rule.frequency(),
                rule.interval(),
                rule.byDay(),
                rule.byMonth(),
                rule.byMonthDay(),
                rule.count(),
                rule.until()
        );
    }

    public RecurrenceRuleRequest toDomain() {
        return new RecurrenceRuleRequest(frequency, interval, by_day, by_month, by_month_day, count, until);
    }
}
