package com.compass.calendar.infrastructure.config;

import com.compass.calendar.domain.recurrence.ExceptionResolver;
import com.compass.calendar.domain.recurrence.RecurrenceExpander;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CalendarConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecurrenceExpander recurrenceExpander(CalendarProperties properties) {
        CalendarProperties.Recurrence recurrence = properties.getRecurrence();
        return new RecurrenceExpander(
                recurrence.getDefaultHorizon(),
                recurrence.getCountHorizon(),
                recurrence.getUntilBoundary(),
                ZoneId.of(recurrence.getZone()));
    }

    @Bean
    public ExceptionResolver exceptionResolver() {
        return new ExceptionResolver();
    }
}
