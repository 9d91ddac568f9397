package com.compass.calendar.infrastructure.config;

import com.compass.calendar.domain.recurrence.UntilBoundary;
import java.time.Period;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Horizons and paging limits of the calendar service
 */
@Component
@ConfigurationProperties(prefix = "compass.calendar")
public class CalendarProperties {

    private Period exceptionShiftLookahead = Period.ofYears(10);
    private int defaultPageSize = 10;
    private int maxPageSize = 100;

    private final Recurrence recurrence = new Recurrence();

    public Period getExceptionShiftLookahead() {
        return exceptionShiftLookahead;
    }

    public void setExceptionShiftLookahead(Period exceptionShiftLookahead) {
        this.exceptionShiftLookahead = exceptionShiftLookahead;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public static class Recurrence {

        private Period defaultHorizon = Period.ofYears(1);
        private Period countHorizon = Period.ofYears(10);
        private UntilBoundary untilBoundary = UntilBoundary.EXCLUSIVE;
        private String zone = "UTC";

        public Period getDefaultHorizon() {
            return defaultHorizon;
        }

        public void setDefaultHorizon(Period defaultHorizon) {
            this.defaultHorizon = defaultHorizon;
        }

        public Period getCountHorizon() {
            return countHorizon;
        }

        public void setCountHorizon(Period countHorizon) {
            this.countHorizon = countHorizon;
        }

        public UntilBoundary getUntilBoundary() {
            return untilBoundary;
        }

        public void setUntilBoundary(UntilBoundary untilBoundary) {
            this.untilBoundary = untilBoundary;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }
}
