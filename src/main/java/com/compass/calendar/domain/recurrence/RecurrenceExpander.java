package com.compass.calendar.domain.recurrence;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.RecurrenceRule;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Materializes the occurrence timestamps of a recurring event.
 *
 * <p>Candidates are stepped from the event start by {@code k * interval} units of the rule's
 * frequency and kept when they pass every non-empty by-day, by-month and by-month-day filter.
 * Stepping is anchored to the start, so a month-end that had to be clamped never drifts the
 * series. A monthly or yearly candidate whose day-of-month does not exist in the target month
 * is skipped.
 *
 * <p>Stateless and thread-safe; identical inputs always yield identical output.
 */
public class RecurrenceExpander {

    private final Period defaultHorizon;
    private final Period countHorizon;
    private final UntilBoundary untilBoundary;
    private final ZoneId zone;

    /**
     * @param defaultHorizon how far an open-ended rule is expanded from its start
     * @param countHorizon how far a count-bounded rule is expanded before giving up on the count
     * @param untilBoundary whether an occurrence exactly at {@code until} is emitted
     * @param zone zone in which calendar steps and filters are evaluated
     */
    public RecurrenceExpander(Period defaultHorizon, Period countHorizon,
                              UntilBoundary untilBoundary, ZoneId zone) {
        this.defaultHorizon = defaultHorizon;
        this.countHorizon = countHorizon;
        this.untilBoundary = untilBoundary;
        this.zone = zone;
    }

    /**
     * Expand over the creation-time horizon: {@code until} when set, otherwise the count
     * horizon for count-bounded rules, otherwise the default horizon.
     */
    public List<Instant> expand(CalendarEvent event, RecurrenceRule rule) {
        ZonedDateTime anchor = event.startTime().atZone(zone);
        Horizon horizon;
        if (rule.until() != null) {
            horizon = Horizon.until(rule.until(), untilBoundary);
        } else if (rule.count() != null) {
            horizon = Horizon.before(anchor.plus(countHorizon).toInstant());
        } else {
            horizon = Horizon.before(anchor.plus(defaultHorizon).toInstant());
        }
        return generate(anchor, rule, horizon);
    }

    /**
     * Expand from the series start up to and including {@code rangeEnd}, regardless of how far
     * the creation-time horizon reached. {@code until} and {@code count} still apply.
     */
    public List<Instant> expandThrough(CalendarEvent event, RecurrenceRule rule, Instant rangeEnd) {
        ZonedDateTime anchor = event.startTime().atZone(zone);
        Horizon horizon = rule.until() != null && !rule.until().isAfter(rangeEnd)
                ? Horizon.until(rule.until(), untilBoundary)
                : Horizon.until(rangeEnd, UntilBoundary.INCLUSIVE);
        return generate(anchor, rule, horizon);
    }

    private List<Instant> generate(ZonedDateTime anchor, RecurrenceRule rule, Horizon horizon) {
        if (rule.interval() < 1) {
            throw new IllegalArgumentException("Recurrence interval must be positive: " + rule.interval());
        }

        List<Instant> occurrences = new ArrayList<>();
        long unitsPerStep = rule.frequency().unitsFor(rule.interval());
        int anchorDayOfMonth = anchor.getDayOfMonth();

        for (long step = 0; ; step++) {
            if (rule.count() != null && occurrences.size() >= rule.count()) {
                break;
            }

            ZonedDateTime candidate;
            try {
                candidate = anchor.plus(step * unitsPerStep, rule.frequency().unit());
            } catch (DateTimeException | ArithmeticException e) {
                // beyond the supported date range, so beyond any horizon
                break;
            }
            if (!horizon.admits(candidate.toInstant())) {
                break;
            }

            // plusMonths/plusYears clamp to the last valid day; such a date is not in the series
            if (rule.frequency().isCalendarBased() && candidate.getDayOfMonth() != anchorDayOfMonth) {
                continue;
            }

            if (matchesFilters(candidate, rule)) {
                occurrences.add(candidate.toInstant());
            }
        }

        return occurrences;
    }

    private boolean matchesFilters(ZonedDateTime candidate, RecurrenceRule rule) {
        Set<String> byDay = rule.byDay();
        if (!byDay.isEmpty() && !byDay.contains(weekdayAbbreviation(candidate))) {
            return false;
        }
        if (!rule.byMonth().isEmpty() && !rule.byMonth().contains(candidate.getMonthValue())) {
            return false;
        }
        return rule.byMonthDay().isEmpty() || rule.byMonthDay().contains(candidate.getDayOfMonth());
    }

    static String weekdayAbbreviation(ZonedDateTime dateTime) {
        return dateTime.getDayOfWeek().name().substring(0, 2).toUpperCase(Locale.ROOT);
    }

    private record Horizon(Instant limit, UntilBoundary boundary) {

        static Horizon until(Instant limit, UntilBoundary boundary) {
            return new Horizon(limit, boundary);
        }

        static Horizon before(Instant limit) {
            return new Horizon(limit, UntilBoundary.EXCLUSIVE);
        }

        boolean admits(Instant candidate) {
            return boundary.admits(candidate, limit);
        }
    }
}
