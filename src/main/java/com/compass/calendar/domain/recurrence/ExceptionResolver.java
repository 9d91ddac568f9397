package com.compass.calendar.domain.recurrence;

import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.ResolvedOccurrence;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Overlays stored exceptions onto generated or stored occurrences.
 * Output order follows the input occurrences; deleted instances are dropped.
 */
public class ExceptionResolver {

    public List<ResolvedOccurrence> resolve(List<EventOccurrence> occurrences, List<EventException> exceptions) {
        Map<Instant, EventException> byOriginalTime = new HashMap<>();
        for (EventException exception : exceptions) {
            byOriginalTime.put(exception.originalTime(), exception);
        }

        List<ResolvedOccurrence> resolved = new ArrayList<>(occurrences.size());
        for (EventOccurrence occurrence : occurrences) {
            EventException exception = byOriginalTime.get(occurrence.occurrenceTime());
            if (exception == null) {
                resolved.add(ResolvedOccurrence.unchanged(occurrence));
            } else if (!exception.deleted()) {
                resolved.add(ResolvedOccurrence.overridden(occurrence, exception));
            }
        }
        return resolved;
    }
}
