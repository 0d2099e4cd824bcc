package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.source.CanonicalEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of reading all calendars for one window.
 *
 * @param events       the events of all healthy calendars, in canonical order
 * @param sourceErrors the failure of each calendar that could not be read, keyed by source id
 *                     in registration order
 */
public record AggregatedEvents(List<CanonicalEvent> events, Map<String, SourceUnavailableException> sourceErrors) {

    public AggregatedEvents {
        events = List.copyOf(events);
        sourceErrors = Collections.unmodifiableMap(new LinkedHashMap<>(sourceErrors));
    }

    public boolean isDegraded() {
        return !sourceErrors.isEmpty();
    }
}
