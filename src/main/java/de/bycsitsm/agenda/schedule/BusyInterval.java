package de.bycsitsm.agenda.schedule;

import java.time.Duration;
import java.time.Instant;

/**
 * Time occupied by one or more events. Derived for a single query and discarded afterwards.
 */
public record BusyInterval(Instant start, Instant end) {

    public Duration duration() {
        return Duration.between(start, end);
    }
}
