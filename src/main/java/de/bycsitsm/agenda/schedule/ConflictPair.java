package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.source.CanonicalEvent;

import java.time.Instant;

/**
 * Two overlapping events from different calendars. {@code first} never starts
 * after {@code second}.
 */
public record ConflictPair(CanonicalEvent first, CanonicalEvent second) {

    public Instant overlapStart() {
        return first.start().isAfter(second.start()) ? first.start() : second.start();
    }

    public Instant overlapEnd() {
        return first.end().isBefore(second.end()) ? first.end() : second.end();
    }
}
