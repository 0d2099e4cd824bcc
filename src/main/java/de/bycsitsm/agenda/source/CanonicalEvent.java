package de.bycsitsm.agenda.source;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Source-agnostic representation of a calendar entry. Instances are built fresh
 * on every read and never changed afterwards; a change is a write to the owning
 * source followed by a new read.
 *
 * @param sourceId        the id of the owning {@link CalendarSource}
 * @param externalEventId the id of the event inside its source
 * @param title           the event title
 * @param start           the start instant (UTC)
 * @param end             the end instant; defaults to one hour after {@code start} when {@code null}
 * @param allDay          whether the event is date-only
 * @param location        an optional location
 * @param attendees       the attendee addresses, possibly empty
 * @param description     an optional free-text description
 * @param kind            the semantic kind assigned by classification
 * @param link            an optional link to the event in the backend's own UI
 */
public record CanonicalEvent(
        String sourceId,
        String externalEventId,
        String title,
        Instant start,
        Instant end,
        boolean allDay,
        @Nullable String location,
        List<String> attendees,
        @Nullable String description,
        EventKind kind,
        @Nullable String link
) {

    public static final Duration DEFAULT_DURATION = Duration.ofHours(1);

    public CanonicalEvent {
        if (end == null) {
            end = start.plus(DEFAULT_DURATION);
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Event '" + title + "' ends before it starts: " + start + " > " + end);
        }
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
        if (kind == null) {
            kind = EventKind.OTHER;
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }

    public CanonicalEvent withKind(EventKind newKind) {
        return new CanonicalEvent(sourceId, externalEventId, title, start, end, allDay, location, attendees,
                description, newKind, link);
    }
}
