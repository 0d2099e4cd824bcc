package de.bycsitsm.agenda.source;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Content of an event to be created in a source. {@code title} and {@code start}
 * are required; adapters reject drafts without them.
 *
 * @param title       the event title
 * @param start       the start instant
 * @param end         the end instant, or {@code null} for the default duration
 * @param allDay      whether the event is date-only
 * @param location    an optional location
 * @param attendees   the attendee addresses, possibly empty
 * @param description an optional description
 */
public record DraftEvent(
        @Nullable String title,
        @Nullable Instant start,
        @Nullable Instant end,
        boolean allDay,
        @Nullable String location,
        List<String> attendees,
        @Nullable String description
) {

    public DraftEvent {
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
    }

    /**
     * Copies the content of an existing event, e.g. to recreate it in another source.
     */
    public static DraftEvent copyOf(CanonicalEvent event) {
        return new DraftEvent(event.title(), event.start(), event.end(), event.allDay(), event.location(),
                event.attendees(), event.description());
    }
}
