package de.bycsitsm.agenda.source;

import java.time.Instant;
import java.util.List;

/**
 * Translates between one kind of calendar backend and the canonical model.
 * Implementations are stateless API clients: they are safe for concurrent use and
 * perform exactly one external write per mutating call, without retrying.
 */
public interface SourceAdapter {

    /**
     * Lists the events of a source overlapping {@code [windowStart, windowEnd)}.
     * An empty calendar yields an empty list.
     *
     * @throws de.bycsitsm.agenda.SourceUnavailableException on network or authentication failure
     */
    List<CanonicalEvent> list(CalendarSource source, Instant windowStart, Instant windowEnd);

    /**
     * Creates a new event.
     *
     * @throws de.bycsitsm.agenda.ValidationException if the draft has no title or no start
     * @throws de.bycsitsm.agenda.SourceUnavailableException if the source rejects or cannot receive the write
     */
    CanonicalEvent create(CalendarSource source, DraftEvent draft);

    /**
     * Applies a sparse patch to an existing event.
     *
     * @throws de.bycsitsm.agenda.EventNotFoundException if the event does not exist
     * @throws de.bycsitsm.agenda.SourceUnavailableException if the source cannot receive the write
     */
    CanonicalEvent update(CalendarSource source, String externalEventId, EventPatch patch);

    /**
     * Deletes an event.
     *
     * @throws de.bycsitsm.agenda.EventNotFoundException if the event is already absent
     * @throws de.bycsitsm.agenda.SourceUnavailableException if the source cannot receive the write
     */
    void delete(CalendarSource source, String externalEventId);

    /**
     * Whether {@link #update} and {@link #delete} accept the given event id. Ids of
     * derived entries, such as single occurrences of a recurring series, are read-only.
     */
    default boolean isWritable(String externalEventId) {
        return true;
    }
}
