package de.bycsitsm.agenda;

import de.bycsitsm.agenda.source.CanonicalEvent;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when moving an event between calendars created the copy in the target
 * calendar but could not remove, or could not confirm the copy before removing,
 * the original. The copy may now exist next to the original and the caller has
 * to decide how to clean up.
 */
public class PartialMutationFailureException extends AgendaException {

    private final CanonicalEvent created;
    private final CanonicalEvent original;

    public PartialMutationFailureException(CanonicalEvent created, CanonicalEvent original, String reason,
                                           @Nullable Throwable cause) {
        super("'" + original.title() + "' was copied to source " + created.sourceId()
                + " but the original in source " + original.sourceId() + " was kept: " + reason, cause);
        this.created = created;
        this.original = original;
    }

    public CanonicalEvent getCreated() {
        return created;
    }

    public CanonicalEvent getOriginal() {
        return original;
    }
}
