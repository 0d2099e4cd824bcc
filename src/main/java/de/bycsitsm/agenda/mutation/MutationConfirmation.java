package de.bycsitsm.agenda.mutation;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Outcome of a successful mutation, describing the event as it is now.
 *
 * @param title              the event title
 * @param start              the event start
 * @param end                the event end
 * @param sourceName         the display name of the calendar holding the event
 * @param externalLink       a link to the event in the backend's own UI, if known
 * @param action             what was done
 * @param previousSourceName the calendar the event was moved away from, only set for moves
 */
public record MutationConfirmation(
        String title,
        Instant start,
        Instant end,
        String sourceName,
        @Nullable String externalLink,
        MutationAction action,
        @Nullable String previousSourceName
) {
}
