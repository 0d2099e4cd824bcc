package de.bycsitsm.agenda.source;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Sparse change to an existing event. Fields left {@code null} stay unchanged.
 */
public record EventPatch(
        @Nullable String title,
        @Nullable Instant start,
        @Nullable Instant end,
        @Nullable String location,
        @Nullable String description
) {

    public static EventPatch reschedule(Instant start, Instant end) {
        return new EventPatch(null, start, end, null, null);
    }

    public boolean isEmpty() {
        return title == null && start == null && end == null && location == null && description == null;
    }
}
