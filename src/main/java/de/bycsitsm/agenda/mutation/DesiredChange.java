package de.bycsitsm.agenda.mutation;

import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventPatch;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * The change a {@link MutationRequest} asks for.
 */
public sealed interface DesiredChange {

    /**
     * Moves an event in time.
     *
     * @param newStart       the new start
     * @param newEnd         the new end, or {@code null} to keep the original duration
     * @param keepTimeOfDay  whether {@code newStart} only names a date and the original
     *                       local time of day is kept
     */
    record Reschedule(Instant newStart, @Nullable Instant newEnd, boolean keepTimeOfDay) implements DesiredChange {

        public Reschedule {
            Objects.requireNonNull(newStart, "newStart");
        }
    }

    /**
     * Moves an event to another calendar.
     *
     * @param targetCalendar a calendar id, display name or kind such as {@code "tasks"}
     */
    record MoveCalendar(String targetCalendar) implements DesiredChange {

        public MoveCalendar {
            Objects.requireNonNull(targetCalendar, "targetCalendar");
        }
    }

    /**
     * Reschedules an event and then moves it to another calendar.
     */
    record RescheduleAndMove(Reschedule reschedule, MoveCalendar move) implements DesiredChange {
    }

    record Delete() implements DesiredChange {
    }

    /**
     * Creates a new event. No existing event is searched.
     *
     * @param draft        the content of the new event
     * @param calendarHint an optional calendar id, display name or kind
     */
    record Create(DraftEvent draft, @Nullable String calendarHint) implements DesiredChange {
    }

    /**
     * Changes the title, location or description of an event.
     */
    record Update(EventPatch patch) implements DesiredChange {
    }
}
