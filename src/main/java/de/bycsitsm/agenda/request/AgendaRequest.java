package de.bycsitsm.agenda.request;

import de.bycsitsm.agenda.mutation.DesiredChange;
import de.bycsitsm.agenda.mutation.MutationRequest;
import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventPatch;
import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;

/**
 * A validated inbound request. Instances are built by {@link AgendaRequests} from
 * the loosely typed calls of the assistant layer and handled by {@link AgendaService}.
 */
public sealed interface AgendaRequest {

    record GetSchedule(LocalDate date) implements AgendaRequest {
    }

    record GetUpcoming(int days) implements AgendaRequest {
    }

    /**
     * @param firstDay        the first day to search
     * @param days            the number of days to search
     * @param durationMinutes the length of the wanted slot
     * @param weekdays        the days of the week to consider; empty means all
     */
    record FindFreeTime(LocalDate firstDay, int days, int durationMinutes, Set<DayOfWeek> weekdays)
            implements AgendaRequest {

        public FindFreeTime {
            weekdays = Set.copyOf(weekdays);
        }
    }

    record GetBriefing(LocalDate date, int characterBudget) implements AgendaRequest {
    }

    /**
     * A request that changes a calendar.
     */
    sealed interface Mutation extends AgendaRequest {

        MutationRequest toMutationRequest();
    }

    record CreateEvent(DraftEvent draft, @Nullable String calendar) implements Mutation {

        @Override
        public MutationRequest toMutationRequest() {
            return MutationRequest.create(new DesiredChange.Create(draft, calendar));
        }
    }

    /**
     * Moves an event in time, and to another calendar when {@code targetCalendar} is set.
     */
    record RescheduleEvent(String eventSearch, DesiredChange.Reschedule reschedule, @Nullable String targetCalendar,
                           @Nullable TimeWindow window) implements Mutation {

        @Override
        public MutationRequest toMutationRequest() {
            DesiredChange change = targetCalendar == null
                    ? reschedule
                    : new DesiredChange.RescheduleAndMove(reschedule, new DesiredChange.MoveCalendar(targetCalendar));
            return new MutationRequest(eventSearch, window, change);
        }
    }

    /**
     * Moves an event to another calendar, rescheduling it first when {@code reschedule} is set.
     */
    record MoveEvent(String eventSearch, String targetCalendar, DesiredChange.@Nullable Reschedule reschedule,
                     @Nullable TimeWindow window) implements Mutation {

        @Override
        public MutationRequest toMutationRequest() {
            var move = new DesiredChange.MoveCalendar(targetCalendar);
            DesiredChange change = reschedule == null ? move : new DesiredChange.RescheduleAndMove(reschedule, move);
            return new MutationRequest(eventSearch, window, change);
        }
    }

    record UpdateEvent(String eventSearch, EventPatch patch, @Nullable TimeWindow window) implements Mutation {

        @Override
        public MutationRequest toMutationRequest() {
            return new MutationRequest(eventSearch, window, new DesiredChange.Update(patch));
        }
    }

    record DeleteEvent(String eventSearch, @Nullable TimeWindow window) implements Mutation {

        @Override
        public MutationRequest toMutationRequest() {
            return new MutationRequest(eventSearch, window, new DesiredChange.Delete());
        }
    }
}
