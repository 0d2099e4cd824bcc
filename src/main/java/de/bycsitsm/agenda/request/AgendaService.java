package de.bycsitsm.agenda.request;

import de.bycsitsm.agenda.briefing.BriefingComposer;
import de.bycsitsm.agenda.briefing.EventFormatter;
import de.bycsitsm.agenda.briefing.ScheduleRenderer;
import de.bycsitsm.agenda.mutation.MutationResolver;
import de.bycsitsm.agenda.schedule.AvailabilityEngine;
import de.bycsitsm.agenda.schedule.ConflictDetector;
import de.bycsitsm.agenda.schedule.EventAggregator;
import de.bycsitsm.agenda.time.TimeNormalizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point of the scheduling core for the assistant layer. Each call is one
 * independent unit of work that reads the calendars afresh.
 * <p>
 * Failures propagate to the caller as {@link de.bycsitsm.agenda.AgendaException}s.
 * Read actions do not fail when single calendars are unavailable; their output
 * carries a warning instead.
 */
@Service
public class AgendaService {

    private static final Logger log = LoggerFactory.getLogger(AgendaService.class);

    private static final int MAX_FREE_SLOTS = 5;

    private final AgendaRequests agendaRequests;
    private final EventAggregator eventAggregator;
    private final AvailabilityEngine availabilityEngine;
    private final ConflictDetector conflictDetector;
    private final BriefingComposer briefingComposer;
    private final ScheduleRenderer scheduleRenderer;
    private final EventFormatter eventFormatter;
    private final MutationResolver mutationResolver;
    private final TimeNormalizer timeNormalizer;

    public AgendaService(AgendaRequests agendaRequests, EventAggregator eventAggregator,
                         AvailabilityEngine availabilityEngine, ConflictDetector conflictDetector,
                         BriefingComposer briefingComposer, ScheduleRenderer scheduleRenderer,
                         EventFormatter eventFormatter, MutationResolver mutationResolver,
                         TimeNormalizer timeNormalizer) {
        this.agendaRequests = agendaRequests;
        this.eventAggregator = eventAggregator;
        this.availabilityEngine = availabilityEngine;
        this.conflictDetector = conflictDetector;
        this.briefingComposer = briefingComposer;
        this.scheduleRenderer = scheduleRenderer;
        this.eventFormatter = eventFormatter;
        this.mutationResolver = mutationResolver;
        this.timeNormalizer = timeNormalizer;
    }

    /**
     * Validates and handles a loosely typed call.
     */
    public AgendaResponse handle(String action, @Nullable Map<String, ?> args) {
        return handle(agendaRequests.fromCall(action, args));
    }

    public AgendaResponse handle(AgendaRequest request) {
        log.debug("Handling {}", request);
        if (request instanceof AgendaRequest.Mutation mutation) {
            var confirmation = mutationResolver.apply(mutation.toMutationRequest());
            return AgendaResponse.confirmed(confirmation, eventFormatter.confirmation(confirmation));
        }
        if (request instanceof AgendaRequest.GetSchedule schedule) {
            var aggregated = eventAggregator.aggregate(timeNormalizer.dayWindow(schedule.date()));
            return AgendaResponse.text(scheduleRenderer.renderDay(schedule.date(), aggregated));
        }
        if (request instanceof AgendaRequest.GetUpcoming upcoming) {
            var end = timeNormalizer.startOfDay(timeNormalizer.today().plusDays(upcoming.days()));
            var aggregated = eventAggregator.aggregate(timeNormalizer.now(), end);
            return AgendaResponse.text(scheduleRenderer.renderUpcoming(upcoming.days(), aggregated));
        }
        if (request instanceof AgendaRequest.FindFreeTime freeTime) {
            return AgendaResponse.text(findFreeTime(freeTime));
        }
        if (request instanceof AgendaRequest.GetBriefing briefing) {
            return AgendaResponse.text(briefing(briefing));
        }
        throw new IllegalArgumentException("Unsupported request: " + request);
    }

    private String findFreeTime(AgendaRequest.FindFreeTime request) {
        var aggregated = eventAggregator.aggregate(timeNormalizer.daysWindow(request.firstDay(), request.days()));
        var slots = availabilityEngine.findFreeSlots(request.firstDay(), request.days(), request.durationMinutes(),
                aggregated.events(), request.weekdays(), timeNormalizer.now(), MAX_FREE_SLOTS);
        return scheduleRenderer.renderFreeSlots(slots, request.durationMinutes(), request.days(), aggregated);
    }

    private String briefing(AgendaRequest.GetBriefing request) {
        var date = request.date();
        var aggregated = eventAggregator.aggregate(timeNormalizer.daysWindow(date, 2));
        var todayWindow = timeNormalizer.dayWindow(date);
        var today = aggregated.events().stream()
                .filter(event -> event.overlaps(todayWindow.start(), todayWindow.end())
                        || event.start().equals(todayWindow.start()))
                .toList();
        var tomorrowWindow = timeNormalizer.dayWindow(date.plusDays(1));
        var tomorrow = aggregated.events().stream()
                .filter(event -> !event.start().isBefore(tomorrowWindow.start())
                        && event.start().isBefore(tomorrowWindow.end()))
                .toList();
        var conflicts = conflictDetector.findConflicts(today);
        return briefingComposer.compose(date, today, tomorrow, conflicts, aggregated.sourceErrors(),
                request.characterBudget());
    }
}
