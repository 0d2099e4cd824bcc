package de.bycsitsm.agenda.mutation;

import de.bycsitsm.agenda.AgendaException;
import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.AmbiguousEventException;
import de.bycsitsm.agenda.EventNotFoundException;
import de.bycsitsm.agenda.PartialMutationFailureException;
import de.bycsitsm.agenda.ValidationException;
import de.bycsitsm.agenda.schedule.EventAggregator;
import de.bycsitsm.agenda.schedule.EventClassifier;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.source.EventPatch;
import de.bycsitsm.agenda.source.RegisteredSource;
import de.bycsitsm.agenda.source.SourceKind;
import de.bycsitsm.agenda.source.SourceRegistry;
import de.bycsitsm.agenda.time.TimeNormalizer;
import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Locates the event a loose reference such as {@code "hair"} points to and applies
 * a change to the calendar owning it.
 * <p>
 * A reference must match exactly one event. Titles are matched by case-insensitive
 * substring first; only when nothing matches that way, every word of the
 * reference has to occur in the title. Several matches are never narrowed down
 * to one: they are reported, ranked by how many words they share with the
 * reference.
 * <p>
 * Moving an event to another calendar is not atomic. The copy is created and read
 * back before the original is deleted, and a copy whose original could not be
 * deleted is reported as a {@link PartialMutationFailureException}.
 */
@Service
public class MutationResolver {

    private static final Logger log = LoggerFactory.getLogger(MutationResolver.class);

    private static final Duration MIN_VERIFY_WINDOW = Duration.ofMinutes(1);

    private final EventAggregator eventAggregator;
    private final EventClassifier eventClassifier;
    private final SourceRegistry sourceRegistry;
    private final TimeNormalizer timeNormalizer;
    private final Duration searchRadius;

    public MutationResolver(EventAggregator eventAggregator, EventClassifier eventClassifier,
                            SourceRegistry sourceRegistry, TimeNormalizer timeNormalizer,
                            AgendaProperties properties) {
        this.eventAggregator = eventAggregator;
        this.eventClassifier = eventClassifier;
        this.sourceRegistry = sourceRegistry;
        this.timeNormalizer = timeNormalizer;
        this.searchRadius = Duration.ofDays(properties.search().windowDays());
    }

    public MutationConfirmation apply(MutationRequest request) {
        var change = request.change();
        if (change instanceof DesiredChange.Create create) {
            return create(create);
        }

        var target = resolve(request.searchText(), request.windowHint());
        // Read-only occurrences and unknown calendars are rejected before the first write
        requireWritable(target);
        if (change instanceof DesiredChange.Reschedule reschedule) {
            var updated = reschedule(target, reschedule);
            return confirm(MutationAction.RESCHEDULED, updated, null);
        }
        if (change instanceof DesiredChange.MoveCalendar move) {
            return move(target, resolveMoveTarget(move));
        }
        if (change instanceof DesiredChange.RescheduleAndMove both) {
            var moveTarget = resolveMoveTarget(both.move());
            var updated = reschedule(target, both.reschedule());
            var moved = move(updated, moveTarget);
            if (moved.action() == MutationAction.UNCHANGED) {
                return confirm(MutationAction.RESCHEDULED, updated, null);
            }
            return moved;
        }
        if (change instanceof DesiredChange.Update update) {
            return update(target, update.patch());
        }
        if (change instanceof DesiredChange.Delete) {
            return delete(target);
        }
        throw new IllegalArgumentException("Unsupported change: " + change);
    }

    /**
     * Finds the single event whose title matches {@code searchText}.
     *
     * @param windowHint the window to search, or {@code null} for the configured radius around now
     * @throws ValidationException      if the search text is empty
     * @throws EventNotFoundException   if no event matches
     * @throws AmbiguousEventException  if more than one event matches
     */
    public CanonicalEvent resolve(@Nullable String searchText, @Nullable TimeWindow windowHint) {
        if (searchText == null || searchText.isBlank()) {
            throw new ValidationException("Name the event to change, e.g. part of its title.");
        }
        var window = windowHint != null ? windowHint : TimeWindow.around(timeNormalizer.now(), searchRadius);
        var aggregated = eventAggregator.aggregate(window);
        var matches = match(searchText, aggregated.events());

        if (matches.isEmpty()) {
            var message = "No event matching '" + searchText.strip() + "' between "
                    + timeNormalizer.localDate(window.start()) + " and " + timeNormalizer.localDate(window.end()) + ".";
            if (aggregated.isDegraded()) {
                message += " Some calendars could not be read: " + String.join(", ", aggregated.sourceErrors().keySet())
                        + ".";
            }
            throw new EventNotFoundException(message);
        }
        if (matches.size() > 1) {
            log.info("Reference '{}' is ambiguous, {} candidates", searchText, matches.size());
            throw new AmbiguousEventException(searchText.strip(), matches);
        }
        return matches.get(0);
    }

    /**
     * Returns the events matching {@code searchText}, best match first.
     */
    List<CanonicalEvent> match(String searchText, List<CanonicalEvent> events) {
        var needle = searchText.strip().toLowerCase(Locale.ROOT);
        var searchTokens = tokens(needle);

        var matches = events.stream()
                .filter(event -> event.title().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
        if (matches.isEmpty() && !searchTokens.isEmpty()) {
            matches = events.stream()
                    .filter(event -> {
                        var title = event.title().toLowerCase(Locale.ROOT);
                        return searchTokens.stream().allMatch(title::contains);
                    })
                    .toList();
        }

        return matches.stream()
                .sorted(Comparator.comparingInt((CanonicalEvent event) -> -score(searchTokens, event.title()))
                        .thenComparing(CanonicalEvent::start))
                .toList();
    }

    private CanonicalEvent reschedule(CanonicalEvent target, DesiredChange.Reschedule reschedule) {
        var start = reschedule.newStart();
        if (reschedule.keepTimeOfDay() && !target.allDay()) {
            start = timeNormalizer.onDate(target.start(), timeNormalizer.localDate(start));
        }
        var end = reschedule.newEnd() != null
                ? reschedule.newEnd()
                : timeNormalizer.endPreservingWallClock(target.start(), target.end(), start);
        if (end.isBefore(start)) {
            throw new ValidationException("The new end of '" + target.title() + "' is before its new start.");
        }

        var registered = sourceRegistry.require(target.sourceId());
        var updated = registered.adapter().update(registered.source(), target.externalEventId(),
                EventPatch.reschedule(start, end));
        log.info("Rescheduled '{}' in {} from {} to {}", target.title(), target.sourceId(), target.start(), start);
        return updated.withKind(eventClassifier.classify(updated, registered.source()));
    }

    private RegisteredSource resolveMoveTarget(DesiredChange.MoveCalendar move) {
        return sourceRegistry.resolve(move.targetCalendar())
                .orElseThrow(() -> new ValidationException("Calendar '" + move.targetCalendar()
                        + "' is not configured. Available: " + sourceRegistry.describeAvailable() + "."));
    }

    // Occurrences of a recurring series can be read but not written on their own
    private void requireWritable(CanonicalEvent target) {
        var owner = sourceRegistry.require(target.sourceId());
        if (!owner.adapter().isWritable(target.externalEventId())) {
            throw new ValidationException("'" + target.title() + "' on "
                    + timeNormalizer.localDate(target.start()) + " is one occurrence of a recurring series in "
                    + owner.source().displayName() + " and cannot be changed on its own.");
        }
    }

    private MutationConfirmation move(CanonicalEvent original, RegisteredSource target) {
        if (target.source().id().equals(original.sourceId())) {
            log.info("'{}' is already in {}, nothing to move", original.title(), original.sourceId());
            return confirm(MutationAction.UNCHANGED, original, null);
        }
        var owner = sourceRegistry.require(original.sourceId());

        var created = target.adapter().create(target.source(), DraftEvent.copyOf(original));
        log.info("Copied '{}' from {} to {} as {}", original.title(), original.sourceId(), target.source().id(),
                created.externalEventId());

        verifyCreated(target, created, original);

        try {
            owner.adapter().delete(owner.source(), original.externalEventId());
        } catch (EventNotFoundException e) {
            log.info("Original of '{}' was already gone from {}", original.title(), original.sourceId());
        } catch (AgendaException e) {
            log.warn("Moved '{}' to {} but could not delete the original in {}: {}", original.title(),
                    target.source().id(), original.sourceId(), e.getMessage());
            throw new PartialMutationFailureException(created, original,
                    "deleting the original failed: " + e.getMessage(), e);
        }
        log.info("Moved '{}' from {} to {}", original.title(), original.sourceId(), target.source().id());
        return confirm(MutationAction.MOVED, created.withKind(eventClassifier.classify(created, target.source())),
                owner.source().displayName());
    }

    // The original is only deleted once the copy can be read back
    private void verifyCreated(RegisteredSource target, CanonicalEvent created, CanonicalEvent original) {
        var end = created.end().isAfter(created.start()) ? created.end() : created.start().plus(MIN_VERIFY_WINDOW);
        List<CanonicalEvent> listed;
        try {
            listed = target.adapter().list(target.source(), created.start(), end);
        } catch (AgendaException e) {
            log.warn("Could not read back the copy of '{}' in {}: {}", original.title(), target.source().id(),
                    e.getMessage());
            throw new PartialMutationFailureException(created, original,
                    "the copy could not be read back: " + e.getMessage(), e);
        }
        var present = listed.stream().anyMatch(event -> event.externalEventId().equals(created.externalEventId()));
        if (!present) {
            log.warn("Copy {} of '{}' is missing from {}", created.externalEventId(), original.title(),
                    target.source().id());
            throw new PartialMutationFailureException(created, original,
                    "the copy was not found in " + target.source().displayName() + " after creating it", null);
        }
    }

    private MutationConfirmation update(CanonicalEvent target, EventPatch patch) {
        if (patch.isEmpty()) {
            throw new ValidationException("Nothing to change for '" + target.title() + "'.");
        }
        var registered = sourceRegistry.require(target.sourceId());
        var updated = registered.adapter().update(registered.source(), target.externalEventId(), patch);
        log.info("Updated '{}' in {}", target.title(), target.sourceId());
        return confirm(MutationAction.UPDATED, updated, null);
    }

    private MutationConfirmation delete(CanonicalEvent target) {
        var registered = sourceRegistry.require(target.sourceId());
        try {
            registered.adapter().delete(registered.source(), target.externalEventId());
            log.info("Deleted '{}' from {}", target.title(), target.sourceId());
        } catch (EventNotFoundException e) {
            log.info("'{}' was already gone from {}", target.title(), target.sourceId());
        }
        return confirm(MutationAction.DELETED, target, null);
    }

    private MutationConfirmation create(DesiredChange.Create create) {
        var draft = create.draft();
        if (draft.title() == null || draft.title().isBlank()) {
            throw new ValidationException("A new event needs a title.");
        }
        if (draft.start() == null) {
            throw new ValidationException("A new event needs a start time, e.g. 2025-03-14T15:00.");
        }
        if (draft.end() != null && draft.end().isBefore(draft.start())) {
            throw new ValidationException("'" + draft.title() + "' would end before it starts.");
        }

        var target = selectCreateTarget(draft, create.calendarHint());
        var created = target.adapter().create(target.source(), draft);
        log.info("Created '{}' in {} at {}", created.title(), target.source().id(), created.start());
        return confirm(MutationAction.CREATED, created, null);
    }

    private RegisteredSource selectCreateTarget(DraftEvent draft, @Nullable String calendarHint) {
        if (calendarHint != null && !calendarHint.isBlank()) {
            return sourceRegistry.resolve(calendarHint)
                    .orElseThrow(() -> new ValidationException("Calendar '" + calendarHint
                            + "' is not configured. Available: " + sourceRegistry.describeAvailable() + "."));
        }
        var kind = eventClassifier.classifyContent(draft.title(), draft.start(), draft.allDay(), draft.attendees());
        Optional<RegisteredSource> byContent = Optional.empty();
        if (kind == EventKind.TASK) {
            byContent = sourceRegistry.firstOfKind(SourceKind.TASK);
        } else if (kind == EventKind.APPOINTMENT) {
            byContent = sourceRegistry.firstOfKind(SourceKind.APPOINTMENT);
        }
        return byContent
                .or(() -> sourceRegistry.firstOfKind(SourceKind.APPOINTMENT))
                .or(() -> sourceRegistry.sources().stream().findFirst())
                .orElseThrow(() -> new ValidationException("No calendars are configured."));
    }

    private MutationConfirmation confirm(MutationAction action, CanonicalEvent event,
                                         @Nullable String previousSourceName) {
        var sourceName = sourceRegistry.find(event.sourceId())
                .map(registered -> registered.source().displayName())
                .orElse(event.sourceId());
        return new MutationConfirmation(event.title(), event.start(), event.end(), sourceName, event.link(), action,
                previousSourceName);
    }

    private static List<String> tokens(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    // Number of title words starting with a word of the reference
    private static int score(List<String> searchTokens, String title) {
        var titleTokens = tokens(title);
        return (int) titleTokens.stream()
                .filter(titleToken -> searchTokens.stream().anyMatch(titleToken::startsWith))
                .count();
    }
}
