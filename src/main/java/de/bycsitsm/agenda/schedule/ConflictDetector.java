package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.source.CanonicalEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds overlapping events across calendars.
 * <p>
 * Events are swept in start order while a set of still-running events is kept.
 * An event conflicts with every running event of another calendar; events of the
 * same calendar are never reported against each other. Each overlapping pair is
 * reported once, with the earlier event first. All-day events are ignored.
 */
@Component
public class ConflictDetector {

    private static final Comparator<CanonicalEvent> SWEEP_ORDER = Comparator.comparing(CanonicalEvent::start)
            .thenComparing(CanonicalEvent::end)
            .thenComparing(CanonicalEvent::sourceId)
            .thenComparing(CanonicalEvent::title)
            .thenComparing(CanonicalEvent::externalEventId);

    public List<ConflictPair> findConflicts(List<CanonicalEvent> events) {
        var sorted = events.stream()
                .filter(event -> !event.allDay())
                .sorted(SWEEP_ORDER)
                .toList();

        var conflicts = new ArrayList<ConflictPair>();
        var active = new ArrayList<CanonicalEvent>();
        for (var event : sorted) {
            active.removeIf(running -> !running.end().isAfter(event.start()));
            for (var running : active) {
                if (!running.sourceId().equals(event.sourceId())) {
                    conflicts.add(new ConflictPair(running, event));
                }
            }
            active.add(event);
        }

        conflicts.sort(Comparator.comparing((ConflictPair pair) -> pair.first(), SWEEP_ORDER)
                .thenComparing(ConflictPair::second, SWEEP_ORDER));
        return conflicts;
    }
}
