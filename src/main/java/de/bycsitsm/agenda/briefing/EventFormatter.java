package de.bycsitsm.agenda.briefing;

import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.mutation.MutationAction;
import de.bycsitsm.agenda.mutation.MutationConfirmation;
import de.bycsitsm.agenda.schedule.ConflictPair;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.source.SourceRegistry;
import de.bycsitsm.agenda.time.TimeNormalizer;
import de.bycsitsm.agenda.time.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders single events, conflicts and warnings as text lines in the local
 * timezone, using 24-hour times.
 */
@Component
public class EventFormatter {

    private static final DateTimeFormatter DAY_HEADING = DateTimeFormatter.ofPattern("EEEE, MMMM d", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_HEADING_WITH_YEAR =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_DAY = DateTimeFormatter.ofPattern("EEE MM/dd", Locale.ENGLISH);

    private final TimeNormalizer timeNormalizer;
    private final SourceRegistry sourceRegistry;

    public EventFormatter(TimeNormalizer timeNormalizer, SourceRegistry sourceRegistry) {
        this.timeNormalizer = timeNormalizer;
        this.sourceRegistry = sourceRegistry;
    }

    /**
     * Formats an event as {@code - 09:00-10:00 Title [Calendar]}, marking tasks.
     */
    public String line(CanonicalEvent event) {
        var when = event.allDay()
                ? "All day"
                : timeNormalizer.toLocalDisplay(event.start()).timeText() + "-"
                + timeNormalizer.toLocalDisplay(event.end()).timeText();
        var marker = event.kind() == EventKind.TASK ? "(task) " : "";
        return "- " + when + " " + marker + event.title() + " [" + sourceName(event.sourceId()) + "]";
    }

    public String conflictLine(ConflictPair conflict) {
        return "- " + timeNormalizer.toLocalDisplay(conflict.overlapStart()).timeText() + "-"
                + timeNormalizer.toLocalDisplay(conflict.overlapEnd()).timeText() + " "
                + conflict.first().title() + " [" + sourceName(conflict.first().sourceId()) + "] overlaps "
                + conflict.second().title() + " [" + sourceName(conflict.second().sourceId()) + "]";
    }

    public String slotLine(int number, TimeWindow slot) {
        var start = timeNormalizer.toLocalDisplay(slot.start());
        return number + ". " + dayHeading(start.date()) + " at " + start.timeText() + "-"
                + timeNormalizer.toLocalDisplay(slot.end()).timeText();
    }

    /**
     * Describes a completed mutation, e.g. {@code Moved 'Gym' from Tasks to Appointments: Tue 03/11 07:00-08:00}.
     */
    public String confirmation(MutationConfirmation confirmation) {
        var title = "'" + confirmation.title() + "'";
        var when = span(confirmation.start(), confirmation.end());
        var text = switch (confirmation.action()) {
            case CREATED -> "Created " + title + " in " + confirmation.sourceName() + ": " + when;
            case UPDATED -> "Updated " + title + " in " + confirmation.sourceName() + ": " + when;
            case RESCHEDULED -> "Rescheduled " + title + " in " + confirmation.sourceName() + " to " + when;
            case MOVED -> "Moved " + title + " from " + confirmation.previousSourceName() + " to "
                    + confirmation.sourceName() + ": " + when;
            case DELETED -> "Deleted " + title + " (" + when + ") from " + confirmation.sourceName();
            case UNCHANGED -> title + " is already in " + confirmation.sourceName() + ": " + when;
        };
        if (confirmation.externalLink() != null && confirmation.action() != MutationAction.DELETED) {
            text += "\nLink: " + confirmation.externalLink();
        }
        return text;
    }

    public List<String> warningLines(Map<String, SourceUnavailableException> sourceErrors) {
        var lines = new ArrayList<String>();
        sourceErrors.forEach((sourceId, error) -> lines.add(
                "Warning: calendar '" + sourceName(sourceId) + "' is unavailable, its events are missing."));
        return lines;
    }

    public String sourceName(String sourceId) {
        return sourceRegistry.find(sourceId)
                .map(registered -> registered.source().displayName())
                .orElse(sourceId);
    }

    private String span(Instant start, Instant end) {
        var from = timeNormalizer.toLocalDisplay(start);
        var until = timeNormalizer.toLocalDisplay(end);
        var text = shortDay(from.date()) + " " + from.timeText() + "-";
        return from.date().equals(until.date()) ? text + until.timeText() : text + shortDay(until.date()) + " "
                + until.timeText();
    }

    public String dayHeading(LocalDate date) {
        return date.format(DAY_HEADING);
    }

    public String dayHeadingWithYear(LocalDate date) {
        return date.format(DAY_HEADING_WITH_YEAR);
    }

    public String shortDay(LocalDate date) {
        return date.format(SHORT_DAY);
    }
}
