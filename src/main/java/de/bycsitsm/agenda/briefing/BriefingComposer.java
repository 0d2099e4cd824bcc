package de.bycsitsm.agenda.briefing;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.schedule.ConflictPair;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.time.TimeNormalizer;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Composes the daily briefing: a header with the local date, today's events,
 * a preview of tomorrow, the conflicts of the day and a closing focus line.
 * <p>
 * The output never exceeds the character budget. When it would, whole lines are
 * dropped in order of increasing importance: the tomorrow preview first, then the
 * closing line, then the individual conflicts, and today's events last. The
 * header and the warnings about unavailable calendars are always kept.
 */
@Service
public class BriefingComposer {

    private static final int MAX_CONFLICT_LINES = 5;

    private final EventFormatter eventFormatter;
    private final TimeNormalizer timeNormalizer;
    private final AgendaProperties.Briefing limits;

    public BriefingComposer(EventFormatter eventFormatter, TimeNormalizer timeNormalizer,
                            AgendaProperties properties) {
        this.eventFormatter = eventFormatter;
        this.timeNormalizer = timeNormalizer;
        this.limits = properties.briefing();
    }

    /**
     * Composes a briefing for the current local day within the configured budget.
     */
    public String compose(List<CanonicalEvent> today, List<CanonicalEvent> tomorrowPreview,
                          List<ConflictPair> conflicts) {
        return compose(timeNormalizer.today(), today, tomorrowPreview, conflicts, Map.of(),
                limits.characterBudget());
    }

    /**
     * Composes a briefing.
     *
     * @param date            the local date the briefing is for
     * @param today           the events of that date, in canonical order
     * @param tomorrowPreview the events of the following date, in canonical order
     * @param conflicts       the conflicts among today's events
     * @param sourceErrors    the calendars that could not be read
     * @param characterBudget the maximum length of the result
     */
    public String compose(LocalDate date, List<CanonicalEvent> today, List<CanonicalEvent> tomorrowPreview,
                          List<ConflictPair> conflicts, Map<String, SourceUnavailableException> sourceErrors,
                          int characterBudget) {
        var fixed = new ArrayList<String>();
        fixed.add("Briefing for " + eventFormatter.dayHeadingWithYear(date));
        fixed.addAll(eventFormatter.warningLines(sourceErrors));

        var todayLimit = Math.min(limits.todayLimit(), today.size());
        var tomorrowLimit = Math.min(limits.tomorrowLimit(), tomorrowPreview.size());
        var conflictLimit = Math.min(MAX_CONFLICT_LINES, conflicts.size());
        var showTomorrow = true;
        var showClosing = true;

        while (true) {
            var text = render(fixed, today, todayLimit, tomorrowPreview, showTomorrow ? tomorrowLimit : -1,
                    conflicts, conflictLimit, showClosing);
            if (text.length() <= characterBudget) {
                return text;
            }
            if (showTomorrow && tomorrowLimit > 0) {
                tomorrowLimit--;
            } else if (showTomorrow) {
                showTomorrow = false;
            } else if (showClosing) {
                showClosing = false;
            } else if (conflictLimit > 0) {
                conflictLimit--;
            } else if (todayLimit > 0) {
                todayLimit--;
            } else {
                return fitLines(fixed, characterBudget);
            }
        }
    }

    private String render(List<String> fixed, List<CanonicalEvent> today, int todayLimit,
                          List<CanonicalEvent> tomorrow, int tomorrowLimit,
                          List<ConflictPair> conflicts, int conflictLimit, boolean showClosing) {
        var lines = new ArrayList<>(fixed);

        lines.add("");
        if (today.isEmpty()) {
            lines.add("Today: clear schedule.");
        } else {
            lines.add("Today (" + today.size() + "):");
            appendEvents(lines, today, todayLimit);
        }

        if (tomorrowLimit >= 0) {
            lines.add("");
            if (tomorrow.isEmpty()) {
                lines.add("Tomorrow: clear schedule.");
            } else {
                lines.add("Tomorrow (" + tomorrow.size() + "):");
                appendEvents(lines, tomorrow, tomorrowLimit);
            }
        }

        if (!conflicts.isEmpty()) {
            lines.add("");
            lines.add("Conflicts (" + conflicts.size() + "):");
            for (int i = 0; i < conflictLimit; i++) {
                lines.add(eventFormatter.conflictLine(conflicts.get(i)));
            }
            if (conflicts.size() > conflictLimit) {
                lines.add("...and " + (conflicts.size() - conflictLimit) + " more");
            }
        }

        if (showClosing) {
            lines.add("");
            lines.add(focusLine(today, conflicts));
        }
        return String.join("\n", lines);
    }

    private void appendEvents(List<String> lines, List<CanonicalEvent> events, int limit) {
        for (int i = 0; i < limit; i++) {
            lines.add(eventFormatter.line(events.get(i)));
        }
        if (events.size() > limit) {
            lines.add("...and " + (events.size() - limit) + " more");
        }
    }

    private String focusLine(List<CanonicalEvent> today, List<ConflictPair> conflicts) {
        if (!conflicts.isEmpty()) {
            return "Focus: resolve " + conflicts.size() + " scheduling conflict(s) first.";
        }
        var firstAppointment = today.stream()
                .filter(event -> !event.allDay() && event.kind() != EventKind.TASK)
                .findFirst();
        if (firstAppointment.isPresent()) {
            var event = firstAppointment.get();
            return "Focus: first commitment at " + timeNormalizer.toLocalDisplay(event.start()).timeText()
                    + ", " + event.title() + ".";
        }
        var tasks = today.stream().filter(event -> event.kind() == EventKind.TASK).count();
        if (tasks > 0) {
            return "Focus: " + tasks + " task(s) to get done today.";
        }
        return "Focus: clear schedule, a good day for deep work.";
    }

    // The header is always kept, cut to the budget if even it does not fit
    private static String fitLines(List<String> lines, int characterBudget) {
        var header = lines.get(0);
        if (header.length() > characterBudget) {
            return header.substring(0, Math.max(0, characterBudget));
        }
        var text = new StringBuilder();
        for (var line : lines) {
            var separator = text.length() == 0 ? 0 : 1;
            if (text.length() + separator + line.length() > characterBudget) {
                break;
            }
            if (separator > 0) {
                text.append('\n');
            }
            text.append(line);
        }
        return text.toString();
    }
}
