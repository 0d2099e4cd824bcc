package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.source.CalendarSource;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.time.TimeNormalizer;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tags events as appointments or tasks.
 * <p>
 * The kind of the owning calendar decides whenever it is specific. Only events
 * of generic calendars are classified by content: several attendees, or a
 * meeting-like title during business hours, make an appointment; a personal
 * chore or maintenance title makes a task. The result depends on the event
 * content alone.
 */
@Component
public class EventClassifier {

    private static final LocalTime BUSINESS_START = LocalTime.of(8, 0);
    private static final LocalTime BUSINESS_END = LocalTime.of(18, 0);

    private static final Set<String> MEETING_KEYWORDS = Set.of(
            "meeting", "call", "sync", "standup", "stand-up", "interview", "review", "appointment",
            "consultation", "conference", "lunch", "demo", "presentation", "1:1", "one-on-one",
            "doctor", "dentist", "workshop", "session", "check-in");

    private static final Set<String> TASK_KEYWORDS = Set.of(
            "wash", "clean", "laundry", "groceries", "grocery", "errand", "errands", "chores", "workout",
            "gym", "exercise", "run", "meditate", "meditation", "journal", "read", "study", "pay", "bills",
            "todo", "to-do", "task", "maintenance", "repair", "fix", "water plants", "skincare", "self-care",
            "nap", "cook", "meal prep", "vacuum", "dishes", "tidy", "organize", "oil change", "renew");

    private final TimeNormalizer timeNormalizer;

    public EventClassifier(TimeNormalizer timeNormalizer) {
        this.timeNormalizer = timeNormalizer;
    }

    public EventKind classify(CanonicalEvent event, CalendarSource source) {
        return switch (source.kind()) {
            case APPOINTMENT -> EventKind.APPOINTMENT;
            case TASK -> EventKind.TASK;
            case GENERIC -> classifyContent(event.title(), event.start(), event.allDay(), event.attendees());
        };
    }

    /**
     * Classifies an event by its content only, e.g. a draft that has no calendar yet.
     */
    public EventKind classifyContent(String title, Instant start, boolean allDay, List<String> attendees) {
        if (attendees.size() > 1) {
            return EventKind.APPOINTMENT;
        }
        var text = normalize(title);
        if (containsAny(text, MEETING_KEYWORDS) && !allDay && isBusinessHours(start)) {
            return EventKind.APPOINTMENT;
        }
        if (containsAny(text, TASK_KEYWORDS)) {
            return EventKind.TASK;
        }
        return EventKind.OTHER;
    }

    private boolean isBusinessHours(Instant start) {
        var day = timeNormalizer.localDate(start).getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        var time = timeNormalizer.localTime(start);
        return !time.isBefore(BUSINESS_START) && time.isBefore(BUSINESS_END);
    }

    // Pads with spaces so keywords only match whole words
    private static String normalize(String title) {
        var words = title.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}:\\-]+", " ").strip();
        return " " + words + " ";
    }

    private static boolean containsAny(String text, Set<String> keywords) {
        for (var keyword : keywords) {
            if (text.contains(" " + keyword + " ")) {
                return true;
            }
        }
        return false;
    }
}
