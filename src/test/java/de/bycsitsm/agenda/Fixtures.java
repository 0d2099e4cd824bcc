package de.bycsitsm.agenda;

import de.bycsitsm.agenda.source.CalendarSource;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.source.RegisteredSource;
import de.bycsitsm.agenda.source.SourceAdapter;
import de.bycsitsm.agenda.source.SourceKind;
import de.bycsitsm.agenda.source.SourceRegistry;
import de.bycsitsm.agenda.time.TimeNormalizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Shared values for tests: a fixed clock on Monday, 2025-03-10 09:00 in Toronto,
 * the day after the spring daylight-saving transition.
 */
public final class Fixtures {

    public static final ZoneId ZONE = ZoneId.of("America/Toronto");
    public static final Instant NOW = at("2025-03-10T09:00");

    public static final CalendarSource APPOINTMENTS =
            new CalendarSource("appointments", "Appointments", SourceKind.APPOINTMENT, "mem:appointments");
    public static final CalendarSource TASKS = new CalendarSource("tasks", "Tasks", SourceKind.TASK, "mem:tasks");
    public static final CalendarSource SHARED = new CalendarSource("shared", "Family", SourceKind.GENERIC, "mem:shared");

    private Fixtures() {
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZONE);
    }

    public static TimeNormalizer timeNormalizer() {
        return new TimeNormalizer(clock());
    }

    public static AgendaProperties properties() {
        return properties(Duration.ofSeconds(2), null, null);
    }

    public static AgendaProperties properties(Duration sourceTimeout, LocalTime dayStart, LocalTime dayEnd) {
        return new AgendaProperties(ZONE.getId(), sourceTimeout, List.of(),
                new AgendaProperties.Availability(dayStart, dayEnd), null, null, null);
    }

    public static SourceRegistry registry(SourceAdapter adapter, CalendarSource... sources) {
        return new SourceRegistry(List.of(sources).stream()
                .map(source -> new RegisteredSource(source, adapter))
                .toList());
    }

    /**
     * Converts a local date-time such as {@code 2025-03-10T14:00} in the test zone.
     */
    public static Instant at(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(ZONE).toInstant();
    }

    public static CanonicalEvent event(String sourceId, String id, String title, String start, String end) {
        return new CanonicalEvent(sourceId, id, title, at(start), at(end), false, null, List.of(), null,
                EventKind.OTHER, null);
    }

    public static CanonicalEvent allDayEvent(String sourceId, String id, String title, String date) {
        var start = at(date + "T00:00");
        var end = at(LocalDateTime.parse(date + "T00:00").plusDays(1).toString());
        return new CanonicalEvent(sourceId, id, title, start, end, true, null, List.of(), null, EventKind.OTHER,
                null);
    }
}
