package de.bycsitsm.agenda.source.caldav;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VEvent;
import biweekly.property.Attendee;
import biweekly.property.DurationProperty;
import biweekly.util.ICalDate;
import de.bycsitsm.agenda.source.CalendarSource;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.source.EventPatch;
import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

/**
 * Converts between iCalendar ({@code VEVENT}) payloads and canonical events.
 * <p>
 * Recurring events are expanded inside the requested window. Each occurrence
 * gets the id {@code href@epochSecond}; such ids identify a single occurrence
 * and cannot be written back.
 */
class EventICalMapper {

    private static final Logger log = LoggerFactory.getLogger(EventICalMapper.class);

    static final String OCCURRENCE_SEPARATOR = "@";

    private static final int MAX_OCCURRENCES_PER_EVENT = 500;
    private static final String UNTITLED = "Untitled event";

    private final ZoneId zone;

    EventICalMapper(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Reads all events of one calendar resource that overlap the window.
     *
     * @param source       the owning calendar
     * @param href         the resource path, used as the event id
     * @param calendarData the iCalendar text of the resource
     * @param window       the window to expand recurring events in
     */
    List<CanonicalEvent> toEvents(CalendarSource source, String href, String calendarData, TimeWindow window) {
        var ical = Biweekly.parse(calendarData).first();
        if (ical == null) {
            log.debug("Resource {} in calendar {} holds no iCalendar data", href, source.id());
            return List.of();
        }

        var events = new ArrayList<CanonicalEvent>();
        var overriddenStarts = new HashSet<Instant>();

        // Overridden occurrences replace the generated ones with the same start
        for (var vevent : ical.getEvents()) {
            if (vevent.getRecurrenceId() != null && vevent.getRecurrenceId().getValue() != null) {
                var recurrenceStart = vevent.getRecurrenceId().getValue().toInstant();
                overriddenStarts.add(recurrenceStart);
                var event = toEvent(source, href + OCCURRENCE_SEPARATOR + recurrenceStart.getEpochSecond(), vevent);
                if (event != null && intersects(event.start(), event.end(), window)) {
                    events.add(event);
                }
            }
        }

        for (var vevent : ical.getEvents()) {
            if (vevent.getRecurrenceId() != null) {
                continue;
            }
            if (vevent.getRecurrenceRule() == null) {
                var event = toEvent(source, href, vevent);
                if (event != null && intersects(event.start(), event.end(), window)) {
                    events.add(event);
                }
            } else {
                events.addAll(expand(source, href, vevent, window, overriddenStarts));
            }
        }
        return events;
    }

    /**
     * Reads the master event of a calendar resource.
     */
    @Nullable CanonicalEvent toMasterEvent(CalendarSource source, String href, String calendarData) {
        var master = findMaster(Biweekly.parse(calendarData).first());
        return master == null ? null : toEvent(source, href, master);
    }

    /**
     * Writes a draft as a new calendar resource.
     */
    String toICalendar(String uid, DraftEvent draft) {
        var vevent = new VEvent();
        vevent.setUid(uid);
        vevent.setSummary(draft.title());
        var start = Objects.requireNonNull(draft.start());
        var end = draft.end() != null ? draft.end() : defaultEnd(start, draft.allDay());
        setTimes(vevent, start, end, draft.allDay());
        if (draft.location() != null) {
            vevent.setLocation(draft.location());
        }
        if (draft.description() != null) {
            vevent.setDescription(draft.description());
        }
        for (var address : draft.attendees()) {
            vevent.addAttendee(new Attendee(null, address));
        }

        var ical = new ICalendar();
        ical.addEvent(vevent);
        return Biweekly.write(ical).go();
    }

    /**
     * Applies a sparse patch to the master event of a resource.
     *
     * @return the rewritten iCalendar text, or {@code null} if the resource has no event
     */
    @Nullable String applyPatch(String calendarData, EventPatch patch) {
        var ical = Biweekly.parse(calendarData).first();
        var master = findMaster(ical);
        if (master == null) {
            return null;
        }
        if (patch.title() != null) {
            master.setSummary(patch.title());
        }
        if (patch.location() != null) {
            master.setLocation(patch.location());
        }
        if (patch.description() != null) {
            master.setDescription(patch.description());
        }
        if (patch.start() != null || patch.end() != null) {
            var current = toEvent(null, "", master);
            var allDay = current != null && current.allDay();
            var start = patch.start() != null ? patch.start() : Objects.requireNonNull(current).start();
            var end = patch.end() != null ? patch.end() : defaultEnd(start, allDay);
            master.removeProperties(DurationProperty.class);
            setTimes(master, start, end, allDay);
        }
        return Biweekly.write(ical).go();
    }

    private List<CanonicalEvent> expand(CalendarSource source, String href, VEvent vevent, TimeWindow window,
                                        Set<Instant> overriddenStarts) {
        var first = toEvent(source, href, vevent);
        if (first == null) {
            return List.of();
        }
        var duration = first.duration();
        var allDayLength = first.allDay()
                ? ChronoUnit.DAYS.between(LocalDate.ofInstant(first.start(), zone), LocalDate.ofInstant(first.end(), zone))
                : 0;
        var occurrences = new ArrayList<CanonicalEvent>();
        var iterator = vevent.getDateIterator(TimeZone.getTimeZone(zone));
        iterator.advanceTo(Date.from(window.start().minus(duration)));

        while (iterator.hasNext() && occurrences.size() < MAX_OCCURRENCES_PER_EVENT) {
            var occurrenceStart = first.allDay()
                    ? LocalDate.ofInstant(iterator.next().toInstant(), zone).atStartOfDay(zone).toInstant()
                    : iterator.next().toInstant();
            if (!occurrenceStart.isBefore(window.end())) {
                break;
            }
            if (overriddenStarts.contains(occurrenceStart)) {
                continue;
            }
            var occurrenceEnd = first.allDay()
                    ? LocalDate.ofInstant(occurrenceStart, zone).plusDays(allDayLength).atStartOfDay(zone).toInstant()
                    : occurrenceStart.plus(duration);
            if (!intersects(occurrenceStart, occurrenceEnd, window)) {
                continue;
            }
            occurrences.add(new CanonicalEvent(
                    first.sourceId(),
                    href + OCCURRENCE_SEPARATOR + occurrenceStart.getEpochSecond(),
                    first.title(),
                    occurrenceStart,
                    occurrenceEnd,
                    first.allDay(),
                    first.location(),
                    first.attendees(),
                    first.description(),
                    EventKind.OTHER,
                    first.link()));
        }
        return occurrences;
    }

    private @Nullable CanonicalEvent toEvent(@Nullable CalendarSource source, String id, VEvent vevent) {
        if (vevent.getDateStart() == null || vevent.getDateStart().getValue() == null) {
            log.debug("Skipping event {} without start date", id);
            return null;
        }
        var startValue = vevent.getDateStart().getValue();
        var allDay = !startValue.hasTime();
        var start = allDay ? localDateOf(startValue).atStartOfDay(zone).toInstant() : startValue.toInstant();

        Instant end = null;
        if (vevent.getDateEnd() != null && vevent.getDateEnd().getValue() != null) {
            var endValue = vevent.getDateEnd().getValue();
            end = allDay ? localDateOf(endValue).atStartOfDay(zone).toInstant() : endValue.toInstant();
        } else if (vevent.getDuration() != null && vevent.getDuration().getValue() != null) {
            var length = Duration.ofMillis(vevent.getDuration().getValue().toMillis());
            // All-day lengths count local days, which are not always 24 hours long
            end = allDay
                    ? localDateOf(startValue).plusDays(length.toDays()).atStartOfDay(zone).toInstant()
                    : start.plus(length);
        } else if (allDay) {
            end = defaultEnd(start, true);
        }
        if (end != null && end.isBefore(start)) {
            log.debug("Event {} ends before it starts, using the default duration", id);
            end = null;
        }

        var title = vevent.getSummary() != null && vevent.getSummary().getValue() != null
                && !vevent.getSummary().getValue().isBlank()
                ? vevent.getSummary().getValue().strip()
                : UNTITLED;
        var attendees = vevent.getAttendees().stream()
                .map(attendee -> attendee.getEmail() != null ? attendee.getEmail() : attendee.getCommonName())
                .filter(Objects::nonNull)
                .toList();

        return new CanonicalEvent(
                source != null ? source.id() : "",
                id,
                title,
                start,
                end,
                allDay,
                vevent.getLocation() != null ? vevent.getLocation().getValue() : null,
                attendees,
                vevent.getDescription() != null ? vevent.getDescription().getValue() : null,
                EventKind.OTHER,
                vevent.getUrl() != null ? vevent.getUrl().getValue() : null);
    }

    private void setTimes(VEvent vevent, Instant start, Instant end, boolean allDay) {
        if (allDay) {
            var firstDay = LocalDate.ofInstant(start, zone);
            var endDay = LocalDate.ofInstant(end, zone);
            if (!endDay.isAfter(firstDay)) {
                endDay = firstDay.plusDays(1);
            }
            vevent.setDateStart(dateOnly(firstDay), false);
            vevent.setDateEnd(dateOnly(endDay), false);
        } else {
            vevent.setDateStart(Date.from(start), true);
            vevent.setDateEnd(Date.from(end), true);
        }
    }

    private Instant defaultEnd(Instant start, boolean allDay) {
        if (allDay) {
            return LocalDate.ofInstant(start, zone).plusDays(1).atStartOfDay(zone).toInstant();
        }
        return start.plus(CanonicalEvent.DEFAULT_DURATION);
    }

    private LocalDate localDateOf(ICalDate value) {
        var raw = value.getRawComponents();
        if (raw != null) {
            return LocalDate.of(raw.getYear(), raw.getMonth(), raw.getDate());
        }
        return LocalDate.ofInstant(value.toInstant(), ZoneId.systemDefault());
    }

    // Date-only values are written in the JVM default zone
    private static Date dateOnly(LocalDate date) {
        return Date.from(date.atStartOfDay(ZoneId.systemDefault()).toInstant());
    }

    // Zero-length events count when they start inside the window
    private static boolean intersects(Instant start, Instant end, TimeWindow window) {
        return start.isBefore(window.end()) && (end.isAfter(window.start()) || !start.isBefore(window.start()));
    }

    private static @Nullable VEvent findMaster(@Nullable ICalendar ical) {
        if (ical == null) {
            return null;
        }
        return ical.getEvents().stream()
                .filter(vevent -> vevent.getRecurrenceId() == null)
                .findFirst()
                .orElse(null);
    }
}
