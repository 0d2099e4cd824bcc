package de.bycsitsm.agenda.briefing;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.schedule.AggregatedEvents;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.SourceRegistry;
import de.bycsitsm.agenda.time.TimeNormalizer;
import de.bycsitsm.agenda.time.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Renders the read views: a single day, the upcoming days and free-time search results.
 */
@Component
public class ScheduleRenderer {

    private static final int MAX_DAY_LINES = 15;

    private final EventFormatter eventFormatter;
    private final TimeNormalizer timeNormalizer;
    private final SourceRegistry sourceRegistry;
    private final AgendaProperties.Upcoming upcomingLimits;

    public ScheduleRenderer(EventFormatter eventFormatter, TimeNormalizer timeNormalizer,
                            SourceRegistry sourceRegistry, AgendaProperties properties) {
        this.eventFormatter = eventFormatter;
        this.timeNormalizer = timeNormalizer;
        this.sourceRegistry = sourceRegistry;
        this.upcomingLimits = properties.upcoming();
    }

    public String renderDay(LocalDate date, AggregatedEvents aggregated) {
        var lines = new ArrayList<String>();
        var events = aggregated.events();
        var heading = "Schedule for " + eventFormatter.dayHeading(date);

        if (events.isEmpty()) {
            lines.add(heading + ": no events (checked " + checkedCalendars(aggregated) + ").");
        } else {
            lines.add(heading + ": " + events.size() + " event(s) (" + breakdown(events) + ")");
            lines.addAll(eventFormatter.warningLines(aggregated.sourceErrors()));
            lines.add("");
            var shown = Math.min(MAX_DAY_LINES, events.size());
            for (int i = 0; i < shown; i++) {
                lines.add(eventFormatter.line(events.get(i)));
            }
            if (events.size() > shown) {
                lines.add("...and " + (events.size() - shown) + " more");
            }
            return String.join("\n", lines);
        }
        lines.addAll(eventFormatter.warningLines(aggregated.sourceErrors()));
        return String.join("\n", lines);
    }

    /**
     * Renders events grouped by local day.
     *
     * @param days the number of days covered by {@code aggregated}
     */
    public String renderUpcoming(int days, AggregatedEvents aggregated) {
        var lines = new ArrayList<String>();
        var events = aggregated.events();
        if (events.isEmpty()) {
            lines.add("Upcoming " + days + " day(s): no events.");
            lines.addAll(eventFormatter.warningLines(aggregated.sourceErrors()));
            return String.join("\n", lines);
        }

        lines.add("Upcoming " + days + " day(s): " + events.size() + " event(s)");
        lines.addAll(eventFormatter.warningLines(aggregated.sourceErrors()));

        var byDay = new LinkedHashMap<LocalDate, List<CanonicalEvent>>();
        for (var event : events) {
            byDay.computeIfAbsent(timeNormalizer.localDate(event.start()), day -> new ArrayList<>()).add(event);
        }

        var shownDays = 0;
        for (var entry : byDay.entrySet()) {
            if (shownDays++ >= upcomingLimits.maxDays()) {
                break;
            }
            lines.add("");
            lines.add(eventFormatter.shortDay(entry.getKey()));
            var dayEvents = entry.getValue();
            var shown = Math.min(upcomingLimits.perDayLimit(), dayEvents.size());
            for (int i = 0; i < shown; i++) {
                lines.add(eventFormatter.line(dayEvents.get(i)));
            }
            if (dayEvents.size() > shown) {
                lines.add("...and " + (dayEvents.size() - shown) + " more");
            }
        }
        return String.join("\n", lines);
    }

    public String renderFreeSlots(List<TimeWindow> slots, int durationMinutes, int days, AggregatedEvents aggregated) {
        var lines = new ArrayList<String>();
        if (slots.isEmpty()) {
            lines.add("No free " + durationMinutes + "-minute slot in the next " + days
                    + " day(s). Try a shorter duration or more days.");
        } else {
            lines.add("Available " + durationMinutes + "-minute slots:");
            for (int i = 0; i < slots.size(); i++) {
                lines.add(eventFormatter.slotLine(i + 1, slots.get(i)));
            }
        }
        lines.addAll(eventFormatter.warningLines(aggregated.sourceErrors()));
        return String.join("\n", lines);
    }

    private String breakdown(List<CanonicalEvent> events) {
        var counts = new LinkedHashMap<String, Integer>();
        for (var registered : sourceRegistry.sources()) {
            var sourceId = registered.source().id();
            var count = (int) events.stream().filter(event -> event.sourceId().equals(sourceId)).count();
            if (count > 0) {
                counts.put(registered.source().displayName(), count);
            }
        }
        var parts = new ArrayList<String>();
        counts.forEach((name, count) -> parts.add(count + " " + name));
        return String.join(", ", parts);
    }

    private String checkedCalendars(AggregatedEvents aggregated) {
        var names = sourceRegistry.sources().stream()
                .filter(registered -> !aggregated.sourceErrors().containsKey(registered.source().id()))
                .map(registered -> registered.source().displayName())
                .toList();
        return names.isEmpty() ? "no calendars" : String.join(", ", names);
    }
}
