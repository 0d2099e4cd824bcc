package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.ValidationException;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.time.TimeNormalizer;
import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes free time from the busy time of aggregated events.
 * <p>
 * Each search is bounded to one local day, optionally narrowed to the
 * configured business hours. All-day events do not block time.
 */
@Service
public class AvailabilityEngine {

    private final TimeNormalizer timeNormalizer;
    private final @Nullable LocalTime dayStart;
    private final @Nullable LocalTime dayEnd;

    public AvailabilityEngine(TimeNormalizer timeNormalizer, AgendaProperties properties) {
        this.timeNormalizer = timeNormalizer;
        this.dayStart = properties.availability().dayStart();
        this.dayEnd = properties.availability().dayEnd();
    }

    /**
     * Finds the earliest gap of at least {@code durationMinutes} on the given day.
     *
     * @return the slot, exactly {@code durationMinutes} long, or empty if the day has no such gap
     * @throws ValidationException if the duration is not positive
     */
    public Optional<TimeWindow> findFreeSlot(LocalDate day, int durationMinutes, List<CanonicalEvent> busyEvents) {
        return findFreeSlot(day, durationMinutes, busyEvents, null);
    }

    /**
     * Like {@link #findFreeSlot(LocalDate, int, List)}, ignoring all time before {@code notBefore}.
     */
    public Optional<TimeWindow> findFreeSlot(LocalDate day, int durationMinutes, List<CanonicalEvent> busyEvents,
                                             @Nullable Instant notBefore) {
        if (durationMinutes <= 0) {
            throw new ValidationException("Duration must be a positive number of minutes, got " + durationMinutes + ".");
        }
        var bounds = timeNormalizer.boundedDayWindow(day, dayStart, dayEnd);
        if (notBefore != null && notBefore.isAfter(bounds.start())) {
            if (!notBefore.isBefore(bounds.end())) {
                return Optional.empty();
            }
            bounds = new TimeWindow(notBefore, bounds.end());
        }

        var duration = Duration.ofMinutes(durationMinutes);
        var cursor = bounds.start();
        for (var busy : mergeBusy(bounds, busyEvents)) {
            if (Duration.between(cursor, busy.start()).compareTo(duration) >= 0) {
                return Optional.of(new TimeWindow(cursor, cursor.plus(duration)));
            }
            if (busy.end().isAfter(cursor)) {
                cursor = busy.end();
            }
        }
        if (Duration.between(cursor, bounds.end()).compareTo(duration) >= 0) {
            return Optional.of(new TimeWindow(cursor, cursor.plus(duration)));
        }
        return Optional.empty();
    }

    /**
     * Searches day by day, starting at {@code firstDay}, and collects the earliest
     * free slot of each qualifying day.
     *
     * @param firstDay        the first day to search
     * @param days            how many days to search
     * @param durationMinutes the required length of the slot
     * @param busyEvents      the events covering the searched days
     * @param weekdays        the days of the week to consider; empty means all
     * @param notBefore       slots never start before this instant
     * @param maxResults      the maximum number of slots to return
     */
    public List<TimeWindow> findFreeSlots(LocalDate firstDay, int days, int durationMinutes,
                                          List<CanonicalEvent> busyEvents, Set<DayOfWeek> weekdays,
                                          Instant notBefore, int maxResults) {
        var slots = new ArrayList<TimeWindow>();
        for (int offset = 0; offset < days && slots.size() < maxResults; offset++) {
            var day = firstDay.plusDays(offset);
            if (!weekdays.isEmpty() && !weekdays.contains(day.getDayOfWeek())) {
                continue;
            }
            findFreeSlot(day, durationMinutes, busyEvents, notBefore).ifPresent(slots::add);
        }
        return slots;
    }

    /**
     * Projects timed events onto the window, then sorts and coalesces overlapping
     * or adjacent intervals.
     */
    public List<BusyInterval> mergeBusy(TimeWindow window, List<CanonicalEvent> events) {
        var projected = new ArrayList<BusyInterval>();
        for (var event : events) {
            if (event.allDay() || !event.overlaps(window.start(), window.end())) {
                continue;
            }
            var start = event.start().isBefore(window.start()) ? window.start() : event.start();
            var end = event.end().isAfter(window.end()) ? window.end() : event.end();
            if (end.isAfter(start)) {
                projected.add(new BusyInterval(start, end));
            }
        }
        projected.sort(Comparator.comparing(BusyInterval::start).thenComparing(BusyInterval::end));

        var merged = new ArrayList<BusyInterval>();
        for (var interval : projected) {
            if (!merged.isEmpty()) {
                var last = merged.get(merged.size() - 1);
                if (!interval.start().isAfter(last.end())) {
                    if (interval.end().isAfter(last.end())) {
                        merged.set(merged.size() - 1, new BusyInterval(last.start(), interval.end()));
                    }
                    continue;
                }
            }
            merged.add(interval);
        }
        return merged;
    }
}
