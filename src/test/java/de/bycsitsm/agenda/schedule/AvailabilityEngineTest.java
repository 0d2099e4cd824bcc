package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.Fixtures;
import de.bycsitsm.agenda.ValidationException;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.time.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static de.bycsitsm.agenda.Fixtures.allDayEvent;
import static de.bycsitsm.agenda.Fixtures.at;
import static de.bycsitsm.agenda.Fixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityEngineTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);

    private final AvailabilityEngine businessHours = new AvailabilityEngine(Fixtures.timeNormalizer(),
            Fixtures.properties(Duration.ofSeconds(2), LocalTime.of(8, 0), LocalTime.of(18, 0)));
    private final AvailabilityEngine wholeDay = new AvailabilityEngine(Fixtures.timeNormalizer(),
            Fixtures.properties());

    @Test
    void empty_day_is_free_from_its_start() {
        assertThat(businessHours.findFreeSlot(MONDAY, 60, List.of()))
                .contains(new TimeWindow(at("2025-03-10T08:00"), at("2025-03-10T09:00")));
        assertThat(wholeDay.findFreeSlot(MONDAY, 30, List.of()))
                .contains(new TimeWindow(at("2025-03-10T00:00"), at("2025-03-10T00:30")));
    }

    @Test
    void earliest_sufficient_gap_is_returned() {
        var events = List.of(
                event("a", "1", "Standup", "2025-03-10T08:00", "2025-03-10T09:00"),
                event("a", "2", "Review", "2025-03-10T09:30", "2025-03-10T11:00"),
                event("t", "3", "Gym", "2025-03-10T12:00", "2025-03-10T13:00"));

        assertThat(businessHours.findFreeSlot(MONDAY, 45, events))
                .contains(new TimeWindow(at("2025-03-10T11:00"), at("2025-03-10T11:45")));
        assertThat(businessHours.findFreeSlot(MONDAY, 30, events))
                .contains(new TimeWindow(at("2025-03-10T09:00"), at("2025-03-10T09:30")));
    }

    @Test
    void overlapping_and_adjacent_events_are_merged() {
        var events = List.of(
                event("a", "1", "One", "2025-03-10T08:00", "2025-03-10T10:00"),
                event("t", "2", "Two", "2025-03-10T09:00", "2025-03-10T11:00"),
                event("a", "3", "Three", "2025-03-10T11:00", "2025-03-10T12:00"));

        var busy = businessHours.mergeBusy(new TimeWindow(at("2025-03-10T08:00"), at("2025-03-10T18:00")), events);

        assertThat(busy).containsExactly(new BusyInterval(at("2025-03-10T08:00"), at("2025-03-10T12:00")));
    }

    @Test
    void fully_booked_day_has_no_slot() {
        var events = List.of(event("a", "1", "Offsite", "2025-03-10T07:00", "2025-03-10T19:00"));

        assertThat(businessHours.findFreeSlot(MONDAY, 15, events)).isEmpty();
    }

    @Test
    void too_short_gaps_are_skipped_up_to_the_end_of_the_day() {
        var events = List.of(
                event("a", "1", "Morning", "2025-03-10T08:00", "2025-03-10T12:00"),
                event("a", "2", "Afternoon", "2025-03-10T12:30", "2025-03-10T17:30"));

        assertThat(businessHours.findFreeSlot(MONDAY, 45, events)).isEmpty();
        assertThat(businessHours.findFreeSlot(MONDAY, 30, events))
                .contains(new TimeWindow(at("2025-03-10T12:00"), at("2025-03-10T12:30")));
    }

    @Test
    void all_day_events_do_not_block_time() {
        var events = List.of(allDayEvent("a", "1", "Conference", "2025-03-10"));

        assertThat(businessHours.findFreeSlot(MONDAY, 60, events))
                .contains(new TimeWindow(at("2025-03-10T08:00"), at("2025-03-10T09:00")));
    }

    @Test
    void slot_never_overlaps_busy_time() {
        var events = List.of(
                event("a", "1", "A", "2025-03-10T08:10", "2025-03-10T08:50"),
                event("t", "2", "B", "2025-03-10T09:05", "2025-03-10T10:40"),
                event("a", "3", "C", "2025-03-10T11:00", "2025-03-10T11:20"));

        for (var minutes : List.of(5, 10, 20, 30, 60, 90)) {
            var slot = businessHours.findFreeSlot(MONDAY, minutes, events).orElseThrow();
            assertThat(events).noneMatch(event -> event.overlaps(slot.start(), slot.end()));
            assertThat(slot.duration()).isEqualTo(Duration.ofMinutes(minutes));
        }
    }

    @Test
    void nothing_before_not_before_is_proposed() {
        var slot = businessHours.findFreeSlot(MONDAY, 60, List.of(), at("2025-03-10T09:17"));

        assertThat(slot).contains(new TimeWindow(at("2025-03-10T09:17"), at("2025-03-10T10:17")));
        assertThat(businessHours.findFreeSlot(MONDAY, 60, List.of(), at("2025-03-10T18:30"))).isEmpty();
    }

    @Test
    void multi_day_search_respects_weekdays_and_limit() {
        List<CanonicalEvent> events = List.of(event("a", "1", "Offsite", "2025-03-11T07:00", "2025-03-11T19:00"));

        var slots = businessHours.findFreeSlots(MONDAY, 7, 60, events,
                Set.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY), Fixtures.NOW, 5);

        assertThat(slots).containsExactly(
                new TimeWindow(at("2025-03-10T09:00"), at("2025-03-10T10:00")),
                new TimeWindow(at("2025-03-12T08:00"), at("2025-03-12T09:00")));
        assertThat(businessHours.findFreeSlots(MONDAY, 7, 60, List.of(), Set.of(), Fixtures.NOW, 2)).hasSize(2);
    }

    @Test
    void non_positive_duration_is_rejected() {
        assertThatThrownBy(() -> businessHours.findFreeSlot(MONDAY, 0, List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("positive");
    }
}
