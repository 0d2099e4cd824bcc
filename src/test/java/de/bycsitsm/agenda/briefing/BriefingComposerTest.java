package de.bycsitsm.agenda.briefing;

import de.bycsitsm.agenda.Fixtures;
import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.schedule.ConflictDetector;
import de.bycsitsm.agenda.source.CanonicalEvent;
import de.bycsitsm.agenda.source.EventKind;
import de.bycsitsm.agenda.source.InMemorySourceAdapter;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static de.bycsitsm.agenda.Fixtures.APPOINTMENTS;
import static de.bycsitsm.agenda.Fixtures.TASKS;
import static de.bycsitsm.agenda.Fixtures.event;
import static de.bycsitsm.agenda.Fixtures.registry;
import static org.assertj.core.api.Assertions.assertThat;

class BriefingComposerTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 10);

    private final BriefingComposer composer = new BriefingComposer(
            new EventFormatter(Fixtures.timeNormalizer(), registry(new InMemorySourceAdapter(), APPOINTMENTS, TASKS)),
            Fixtures.timeNormalizer(), Fixtures.properties());
    private final ConflictDetector conflictDetector = new ConflictDetector();

    private final CanonicalEvent dentist = event("appointments", "a1", "Dentist", "2025-03-10T10:00", "2025-03-10T10:30")
            .withKind(EventKind.APPOINTMENT);
    private final CanonicalEvent gym = event("tasks", "t1", "Gym", "2025-03-10T10:15", "2025-03-10T10:45")
            .withKind(EventKind.TASK);
    private final CanonicalEvent laundry = event("tasks", "t2", "Laundry", "2025-03-11T18:00", "2025-03-11T19:00")
            .withKind(EventKind.TASK);

    @Test
    void sections_appear_in_fixed_order() {
        var today = List.of(dentist, gym);

        var briefing = composer.compose(today, List.of(laundry), conflictDetector.findConflicts(today));

        assertThat(briefing).startsWith("Briefing for Monday, March 10, 2025\n");
        assertThat(briefing).containsSubsequence(
                "Today (2):",
                "- 10:00-10:30 Dentist [Appointments]",
                "- 10:15-10:45 (task) Gym [Tasks]",
                "Tomorrow (1):",
                "- 18:00-19:00 (task) Laundry [Tasks]",
                "Conflicts (1):",
                "- 10:15-10:30 Dentist [Appointments] overlaps Gym [Tasks]",
                "Focus: resolve 1 scheduling conflict(s) first.");
    }

    @Test
    void empty_day_reads_as_clear() {
        var briefing = composer.compose(List.of(), List.of(), List.of());

        assertThat(briefing).contains("Today: clear schedule.")
                .contains("Tomorrow: clear schedule.")
                .doesNotContain("Conflicts")
                .endsWith("Focus: clear schedule, a good day for deep work.");
    }

    @Test
    void focus_names_the_first_commitment() {
        var briefing = composer.compose(List.of(dentist), List.of(), List.of());

        assertThat(briefing).endsWith("Focus: first commitment at 10:00, Dentist.");
    }

    @Test
    void focus_counts_tasks_when_there_are_no_appointments() {
        var briefing = composer.compose(List.of(gym, laundry), List.of(), List.of());

        assertThat(briefing).endsWith("Focus: 2 task(s) to get done today.");
    }

    @Test
    void long_lists_are_truncated_with_a_count() {
        var today = new ArrayList<CanonicalEvent>();
        for (int hour = 6; hour < 18; hour++) {
            today.add(event("appointments", "a" + hour, "Slot " + hour, "2025-03-10T%02d:00".formatted(hour),
                    "2025-03-10T%02d:30".formatted(hour)));
        }
        var tomorrow = new ArrayList<CanonicalEvent>();
        for (int hour = 8; hour < 13; hour++) {
            tomorrow.add(event("tasks", "t" + hour, "Task " + hour, "2025-03-11T%02d:00".formatted(hour),
                    "2025-03-11T%02d:30".formatted(hour)));
        }

        var briefing = composer.compose(MONDAY, today, tomorrow, List.of(), Map.of(), 5000);

        assertThat(briefing).contains("Today (12):").contains("Slot 15").doesNotContain("Slot 16")
                .containsSubsequence("Slot 15", "...and 2 more", "Tomorrow (5):", "Task 10", "...and 2 more");
        assertThat(briefing).doesNotContain("Task 11");
    }

    @Test
    void output_never_exceeds_the_budget() {
        var today = new ArrayList<CanonicalEvent>();
        for (int hour = 8; hour < 18; hour++) {
            today.add(event("appointments", "a" + hour, "Quarterly planning session " + hour,
                    "2025-03-10T%02d:00".formatted(hour), "2025-03-10T%02d:45".formatted(hour)));
        }
        today.add(gym);
        var conflicts = conflictDetector.findConflicts(today);

        for (var budget : List.of(60, 120, 250, 400, 800, 1200)) {
            var briefing = composer.compose(MONDAY, today, List.of(laundry), conflicts, Map.of(), budget);
            assertThat(briefing.length()).isLessThanOrEqualTo(budget);
            assertThat(briefing).startsWith("Briefing for Monday, March 10, 2025");
        }
    }

    @Test
    void tomorrow_is_dropped_before_today_is_shortened() {
        var today = new ArrayList<CanonicalEvent>();
        for (int hour = 8; hour < 14; hour++) {
            today.add(event("appointments", "a" + hour, "Customer call number " + hour,
                    "2025-03-10T%02d:00".formatted(hour), "2025-03-10T%02d:30".formatted(hour)));
        }
        var full = composer.compose(MONDAY, today, List.of(laundry), List.of(), Map.of(), 5000);
        var withoutTomorrow = composer.compose(MONDAY, today, List.of(), List.of(), Map.of(), 5000)
                .replace("\n\nTomorrow: clear schedule.", "");

        var briefing = composer.compose(MONDAY, today, List.of(laundry), List.of(), Map.of(),
                withoutTomorrow.length());

        assertThat(full).contains("Laundry");
        assertThat(briefing).doesNotContain("Tomorrow").contains("Customer call number 13");
    }

    @Test
    void unavailable_calendars_are_always_mentioned() {
        var errors = Map.of("tasks", new SourceUnavailableException("tasks", "Calendar 'Tasks' is unreachable"));

        var briefing = composer.compose(MONDAY, List.of(dentist), List.of(), List.of(), errors, 150);

        assertThat(briefing).startsWith("Briefing for Monday, March 10, 2025\n"
                + "Warning: calendar 'Tasks' is unavailable, its events are missing.");
        assertThat(briefing.length()).isLessThanOrEqualTo(150);
    }

    @Test
    void budget_below_the_header_keeps_the_start_of_the_header() {
        var briefing = composer.compose(MONDAY, List.of(dentist, gym), List.of(laundry), List.of(), Map.of(), 20);

        assertThat(briefing).isEqualTo("Briefing for Monday,");
    }

    @Test
    void budget_fitting_only_the_header_returns_the_header() {
        var briefing = composer.compose(MONDAY, List.of(dentist), List.of(), List.of(), Map.of(), 36);

        assertThat(briefing).isEqualTo("Briefing for Monday, March 10, 2025");
    }
}
