package de.bycsitsm.agenda.schedule;

import de.bycsitsm.agenda.Fixtures;
import de.bycsitsm.agenda.source.EventKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.bycsitsm.agenda.Fixtures.APPOINTMENTS;
import static de.bycsitsm.agenda.Fixtures.SHARED;
import static de.bycsitsm.agenda.Fixtures.TASKS;
import static de.bycsitsm.agenda.Fixtures.at;
import static de.bycsitsm.agenda.Fixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier(Fixtures.timeNormalizer());

    @Test
    void specific_source_kind_decides() {
        var meeting = event("x", "1", "Team meeting", "2025-03-10T10:00", "2025-03-10T11:00");

        assertThat(classifier.classify(meeting, TASKS)).isEqualTo(EventKind.TASK);
        assertThat(classifier.classify(meeting, APPOINTMENTS)).isEqualTo(EventKind.APPOINTMENT);
    }

    @Test
    void several_attendees_make_an_appointment() {
        var kind = classifier.classifyContent("Dinner", at("2025-03-15T19:00"), false,
                List.of("a@example.org", "b@example.org"));

        assertThat(kind).isEqualTo(EventKind.APPOINTMENT);
    }

    @Test
    void meeting_keyword_during_business_hours_makes_an_appointment() {
        var weekday = event("shared", "1", "Budget review", "2025-03-11T10:00", "2025-03-11T11:00");

        assertThat(classifier.classify(weekday, SHARED)).isEqualTo(EventKind.APPOINTMENT);
    }

    @Test
    void meeting_keyword_outside_business_hours_is_not_an_appointment() {
        assertThat(classifier.classifyContent("Budget review", at("2025-03-15T10:00"), false, List.of()))
                .isEqualTo(EventKind.OTHER);
        assertThat(classifier.classifyContent("Budget review", at("2025-03-11T20:00"), false, List.of()))
                .isEqualTo(EventKind.OTHER);
    }

    @Test
    void chore_keywords_make_a_task() {
        assertThat(classifier.classifyContent("Wash car", at("2025-03-11T10:00"), false, List.of()))
                .isEqualTo(EventKind.TASK);
        assertThat(classifier.classifyContent("Pay bills!", at("2025-03-15T10:00"), true, List.of()))
                .isEqualTo(EventKind.TASK);
    }

    @Test
    void keywords_only_match_whole_words() {
        assertThat(classifier.classifyContent("Recall notes", at("2025-03-11T10:00"), false, List.of()))
                .isEqualTo(EventKind.OTHER);
    }

    @Test
    void same_content_always_gets_the_same_kind() {
        var titles = List.of("Wash car", "Team meeting", "Birthday", "Wash car", "Team meeting");

        var kinds = titles.stream()
                .map(title -> classifier.classifyContent(title, at("2025-03-11T10:00"), false, List.of()))
                .toList();

        assertThat(kinds).containsExactly(EventKind.TASK, EventKind.APPOINTMENT, EventKind.OTHER, EventKind.TASK,
                EventKind.APPOINTMENT);
    }
}
