package de.bycsitsm.agenda.source.caldav;

import de.bycsitsm.agenda.EventNotFoundException;
import de.bycsitsm.agenda.Fixtures;
import de.bycsitsm.agenda.SourceUnavailableException;
import de.bycsitsm.agenda.ValidationException;
import de.bycsitsm.agenda.mutation.DesiredChange;
import de.bycsitsm.agenda.mutation.MutationRequest;
import de.bycsitsm.agenda.mutation.MutationResolver;
import de.bycsitsm.agenda.schedule.EventAggregator;
import de.bycsitsm.agenda.schedule.EventClassifier;
import de.bycsitsm.agenda.source.CalendarSource;
import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventPatch;
import de.bycsitsm.agenda.source.SourceKind;
import de.bycsitsm.agenda.time.TimeWindow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;

import static de.bycsitsm.agenda.Fixtures.APPOINTMENTS;
import static de.bycsitsm.agenda.Fixtures.at;
import static de.bycsitsm.agenda.Fixtures.registry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalDavSourceAdapterTest {

    private final CalDavSourceAdapter adapter =
            new CalDavSourceAdapter(new CalDavProperties("user", "secret", false), Fixtures.timeNormalizer());
    private final CalDavServer server = new CalDavServer();

    private final CalendarSource appointments = new CalendarSource("appointments", "Appointments",
            SourceKind.APPOINTMENT, server.url("/appointments/"));
    private final CalendarSource tasks = new CalendarSource("tasks", "Tasks", SourceKind.TASK,
            server.url("/tasks/"));

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void parsing_calendar_query_response_extracts_resources() {
        // Shape of a Radicale calendar-query answer
        var xml = """
                <?xml version="1.0" encoding="utf-8"?>
                <multistatus xmlns="DAV:" xmlns:C="urn:ietf:params:xml:ns:caldav">
                  <response>
                    <href>/user/appointments/a1.ics</href>
                    <propstat>
                      <prop>
                        <getetag>"etag-1"</getetag>
                        <C:calendar-data>BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VEVENT
                UID:a1
                DTSTART:20250310T140000Z
                DTEND:20250310T150000Z
                SUMMARY:Dentist
                END:VEVENT
                END:VCALENDAR
                </C:calendar-data>
                      </prop>
                      <status>HTTP/1.1 200 OK</status>
                    </propstat>
                  </response>
                  <response>
                    <href>/user/appointments/gone.ics</href>
                    <propstat>
                      <prop>
                        <getetag/>
                        <C:calendar-data/>
                      </prop>
                      <status>HTTP/1.1 404 Not Found</status>
                    </propstat>
                  </response>
                </multistatus>
                """;

        var resources = adapter.parseCalendarQueryResponse(APPOINTMENTS, xml);

        assertThat(resources).hasSize(1);
        assertThat(resources.get(0).href()).isEqualTo("/user/appointments/a1.ics");
        assertThat(resources.get(0).etag()).isEqualTo("\"etag-1\"");
        assertThat(resources.get(0).calendarData()).contains("SUMMARY:Dentist");
    }

    @Test
    void parsing_calendar_query_response_skips_resources_without_calendar_data() {
        var xml = """
                <?xml version="1.0" encoding="utf-8"?>
                <d:multistatus xmlns:d="DAV:">
                  <d:response>
                    <d:href>/user/appointments/</d:href>
                    <d:propstat>
                      <d:prop>
                        <d:getetag>"collection"</d:getetag>
                      </d:prop>
                      <d:status>HTTP/1.1 200 OK</d:status>
                    </d:propstat>
                  </d:response>
                </d:multistatus>
                """;

        assertThat(adapter.parseCalendarQueryResponse(APPOINTMENTS, xml)).isEmpty();
    }

    @Test
    void unreadable_response_makes_the_source_unavailable() {
        assertThatThrownBy(() -> adapter.parseCalendarQueryResponse(APPOINTMENTS, "<multistatus"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("Appointments")
                .extracting(e -> ((SourceUnavailableException) e).getSourceId())
                .isEqualTo("appointments");
    }

    @Test
    void create_requires_title_before_any_request() {
        var draft = new DraftEvent(" ", Instant.parse("2025-03-10T14:00:00Z"), null, false, null, List.of(), null);

        assertThatThrownBy(() -> adapter.create(APPOINTMENTS, draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("without a title");
    }

    @Test
    void create_requires_start_before_any_request() {
        var draft = new DraftEvent("Dentist", null, null, false, null, List.of(), null);

        assertThatThrownBy(() -> adapter.create(APPOINTMENTS, draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'Dentist' without a start time");
    }

    @Test
    void single_occurrences_of_recurring_events_cannot_be_changed() {
        var patch = new EventPatch("Renamed", null, null, null, null);

        assertThatThrownBy(() -> adapter.update(APPOINTMENTS, "/user/appointments/series.ics@1741615200", patch))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("recurring series");
        assertThatThrownBy(() -> adapter.delete(APPOINTMENTS, "/user/appointments/series.ics@1741615200"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void hrefs_resolve_against_the_collection_url() {
        var base = adapter.normalizeUrl("cal.example.org/user/appointments");

        assertThat(base).isEqualTo("https://cal.example.org/user/appointments/");
        assertThat(adapter.resolveHref(base, "/user/appointments/a1.ics"))
                .isEqualTo("https://cal.example.org/user/appointments/a1.ics");
        assertThat(adapter.resolveHref(base, "https://other.example.org/x.ics"))
                .isEqualTo("https://other.example.org/x.ics");
    }

    @Test
    void list_sends_an_authenticated_calendar_query() {
        server.respond("REPORT", "/appointments/", 207, multistatus("/appointments/a1.ics", """
                BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VEVENT
                UID:a1
                DTSTART:20250310T140000Z
                DTEND:20250310T150000Z
                SUMMARY:Dentist
                END:VEVENT
                END:VCALENDAR
                """));

        var events = adapter.list(appointments, at("2025-03-10T00:00"), at("2025-03-11T00:00"));

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.externalEventId()).isEqualTo("/appointments/a1.ics");
            assertThat(event.title()).isEqualTo("Dentist");
        });
        var report = server.requests().get(0);
        assertThat(report.method()).isEqualTo("REPORT");
        assertThat(report.header("Depth")).isEqualTo("1");
        assertThat(report.header("Authorization")).isEqualTo("Basic dXNlcjpzZWNyZXQ=");
        assertThat(report.body()).contains("calendar-query").contains("start=\"20250310T040000Z\"");
    }

    @Test
    void rejected_credentials_make_the_source_unavailable() {
        server.respond("REPORT", "/appointments/", 401, "");

        assertThatThrownBy(() -> adapter.list(appointments, at("2025-03-10T00:00"), at("2025-03-11T00:00")))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("authentication failed");
    }

    @Test
    void forbidden_collection_makes_the_source_unavailable() {
        server.respond("REPORT", "/appointments/", 403, "");

        assertThatThrownBy(() -> adapter.list(appointments, at("2025-03-10T00:00"), at("2025-03-11T00:00")))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("access denied");
    }

    @Test
    void server_error_makes_the_source_unavailable() {
        server.respond("REPORT", "/appointments/", 500, "");
        server.respond("DELETE", "/appointments/", 503, "");

        assertThatThrownBy(() -> adapter.list(appointments, at("2025-03-10T00:00"), at("2025-03-11T00:00")))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("unexpected status 500");
        assertThatThrownBy(() -> adapter.delete(appointments, "/appointments/a1.ics"))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("unexpected status 503");
    }

    @Test
    void unreachable_server_makes_the_source_unavailable() {
        var closed = new CalendarSource("appointments", "Appointments", SourceKind.APPOINTMENT,
                server.url("/appointments/"));
        server.close();

        assertThatThrownBy(() -> adapter.list(closed, at("2025-03-10T00:00"), at("2025-03-11T00:00")))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("unreachable")
                .extracting(e -> ((SourceUnavailableException) e).getSourceId())
                .isEqualTo("appointments");
    }

    @Test
    void create_puts_a_new_resource_without_overwriting() {
        server.respond("PUT", "/appointments/", 201, "");
        var draft = new DraftEvent("Dentist", at("2025-03-12T14:00"), at("2025-03-12T15:00"), false, "Main St",
                List.of(), null);

        var created = adapter.create(appointments, draft);

        var put = server.requests().get(0);
        assertThat(put.method()).isEqualTo("PUT");
        assertThat(put.path()).startsWith("/appointments/").endsWith(".ics");
        assertThat(put.header("If-None-Match")).isEqualTo("*");
        assertThat(put.body()).contains("SUMMARY:Dentist").contains("LOCATION:Main St");
        assertThat(created.externalEventId()).isEqualTo(put.path());
        assertThat(created.start()).isEqualTo(at("2025-03-12T14:00"));
    }

    @Test
    void update_reads_then_writes_guarded_by_the_etag() {
        server.respond("GET", "/appointments/a1.ics", 200, """
                BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VEVENT
                UID:a1
                DTSTART:20250310T140000Z
                DTEND:20250310T150000Z
                SUMMARY:Dentist
                END:VEVENT
                END:VCALENDAR
                """, "ETag", "\"v1\"");
        server.respond("PUT", "/appointments/a1.ics", 204, "");

        var updated = adapter.update(appointments, "/appointments/a1.ics",
                new EventPatch("Dentist check-up", null, null, null, null));

        assertThat(server.methods()).containsExactly("GET", "PUT");
        var put = server.requests().get(1);
        assertThat(put.header("If-Match")).isEqualTo("\"v1\"");
        assertThat(put.body()).contains("SUMMARY:Dentist check-up").contains("UID:a1");
        assertThat(updated.title()).isEqualTo("Dentist check-up");
    }

    @Test
    void update_of_a_missing_resource_is_not_found() {
        assertThatThrownBy(() -> adapter.update(appointments, "/appointments/gone.ics",
                new EventPatch("Renamed", null, null, null, null)))
                .isInstanceOf(EventNotFoundException.class);
        assertThat(server.methods()).containsExactly("GET");
    }

    @Test
    void update_rejected_because_of_a_concurrent_change_is_unavailable() {
        server.respond("GET", "/appointments/a1.ics", 200, """
                BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VEVENT
                UID:a1
                DTSTART:20250310T140000Z
                SUMMARY:Dentist
                END:VEVENT
                END:VCALENDAR
                """, "ETag", "\"v1\"");
        server.respond("PUT", "/appointments/a1.ics", 412, "");

        assertThatThrownBy(() -> adapter.update(appointments, "/appointments/a1.ics",
                new EventPatch("Renamed", null, null, null, null)))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("changed on the server");
    }

    @Test
    void delete_of_an_absent_resource_is_not_found() {
        server.respond("DELETE", "/appointments/expired.ics", 410, "");

        assertThatThrownBy(() -> adapter.delete(appointments, "/appointments/gone.ics"))
                .isInstanceOf(EventNotFoundException.class);
        assertThatThrownBy(() -> adapter.delete(appointments, "/appointments/expired.ics"))
                .isInstanceOf(EventNotFoundException.class);
    }

    @Test
    void delete_succeeds_on_no_content() {
        server.respond("DELETE", "/appointments/a1.ics", 204, "");

        adapter.delete(appointments, "/appointments/a1.ics");

        assertThat(server.requests()).singleElement()
                .satisfies(request -> assertThat(request.path()).isEqualTo("/appointments/a1.ics"));
    }

    @Test
    void occurrence_ids_are_read_only() {
        assertThat(adapter.isWritable("/user/appointments/a1.ics")).isTrue();
        assertThat(adapter.isWritable("/user/appointments/series.ics@1741615200")).isFalse();
        assertThat(adapter.isWritable("/user/appointments/team@example.org.ics")).isTrue();
    }

    @Test
    void moving_one_occurrence_of_a_series_writes_nothing() {
        server.respond("REPORT", "/tasks/", 207, multistatus("/tasks/gym.ics", """
                BEGIN:VCALENDAR
                VERSION:2.0
                BEGIN:VEVENT
                UID:gym
                DTSTART:20250304T120000Z
                DTEND:20250304T130000Z
                RRULE:FREQ=WEEKLY;COUNT=4
                SUMMARY:Gym session
                END:VEVENT
                END:VCALENDAR
                """));
        server.respond("REPORT", "/appointments/", 207, "<d:multistatus xmlns:d=\"DAV:\"/>");
        var executor = Executors.newCachedThreadPool();
        try {
            var normalizer = Fixtures.timeNormalizer();
            var sources = registry(adapter, appointments, tasks);
            var classifier = new EventClassifier(normalizer);
            var resolver = new MutationResolver(new EventAggregator(sources, classifier, executor,
                    Fixtures.properties()), classifier, sources, normalizer, Fixtures.properties());
            var tuesday = new TimeWindow(at("2025-03-11T00:00"), at("2025-03-12T00:00"));

            assertThatThrownBy(() -> resolver.apply(new MutationRequest("gym", tuesday,
                    new DesiredChange.MoveCalendar("appointments"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Gym session")
                    .hasMessageContaining("recurring series");
            assertThat(server.methods()).containsOnly("REPORT");
        } finally {
            executor.shutdownNow();
        }
    }

    private static String multistatus(String href, String calendarData) {
        return """
                <?xml version="1.0" encoding="utf-8"?>
                <d:multistatus xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
                  <d:response>
                    <d:href>%s</d:href>
                    <d:propstat>
                      <d:prop>
                        <d:getetag>"1"</d:getetag>
                        <c:calendar-data>%s</c:calendar-data>
                      </d:prop>
                      <d:status>HTTP/1.1 200 OK</d:status>
                    </d:propstat>
                  </d:response>
                </d:multistatus>
                """.formatted(href, calendarData);
    }
}
