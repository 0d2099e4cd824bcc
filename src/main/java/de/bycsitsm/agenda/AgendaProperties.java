package de.bycsitsm.agenda;

import de.bycsitsm.agenda.source.SourceKind;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.util.List;

/**
 * Configuration properties for the scheduling core.
 *
 * @param timezone      the IANA id of the local civil timezone used for input and display
 * @param sourceTimeout the time each calendar gets to answer a list request
 * @param sources       the configured calendars, in registration order
 * @param availability  the bounds applied to free-time searches
 * @param briefing      the limits applied to composed briefings
 * @param search        the window searched when resolving an event reference
 * @param upcoming      the limits applied to the upcoming-events view
 */
@ConfigurationProperties(prefix = "agenda")
public record AgendaProperties(
        String timezone,
        Duration sourceTimeout,
        List<Source> sources,
        Availability availability,
        Briefing briefing,
        Search search,
        Upcoming upcoming
) {

    public AgendaProperties {
        if (timezone == null || timezone.isBlank()) {
            timezone = "America/Toronto";
        }
        if (sourceTimeout == null) {
            sourceTimeout = Duration.ofSeconds(10);
        }
        if (sources == null) {
            sources = List.of();
        }
        if (availability == null) {
            availability = new Availability(null, null);
        }
        if (briefing == null) {
            briefing = new Briefing(0, 0, 0);
        }
        if (search == null) {
            search = new Search(0);
        }
        if (upcoming == null) {
            upcoming = new Upcoming(0, 0);
        }
    }

    /**
     * A configured calendar.
     *
     * @param id          the stable identifier
     * @param displayName the name shown to the user; defaults to the id
     * @param kind        what the calendar is used for; defaults to {@link SourceKind#GENERIC}
     * @param url         the CalDAV collection URL
     */
    public record Source(String id, String displayName, SourceKind kind, String url) {

        public Source {
            if (displayName == null || displayName.isBlank()) {
                displayName = id;
            }
            if (kind == null) {
                kind = SourceKind.GENERIC;
            }
        }
    }

    /**
     * Daily bounds for free-time searches. {@code null} means the start or end of the day.
     */
    public record Availability(@Nullable LocalTime dayStart, @Nullable LocalTime dayEnd) {
    }

    public record Briefing(int characterBudget, int todayLimit, int tomorrowLimit) {

        public Briefing {
            if (characterBudget <= 0) {
                characterBudget = 1200;
            }
            if (todayLimit <= 0) {
                todayLimit = 10;
            }
            if (tomorrowLimit <= 0) {
                tomorrowLimit = 3;
            }
        }
    }

    public record Search(int windowDays) {

        public Search {
            if (windowDays <= 0) {
                windowDays = 14;
            }
        }
    }

    public record Upcoming(int maxDays, int perDayLimit) {

        public Upcoming {
            if (maxDays <= 0) {
                maxDays = 7;
            }
            if (perDayLimit <= 0) {
                perDayLimit = 6;
            }
        }
    }
}
