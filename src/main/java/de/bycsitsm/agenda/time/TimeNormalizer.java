package de.bycsitsm.agenda.time;

import de.bycsitsm.agenda.InvalidTimeFormatException;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Single owner of all conversions between local civil time and absolute instants.
 * The configured timezone is the zone of the injected {@link Clock}.
 * <p>
 * Accepted inputs are {@code YYYY-MM-DD}, {@code YYYY-MM-DDTHH:MM} and
 * {@code YYYY-MM-DDTHH:MM:SS}; an explicit UTC offset is honored as an absolute
 * time. Local times that fall into a daylight-saving gap are rejected rather than
 * silently shifted.
 */
@Component
public class TimeNormalizer {

    private static final Pattern EXPLICIT_OFFSET = Pattern.compile(".*T.*(Z|[+-]\\d{2}:\\d{2})$");

    private final Clock clock;

    public TimeNormalizer(Clock clock) {
        this.clock = clock;
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Parses a local civil time string.
     *
     * @throws InvalidTimeFormatException if the value is empty or not in a supported format
     */
    public CivilTime parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTimeFormatException("Time value must not be empty.");
        }
        var text = value.strip();
        if (!text.contains("T")) {
            try {
                return new CivilTime(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE), null);
            } catch (DateTimeParseException e) {
                throw new InvalidTimeFormatException("'" + value + "' is not a valid date (expected YYYY-MM-DD).", e);
            }
        }
        try {
            if (EXPLICIT_OFFSET.matcher(text).matches()) {
                var zoned = OffsetDateTime.parse(text).atZoneSameInstant(zone());
                return new CivilTime(zoned.toLocalDate(), zoned.toLocalTime());
            }
            var local = LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            return new CivilTime(local.toLocalDate(), local.toLocalTime());
        } catch (DateTimeParseException e) {
            throw new InvalidTimeFormatException(
                    "'" + value + "' is not a valid date-time (expected YYYY-MM-DDTHH:MM[:SS]).", e);
        }
    }

    /**
     * Converts a local civil time string to an instant. Date-only input, and any
     * input when {@code assumeDateOnly} is set, resolves to the start of the local day.
     *
     * @throws InvalidTimeFormatException if the value cannot be parsed or does not exist locally
     */
    public Instant toInstant(String value, boolean assumeDateOnly) {
        var civil = parse(value);
        if (civil.isDateOnly() || assumeDateOnly) {
            return startOfDay(civil.date());
        }
        return toInstant(civil.date().atTime(civil.time()));
    }

    /**
     * Converts a local date-time to an instant. In an overlap the earlier offset wins.
     *
     * @throws InvalidTimeFormatException if the local time is skipped by a daylight-saving transition
     */
    public Instant toInstant(LocalDateTime local) {
        if (zone().getRules().getValidOffsets(local).isEmpty()) {
            throw new InvalidTimeFormatException(
                    "'" + local + "' does not exist in " + zone().getId() + " (daylight-saving gap).");
        }
        return ZonedDateTime.ofLocal(local, zone(), null).toInstant();
    }

    public Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(zone()).toInstant();
    }

    /**
     * The local day as a window. It is 23 or 25 hours long on transition days.
     */
    public TimeWindow dayWindow(LocalDate date) {
        return new TimeWindow(startOfDay(date), startOfDay(date.plusDays(1)));
    }

    public TimeWindow daysWindow(LocalDate firstDay, int days) {
        return new TimeWindow(startOfDay(firstDay), startOfDay(firstDay.plusDays(days)));
    }

    /**
     * Projects a pair of local times of day onto a date. A {@code null} bound means
     * the start or the end of the day.
     */
    public TimeWindow boundedDayWindow(LocalDate date, @Nullable LocalTime from, @Nullable LocalTime until) {
        var day = dayWindow(date);
        var start = from == null ? day.start() : ZonedDateTime.of(date, from, zone()).toInstant();
        var end = until == null ? day.end() : ZonedDateTime.of(date, until, zone()).toInstant();
        if (end.isBefore(start)) {
            end = start;
        }
        return new TimeWindow(start, end);
    }

    public LocalDisplay toLocalDisplay(Instant instant) {
        var zoned = instant.atZone(zone());
        return new LocalDisplay(zoned.toLocalDate(), zoned.toLocalTime(), zoned.getOffset());
    }

    public LocalDate localDate(Instant instant) {
        return instant.atZone(zone()).toLocalDate();
    }

    public LocalTime localTime(Instant instant) {
        return instant.atZone(zone()).toLocalTime();
    }

    /**
     * Computes the end of an event moved to {@code newStart} so that it keeps the
     * wall-clock duration of {@code [oldStart, oldEnd)}. Across a daylight-saving
     * transition this differs from the absolute duration.
     */
    public Instant endPreservingWallClock(Instant oldStart, Instant oldEnd, Instant newStart) {
        var localDuration = Duration.between(
                LocalDateTime.ofInstant(oldStart, zone()),
                LocalDateTime.ofInstant(oldEnd, zone()));
        if (localDuration.isNegative()) {
            localDuration = Duration.between(oldStart, oldEnd);
        }
        var newLocalEnd = LocalDateTime.ofInstant(newStart, zone()).plus(localDuration);
        return ZonedDateTime.ofLocal(newLocalEnd, zone(), null).toInstant();
    }

    /**
     * Moves an instant to another local date, keeping its local time of day.
     */
    public Instant onDate(Instant original, LocalDate date) {
        return toInstant(date.atTime(localTime(original)));
    }
}
