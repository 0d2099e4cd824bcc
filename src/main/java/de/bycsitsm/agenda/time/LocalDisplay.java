package de.bycsitsm.agenda.time;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * An instant rendered in the configured local timezone.
 *
 * @param date        the local date
 * @param time        the local time of day
 * @param civilOffset the offset in effect at that instant
 */
public record LocalDisplay(LocalDate date, LocalTime time, ZoneOffset civilOffset) {

    private static final DateTimeFormatter TIME_24H = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter TIME_24H_SECONDS = DateTimeFormatter.ofPattern("HH:mm:ss");

    public String dateText() {
        return date.toString();
    }

    public String timeText() {
        return time.format(TIME_24H);
    }

    /**
     * Formats as {@code YYYY-MM-DDTHH:MM}, with seconds only when they are not zero.
     */
    public String toCivilString() {
        var pattern = time.getSecond() == 0 ? TIME_24H : TIME_24H_SECONDS;
        return dateText() + "T" + time.format(pattern);
    }
}
