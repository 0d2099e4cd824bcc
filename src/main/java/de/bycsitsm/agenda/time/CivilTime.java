package de.bycsitsm.agenda.time;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A parsed local civil time. Date-only inputs have no time of day and mean the
 * whole day; they are never combined with a time of day implicitly.
 *
 * @param date the local date
 * @param time the local time of day, or {@code null} for date-only input
 */
public record CivilTime(LocalDate date, @Nullable LocalTime time) {

    public boolean isDateOnly() {
        return time == null;
    }
}
