package de.bycsitsm.agenda.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open interval {@code [start, end)} of absolute instants.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow around(Instant center, Duration reach) {
        return new TimeWindow(center.minus(reach), center.plus(reach));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }
}
