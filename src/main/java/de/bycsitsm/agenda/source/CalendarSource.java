package de.bycsitsm.agenda.source;

/**
 * A configured calendar backing the unified view.
 *
 * @param id          the stable identifier used in event keys and requests
 * @param displayName the human-readable calendar name shown to the user
 * @param kind        what the calendar is used for
 * @param externalRef the backend reference of the calendar, e.g. the CalDAV collection URL
 */
public record CalendarSource(
        String id,
        String displayName,
        SourceKind kind,
        String externalRef
) {
}
