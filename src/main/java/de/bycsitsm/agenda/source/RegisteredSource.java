package de.bycsitsm.agenda.source;

/**
 * A configured calendar together with the adapter that talks to its backend.
 *
 * @param source  the calendar
 * @param adapter the adapter owning all I/O for the calendar
 */
public record RegisteredSource(CalendarSource source, SourceAdapter adapter) {
}
