package de.bycsitsm.agenda.source;

/**
 * What a configured calendar is used for. {@link #GENERIC} marks a calendar
 * holding a mix of entries, whose events are classified by content.
 */
public enum SourceKind {
    APPOINTMENT,
    TASK,
    GENERIC
}
