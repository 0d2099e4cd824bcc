package de.bycsitsm.agenda.source;

/**
 * Semantic kind of a single event.
 */
public enum EventKind {
    APPOINTMENT,
    TASK,
    OTHER
}
