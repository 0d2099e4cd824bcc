package de.bycsitsm.agenda.mutation;

public enum MutationAction {
    CREATED,
    UPDATED,
    RESCHEDULED,
    MOVED,
    DELETED,
    UNCHANGED
}
