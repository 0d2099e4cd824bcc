package de.bycsitsm.agenda;

import org.jspecify.annotations.Nullable;

/**
 * Base exception for all failures surfaced by the scheduling core. Each subclass
 * corresponds to one user-visible failure kind, and its message names the
 * reference that could not be handled.
 */
public class AgendaException extends RuntimeException {

    public AgendaException(String message) {
        super(message);
    }

    public AgendaException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
