package de.bycsitsm.agenda;

/**
 * Thrown when no event matches a reference, or when a source reports that an
 * event no longer exists.
 */
public class EventNotFoundException extends AgendaException {

    public EventNotFoundException(String message) {
        super(message);
    }
}
