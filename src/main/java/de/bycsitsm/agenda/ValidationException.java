package de.bycsitsm.agenda;

/**
 * Thrown when a request or a mutation lacks required fields or carries values
 * of the wrong shape.
 */
public class ValidationException extends AgendaException {

    public ValidationException(String message) {
        super(message);
    }
}
