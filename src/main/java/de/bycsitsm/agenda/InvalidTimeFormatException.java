package de.bycsitsm.agenda;

/**
 * Thrown when a local civil time string cannot be parsed or does not exist
 * in the configured timezone.
 */
public class InvalidTimeFormatException extends AgendaException {

    public InvalidTimeFormatException(String message) {
        super(message);
    }

    public InvalidTimeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
