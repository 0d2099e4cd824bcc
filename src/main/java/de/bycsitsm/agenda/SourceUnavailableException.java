package de.bycsitsm.agenda;

/**
 * Thrown when a calendar source cannot be reached, rejects the credentials or
 * does not answer in time.
 */
public class SourceUnavailableException extends AgendaException {

    private final String sourceId;

    public SourceUnavailableException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public SourceUnavailableException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
