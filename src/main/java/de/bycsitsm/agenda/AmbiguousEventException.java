package de.bycsitsm.agenda;

import de.bycsitsm.agenda.source.CanonicalEvent;

import java.util.List;

/**
 * Thrown when a reference matches more than one event. The candidates are
 * ranked best match first so the caller can ask the user to pick one.
 */
public class AmbiguousEventException extends AgendaException {

    private final String searchText;
    private final List<CanonicalEvent> candidates;

    public AmbiguousEventException(String searchText, List<CanonicalEvent> candidates) {
        super(buildMessage(searchText, candidates));
        this.searchText = searchText;
        this.candidates = List.copyOf(candidates);
    }

    public String getSearchText() {
        return searchText;
    }

    public List<CanonicalEvent> getCandidates() {
        return candidates;
    }

    private static String buildMessage(String searchText, List<CanonicalEvent> candidates) {
        var titles = candidates.stream()
                .map(event -> "'" + event.title() + "'")
                .toList();
        return "'" + searchText + "' matches " + candidates.size() + " events: "
                + String.join(", ", titles) + ". Please be more specific.";
    }
}
