package de.bycsitsm.agenda.source;

import de.bycsitsm.agenda.ValidationException;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of the configured calendars and their adapters. The
 * registration order is significant: it breaks ties when events from different
 * calendars start at the same instant.
 */
public class SourceRegistry {

    private final List<RegisteredSource> sources;
    private final Map<String, Integer> order = new HashMap<>();

    public SourceRegistry(List<RegisteredSource> sources) {
        this.sources = List.copyOf(sources);
        for (int i = 0; i < this.sources.size(); i++) {
            var id = this.sources.get(i).source().id();
            if (order.putIfAbsent(id, i) != null) {
                throw new IllegalArgumentException("Calendar source id '" + id + "' is configured twice.");
            }
        }
    }

    public List<RegisteredSource> sources() {
        return sources;
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    /**
     * Returns the registration index of a source, or {@link Integer#MAX_VALUE} for unknown ids.
     */
    public int orderOf(String sourceId) {
        return order.getOrDefault(sourceId, Integer.MAX_VALUE);
    }

    public Optional<RegisteredSource> find(String sourceId) {
        var index = order.get(sourceId);
        return index == null ? Optional.empty() : Optional.of(sources.get(index));
    }

    /**
     * Returns the source with the given id.
     *
     * @throws ValidationException if no such source is configured
     */
    public RegisteredSource require(String sourceId) {
        return find(sourceId).orElseThrow(() -> new ValidationException(
                "Calendar '" + sourceId + "' is not configured. Available: " + describeAvailable() + "."));
    }

    public Optional<RegisteredSource> firstOfKind(SourceKind kind) {
        return sources.stream()
                .filter(registered -> registered.source().kind() == kind)
                .findFirst();
    }

    /**
     * Resolves a loose calendar reference such as {@code "tasks"}, {@code "Tasks calendar"}
     * or a configured id. Tries the exact id, the exact display name, the calendar kind
     * and finally a display name substring, in that order.
     */
    public Optional<RegisteredSource> resolve(@Nullable String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        var hint = reference.strip().toLowerCase(Locale.ROOT);

        for (var registered : sources) {
            if (registered.source().id().equalsIgnoreCase(hint)) {
                return Optional.of(registered);
            }
        }
        for (var registered : sources) {
            if (registered.source().displayName().equalsIgnoreCase(hint)) {
                return Optional.of(registered);
            }
        }

        var byKind = kindOf(hint).flatMap(this::firstOfKind);
        if (byKind.isPresent()) {
            return byKind;
        }

        var stripped = hint.replaceAll("\\s*calendar$", "");
        return sources.stream()
                .filter(registered -> {
                    var name = registered.source().displayName().toLowerCase(Locale.ROOT);
                    return !stripped.isEmpty() && (name.contains(stripped) || stripped.contains(name));
                })
                .findFirst();
    }

    public String describeAvailable() {
        var names = sources.stream()
                .map(registered -> registered.source().displayName() + " (" + registered.source().id() + ")")
                .toList();
        return names.isEmpty() ? "none" : String.join(", ", names);
    }

    private static Optional<SourceKind> kindOf(String hint) {
        if (hint.contains("task") || hint.contains("to-do") || hint.contains("todo")) {
            return Optional.of(SourceKind.TASK);
        }
        if (hint.contains("appointment") || hint.equals("calendar") || hint.startsWith("main")
                || hint.startsWith("primary")) {
            return Optional.of(SourceKind.APPOINTMENT);
        }
        return Optional.empty();
    }
}
