package de.bycsitsm.agenda.mutation;

import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;

/**
 * A change to apply to the event a loose reference points to.
 *
 * @param searchText text matched against event titles; ignored for {@link DesiredChange.Create}
 * @param windowHint the window to search in, or {@code null} for the configured default around now
 * @param change     the change to apply
 */
public record MutationRequest(@Nullable String searchText, @Nullable TimeWindow windowHint, DesiredChange change) {

    public static MutationRequest create(DesiredChange.Create create) {
        return new MutationRequest(null, null, create);
    }
}
