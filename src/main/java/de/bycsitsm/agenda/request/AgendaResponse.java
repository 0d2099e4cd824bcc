package de.bycsitsm.agenda.request;

import de.bycsitsm.agenda.mutation.MutationConfirmation;
import org.jspecify.annotations.Nullable;

/**
 * Result of a handled request: rendered text for reads, and additionally the
 * structured confirmation for mutations.
 */
public record AgendaResponse(String text, @Nullable MutationConfirmation confirmation) {

    public static AgendaResponse text(String text) {
        return new AgendaResponse(text, null);
    }

    public static AgendaResponse confirmed(MutationConfirmation confirmation, String text) {
        return new AgendaResponse(text, confirmation);
    }
}
