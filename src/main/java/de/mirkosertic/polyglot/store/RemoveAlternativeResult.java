package de.mirkosertic.polyglot.store;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of {@link ConfigurationStore#tryRemoveAlternativeAtomic(UUID, java.util.Set)}.
 */
public record RemoveAlternativeResult(
        /** What happened */
        Outcome outcome,
        /** Mirror ids found in the alternative that the caller did not expect, only for NEW_MIRRORS_ADDED */
        List<UUID> unexpectedMirrorIds
) {

    public enum Outcome {
        SUCCEEDED,
        NOT_FOUND,
        UNAVAILABLE,
        NEW_MIRRORS_ADDED
    }

    public static RemoveAlternativeResult succeeded() {
        return new RemoveAlternativeResult(Outcome.SUCCEEDED, List.of());
    }

    public static RemoveAlternativeResult notFound() {
        return new RemoveAlternativeResult(Outcome.NOT_FOUND, List.of());
    }

    public static RemoveAlternativeResult unavailable() {
        return new RemoveAlternativeResult(Outcome.UNAVAILABLE, List.of());
    }

    public static RemoveAlternativeResult newMirrorsAdded(final List<UUID> unexpectedMirrorIds) {
        return new RemoveAlternativeResult(Outcome.NEW_MIRRORS_ADDED, List.copyOf(unexpectedMirrorIds));
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }
}
