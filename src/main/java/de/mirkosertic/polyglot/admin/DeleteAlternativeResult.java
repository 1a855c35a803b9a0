package de.mirkosertic.polyglot.admin;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of {@link AlternativeAdministration#deleteAlternative}.
 */
public record DeleteAlternativeResult(
        Outcome outcome,
        /** Mirrors removed during this call. */
        List<UUID> deletedMirrors,
        /** Mirrors that could not be removed, as {@code "name: error"}. The alternative is kept. */
        List<String> failedMirrors,
        /** Mirrors added concurrently, only for {@link Outcome#CONFLICT}. */
        List<UUID> unexpectedMirrorIds
) {

    public enum Outcome {
        DELETED,
        NOT_FOUND,
        MIRROR_DELETION_FAILED,
        CONFLICT,
        UNAVAILABLE
    }
}
