package de.mirkosertic.polyglot.mirror;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Report of an orphan cleanup pass.
 */
public record OrphanCleanupResult(
        /** Human-readable entries like {@code "Filme (Deutsch) (source deleted)"}. */
        List<String> cleanedUpMirrors,
        /** Mirrors that should have been removed but could not be, with the reason. */
        List<String> failedCleanups,
        /** Source libraries that lost their last mirror and are visible as plain sources again. */
        Set<UUID> sourcesWithoutMirrors
) {

    public int totalCleaned() {
        return cleanedUpMirrors.size();
    }
}
