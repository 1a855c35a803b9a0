package de.mirkosertic.polyglot.mirror;

/**
 * Outcome of syncing every mirror of one alternative.
 */
public record SyncAllResult(Status status, int mirrorsSynced, int mirrorsFailed, int totalMirrors) {

    public enum Status {
        COMPLETED,
        COMPLETED_WITH_ERRORS,
        CANCELLED,
        ALTERNATIVE_NOT_FOUND
    }
}
