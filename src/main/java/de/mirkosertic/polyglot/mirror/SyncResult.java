package de.mirkosertic.polyglot.mirror;

/**
 * Outcome of a single mirror sync.
 *
 * @param added           files hardlinked successfully
 * @param removed         files deleted from the mirror successfully
 * @param failed          per-file operations that failed and were skipped
 * @param sourceFileCount qualifying files in the source at sync time
 */
public record SyncResult(int added, int removed, int failed, int sourceFileCount) {
}
