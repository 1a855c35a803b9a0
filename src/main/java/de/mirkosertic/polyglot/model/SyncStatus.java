package de.mirkosertic.polyglot.model;

/**
 * Synchronization state of a {@link LibraryMirror}.
 * <p>
 * A mirror starts in {@link #PENDING}; every create or sync run moves it to {@link #SYNCING}
 * and then to {@link #SYNCED} or {@link #ERROR}. There is no terminal state.
 */
public enum SyncStatus {
    PENDING,
    SYNCING,
    SYNCED,
    ERROR
}
