package de.mirkosertic.polyglot.mirror;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link MirrorService#deleteMirror}.
 */
public record DeleteMirrorResult(
        /** Whether the configuration entry is gone. False means a retry is possible. */
        boolean removedFromConfig,
        /** Set when removing the host library failed. */
        @Nullable String libraryDeletionError,
        /** Set when deleting the mirror directory failed. */
        @Nullable String fileDeletionError
) {

    public boolean hasErrors() {
        return libraryDeletionError != null || fileDeletionError != null;
    }
}
