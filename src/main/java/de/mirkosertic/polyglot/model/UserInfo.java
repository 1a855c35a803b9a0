package de.mirkosertic.polyglot.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * Host user joined with its language assignment, if any.
 */
public record UserInfo(
        UUID id,
        String username,
        boolean administrator,
        boolean pluginManaged,
        @Nullable UUID assignedAlternativeId,
        @Nullable String assignedAlternativeName,
        boolean manuallySet,
        @Nullable String setBy,
        @Nullable Instant setAt
) {
}
