package de.mirkosertic.polyglot.host;

import java.util.Set;
import java.util.UUID;

/**
 * A user account of the media host together with its library access policy.
 */
public record HostUser(
        UUID id,
        String username,
        boolean administrator,
        /** When set the user sees every library and {@link #enabledFolders()} is ignored by the host. */
        boolean enableAllFolders,
        Set<UUID> enabledFolders
) {
}
