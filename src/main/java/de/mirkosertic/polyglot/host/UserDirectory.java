package de.mirkosertic.polyglot.host;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The media host's user registry.
 */
public interface UserDirectory {

    Optional<HostUser> getUser(UUID userId);

    List<HostUser> getUsers();

    void updateLibraryAccess(UUID userId, boolean enableAllFolders, Set<UUID> enabledFolderIds) throws IOException;
}
