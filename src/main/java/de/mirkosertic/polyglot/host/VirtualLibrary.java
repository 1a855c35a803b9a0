package de.mirkosertic.polyglot.host;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.UUID;

/**
 * A library as registered with the media host.
 *
 * @param id             host item id of the library
 * @param name           display name, unique within the host
 * @param collectionType e.g. {@code movies} or {@code tvshows}; may be absent for mixed libraries
 * @param locations      root directories of the library
 * @param options        library settings, never shared with the host's own instance
 */
public record VirtualLibrary(
        UUID id,
        String name,
        @Nullable String collectionType,
        List<String> locations,
        LibraryOptions options
) {
}
