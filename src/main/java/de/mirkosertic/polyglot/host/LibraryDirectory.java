package de.mirkosertic.polyglot.host;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * The media host's library registry.
 */
public interface LibraryDirectory {

    List<VirtualLibrary> getVirtualLibraries();

    /**
     * Register a new library without any paths.
     */
    VirtualLibrary createVirtualLibrary(String name, String collectionType, LibraryOptions options) throws IOException;

    void removeVirtualLibrary(String name, boolean refreshLibrary) throws IOException;

    void addMediaPath(String libraryName, String path) throws IOException;

    /**
     * Schedule a metadata scan of the library. Returns immediately.
     */
    void queueRefresh(UUID libraryId) throws IOException;
}
