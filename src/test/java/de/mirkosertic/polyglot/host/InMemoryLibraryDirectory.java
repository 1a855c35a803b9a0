package de.mirkosertic.polyglot.host;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Library directory double that keeps libraries in memory and can be told to fail.
 */
public class InMemoryLibraryDirectory implements LibraryDirectory {

    private final Map<String, VirtualLibrary> libraries = new ConcurrentHashMap<>();
    private final List<UUID> refreshed = new CopyOnWriteArrayList<>();
    private final Set<String> failingRemovals = ConcurrentHashMap.newKeySet();
    private volatile boolean failCreate;
    private volatile boolean failAddMediaPath;

    public VirtualLibrary addLibrary(final String name, final String collectionType, final String... paths) {
        final VirtualLibrary library = new VirtualLibrary(UUID.randomUUID(), name, collectionType,
                new ArrayList<>(List.of(paths)), new LibraryOptions());
        libraries.put(name, library);
        return library;
    }

    public VirtualLibrary addLibrary(final String name, final String collectionType, final LibraryOptions options,
                                     final String... paths) {
        final VirtualLibrary library = new VirtualLibrary(UUID.randomUUID(), name, collectionType,
                new ArrayList<>(List.of(paths)), options);
        libraries.put(name, library);
        return library;
    }

    public void removeExternally(final String name) {
        libraries.remove(name);
    }

    public VirtualLibrary byName(final String name) {
        return libraries.get(name);
    }

    public List<UUID> getRefreshed() {
        return refreshed;
    }

    public void setFailCreate(final boolean failCreate) {
        this.failCreate = failCreate;
    }

    public void setFailAddMediaPath(final boolean failAddMediaPath) {
        this.failAddMediaPath = failAddMediaPath;
    }

    public void failRemovalOf(final String name) {
        failingRemovals.add(name);
    }

    @Override
    public List<VirtualLibrary> getVirtualLibraries() {
        return new ArrayList<>(libraries.values());
    }

    @Override
    public VirtualLibrary createVirtualLibrary(final String name, final String collectionType,
                                               final LibraryOptions options) throws IOException {
        if (failCreate) {
            throw new IOException("Host refused to create library " + name);
        }
        if (libraries.containsKey(name)) {
            throw new IOException("Library " + name + " already exists");
        }
        final VirtualLibrary library = new VirtualLibrary(UUID.randomUUID(), name, collectionType,
                new ArrayList<>(), options.copy());
        libraries.put(name, library);
        return library;
    }

    @Override
    public void removeVirtualLibrary(final String name, final boolean refreshLibrary) throws IOException {
        if (failingRemovals.contains(name)) {
            throw new IOException("Library " + name + " is in use");
        }
        libraries.remove(name);
    }

    @Override
    public void addMediaPath(final String libraryName, final String path) throws IOException {
        if (failAddMediaPath) {
            throw new IOException("Cannot add path " + path);
        }
        final VirtualLibrary library = libraries.get(libraryName);
        if (library == null) {
            throw new IOException("No library " + libraryName);
        }
        library.locations().add(path);
    }

    @Override
    public void queueRefresh(final UUID libraryId) {
        refreshed.add(libraryId);
    }
}
