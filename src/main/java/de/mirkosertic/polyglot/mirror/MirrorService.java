package de.mirkosertic.polyglot.mirror;

import de.mirkosertic.polyglot.ErrorKind;
import de.mirkosertic.polyglot.PolyglotException;
import de.mirkosertic.polyglot.host.LibraryDirectory;
import de.mirkosertic.polyglot.host.LibraryOptions;
import de.mirkosertic.polyglot.host.VirtualLibrary;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryInfo;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.SyncStatus;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import de.mirkosertic.polyglot.store.MirrorLocation;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Creates, synchronizes and deletes mirrors.
 * <p>
 * A mirror is a directory tree of hardlinks to the qualifying files of a source library plus a
 * host library registered on that tree. Create, sync and delete of the same mirror are mutually
 * exclusive and hold the mirror's lock for their whole duration, including all file I/O.
 * Different mirrors are processed fully in parallel.
 * <p>
 * All state lives in the {@link ConfigurationStore}; this service only ever works on copies and
 * writes status changes back through {@link ConfigurationStore#updateMirror}.
 */
public class MirrorService {

    private static final Logger logger = LoggerFactory.getLogger(MirrorService.class);

    private final ConfigurationStore store;
    private final LibraryDirectory libraryDirectory;
    private final MirrorLockRegistry locks;

    public MirrorService(final ConfigurationStore store,
                         final LibraryDirectory libraryDirectory,
                         final MirrorLockRegistry locks) {
        this.store = store;
        this.libraryDirectory = libraryDirectory;
        this.locks = locks;
    }

    // ==================== Create ====================

    /**
     * Build the mirror's hardlink tree and register its host library.
     * <p>
     * On failure everything this call created is rolled back: a directory it created is deleted,
     * in a directory that existed empty only the files it placed are deleted, a non-empty
     * directory that existed before is left alone, and a library it registered is removed.
     * The mirror is then marked {@link SyncStatus#ERROR} and the original error is rethrown.
     *
     * @return number of files hardlinked
     */
    public int createMirror(final UUID alternativeId, final UUID mirrorId, final CancellationToken cancellation)
            throws PolyglotException {
        final ReentrantLock lock = acquire(mirrorId);
        try {
            final MirrorLocation location = store.getMirrorWithAlternative(mirrorId)
                    .filter(l -> l.alternative().getId().equals(alternativeId))
                    .orElseThrow(() -> PolyglotException.notFound(
                            "Mirror " + mirrorId + " not found in alternative " + alternativeId));
            final LibraryMirror mirror = location.mirror();
            final LanguageAlternative alternative = location.alternative();

            logger.info("Creating mirror {} of '{}' for alternative '{}' at {}",
                    mirrorId, mirror.getSourceLibraryName(), alternative.getName(), mirror.getTargetPath());
            store.updateMirror(mirrorId, m -> m.setStatus(SyncStatus.SYNCING));

            final CreateState state = new CreateState(Paths.get(mirror.getTargetPath()));
            try {
                final VirtualLibrary source = findLibrary(mirror.getSourceLibraryId())
                        .orElseThrow(() -> PolyglotException.notFound(
                                "Source library " + mirror.getSourceLibraryId() + " not found"));
                final List<Path> sourceRoots = sourceRoots(source);

                checkSameVolume(sourceRoots, state.target);
                prepareTargetDirectory(state);

                final Map<String, ScannedFile> sourceFiles = FileSystemHelper.scan(
                        sourceRoots, FileClassifier.fromStore(store), cancellation);
                int linked = 0;
                for (final Map.Entry<String, ScannedFile> entry : sourceFiles.entrySet()) {
                    cancellation.throwIfCancelled();
                    final Path targetFile = state.target.resolve(entry.getKey());
                    try {
                        FileSystemHelper.createHardLink(entry.getValue().path(), targetFile);
                        state.createdFiles.add(targetFile);
                        linked++;
                    } catch (final IOException e) {
                        logger.warn("Failed to create hardlink for {}", entry.getKey(), e);
                    }
                }
                logger.info("Hardlinked {} of {} files into {}", linked, sourceFiles.size(), state.target);

                if (mirror.getTargetLibraryId() == null) {
                    registerLibrary(alternative, mirror, source, state);
                }

                final int fileCount = linked;
                final boolean recorded = store.updateMirror(mirrorId, m -> {
                    m.setStatus(SyncStatus.SYNCED);
                    m.setLastSyncedAt(Instant.now());
                    m.setLastSyncFileCount(fileCount);
                    m.setLastError(null);
                });
                if (!recorded) {
                    throw new IOException("Could not record completion of mirror " + mirrorId);
                }
                logger.info("Mirror {} created with {} files", mirrorId, fileCount);
                return fileCount;
            } catch (final PolyglotException e) {
                failCreate(mirror, state, e.getMessage(), e);
                throw e;
            } catch (final CancellationException e) {
                failCreate(mirror, state, "Creation cancelled", e);
                throw e;
            } catch (final IOException | RuntimeException e) {
                failCreate(mirror, state, e.getMessage(), e);
                throw PolyglotException.fatal("Failed to create mirror " + mirror.getTargetLibraryName()
                        + ": " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    private void checkSameVolume(final List<Path> sourceRoots, final Path target) throws PolyglotException, IOException {
        for (final Path sourceRoot : sourceRoots) {
            if (!FileSystemHelper.isSameVolume(sourceRoot, target)) {
                throw new PolyglotException(ErrorKind.FATAL, "Source path " + sourceRoot + " and target path "
                        + target + " are on different filesystems, hardlinks are not possible");
            }
        }
    }

    private void prepareTargetDirectory(final CreateState state) throws IOException {
        state.preExisted = Files.isDirectory(state.target);
        state.wasEmpty = !state.preExisted || FileSystemHelper.isDirectoryEmpty(state.target);
        if (!state.preExisted) {
            Files.createDirectories(state.target);
            logger.debug("Created target directory {}", state.target);
        }
    }

    private void registerLibrary(final LanguageAlternative alternative,
                                 final LibraryMirror mirror,
                                 final VirtualLibrary source,
                                 final CreateState state) throws IOException {
        final LibraryOptions options = source.options().copy();
        options.setPreferredMetadataLanguage(alternative.getMetadataLanguage());
        options.setMetadataCountryCode(alternative.getMetadataCountry());
        // Sidecar files would be written next to shared inodes and leak into the source.
        options.setSaveLocalMetadata(false);
        options.setSaveSubtitlesWithMedia(false);
        options.setSaveLyricsWithMedia(false);
        options.setEnableRealtimeMonitor(true);
        options.setEnabled(true);
        options.setEnableInternetProviders(true);

        final String collectionType = mirror.getCollectionType() != null
                ? mirror.getCollectionType()
                : source.collectionType();
        final VirtualLibrary created = libraryDirectory.createVirtualLibrary(
                mirror.getTargetLibraryName(), collectionType, options);
        state.registeredLibraryName = mirror.getTargetLibraryName();
        libraryDirectory.addMediaPath(mirror.getTargetLibraryName(), state.target.toString());

        if (!store.updateMirror(mirror.getId(), m -> m.setTargetLibraryId(created.id()))) {
            throw new IOException("Could not record library " + created.id() + " for mirror " + mirror.getId());
        }
        logger.info("Registered library '{}' ({}) with language {}-{}", created.name(), created.id(),
                alternative.getMetadataLanguage(), alternative.getMetadataCountry());

        try {
            libraryDirectory.queueRefresh(created.id());
        } catch (final IOException | RuntimeException e) {
            logger.warn("Failed to queue refresh for library '{}'", created.name(), e);
        }
    }

    private void failCreate(final LibraryMirror mirror, final CreateState state, final @Nullable String message,
                            final Exception cause) {
        logger.error("Failed to create mirror {} ({})", mirror.getId(), mirror.getTargetLibraryName(), cause);
        rollback(mirror, state);
        store.updateMirror(mirror.getId(), m -> {
            m.setStatus(SyncStatus.ERROR);
            m.setLastError(message);
            if (state.registeredLibraryName != null) {
                m.setTargetLibraryId(null);
            }
        });
    }

    private void rollback(final LibraryMirror mirror, final CreateState state) {
        if (state.registeredLibraryName != null) {
            try {
                libraryDirectory.removeVirtualLibrary(state.registeredLibraryName, false);
                logger.info("Rollback: removed library '{}'", state.registeredLibraryName);
            } catch (final IOException | RuntimeException e) {
                logger.error("Rollback: failed to remove library '{}'", state.registeredLibraryName, e);
            }
        }

        if (state.preExisted == null) {
            return;
        }
        if (!state.preExisted) {
            try {
                FileSystemHelper.deleteRecursively(state.target);
                logger.info("Rollback: deleted directory {}", state.target);
            } catch (final IOException e) {
                logger.error("Rollback: failed to delete directory {}", state.target, e);
            }
        } else if (state.wasEmpty) {
            for (final Path file : state.createdFiles) {
                try {
                    Files.deleteIfExists(file);
                    final Path parent = file.getParent();
                    if (parent != null) {
                        FileSystemHelper.pruneEmptyDirectories(parent, state.target);
                    }
                } catch (final IOException e) {
                    logger.error("Rollback: failed to delete {}", file, e);
                }
            }
            logger.info("Rollback: removed {} files from pre-existing directory {}",
                    state.createdFiles.size(), state.target);
        } else {
            logger.warn("Rollback: leaving pre-existing non-empty directory {} of mirror {} untouched",
                    state.target, mirror.getId());
        }
    }

    /**
     * What a create call has done so far, for rollback.
     */
    private static final class CreateState {
        private final Path target;
        private final List<Path> createdFiles = new ArrayList<>();
        private @Nullable Boolean preExisted;
        private boolean wasEmpty;
        private @Nullable String registeredLibraryName;

        private CreateState(final Path target) {
            this.target = target;
        }
    }

    // ==================== Sync ====================

    /**
     * Bring the mirror tree in line with its source: link new files, relink changed ones and
     * delete files whose source is gone. Per-file failures are logged and counted but do not
     * abort the run.
     */
    public SyncResult syncMirror(final UUID mirrorId,
                                 final @Nullable ProgressListener progress,
                                 final CancellationToken cancellation) throws PolyglotException {
        final ReentrantLock lock = acquire(mirrorId);
        try {
            final LibraryMirror mirror = store.getMirror(mirrorId)
                    .orElseThrow(() -> PolyglotException.notFound("Mirror " + mirrorId + " not found"));
            logger.info("Syncing mirror {} ({})", mirrorId, mirror.getSourceLibraryName());
            store.updateMirror(mirrorId, m -> m.setStatus(SyncStatus.SYNCING));

            try {
                final SyncResult result = doSync(mirror, progress, cancellation);
                store.updateMirror(mirrorId, m -> {
                    m.setStatus(SyncStatus.SYNCED);
                    m.setLastSyncedAt(Instant.now());
                    m.setLastSyncFileCount(result.sourceFileCount());
                    m.setLastError(null);
                });
                logger.info("Mirror sync completed: {} added, {} removed, {} failed",
                        result.added(), result.removed(), result.failed());
                return result;
            } catch (final PolyglotException e) {
                failSync(mirrorId, e.getMessage(), e);
                throw e;
            } catch (final CancellationException e) {
                failSync(mirrorId, "Sync cancelled", e);
                throw e;
            } catch (final IOException | RuntimeException e) {
                failSync(mirrorId, e.getMessage(), e);
                throw PolyglotException.fatal("Failed to sync mirror " + mirror.getTargetLibraryName()
                        + ": " + e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    private SyncResult doSync(final LibraryMirror mirror,
                              final @Nullable ProgressListener progress,
                              final CancellationToken cancellation) throws PolyglotException, IOException {
        final VirtualLibrary source = findLibrary(mirror.getSourceLibraryId())
                .orElseThrow(() -> PolyglotException.notFound(
                        "Source library " + mirror.getSourceLibraryId() + " not found"));
        final List<Path> sourceRoots = sourceRoots(source);

        final Path target = Paths.get(mirror.getTargetPath());
        if (!Files.isDirectory(target)) {
            logger.warn("Mirror directory {} is missing, recreating it", target);
            Files.createDirectories(target);
        }

        final FileClassifier classifier = FileClassifier.fromStore(store);
        final Map<String, ScannedFile> sourceFiles = FileSystemHelper.scan(sourceRoots, classifier, cancellation);
        final Map<String, ScannedFile> targetFiles = FileSystemHelper.scan(List.of(target), classifier, cancellation);
        final SyncPlan plan = SyncPlan.compute(signatures(sourceFiles), signatures(targetFiles));
        logger.debug("Sync plan for {}: remove={}, add={}, unchanged={}", mirror.getId(),
                plan.toRemove().size(), plan.toAdd().size(), plan.unchangedCount());

        final int total = plan.totalOperations();
        int completed = 0;
        int removed = 0;
        int added = 0;
        int failed = 0;

        for (final String relativePath : plan.toRemove()) {
            cancellation.throwIfCancelled();
            final Path targetFile = target.resolve(relativePath);
            try {
                Files.deleteIfExists(targetFile);
                removed++;
                final Path parent = targetFile.getParent();
                if (parent != null) {
                    FileSystemHelper.pruneEmptyDirectories(parent, target);
                }
            } catch (final IOException e) {
                logger.warn("Failed to delete file {}", targetFile, e);
                failed++;
            }
            reportProgress(progress, ++completed, total);
        }

        for (final String relativePath : plan.toAdd()) {
            cancellation.throwIfCancelled();
            final Path sourceFile = locateSourceFile(sourceRoots, relativePath);
            if (sourceFile == null) {
                logger.warn("Source file {} vanished during sync", relativePath);
                failed++;
            } else {
                try {
                    FileSystemHelper.createHardLink(sourceFile, target.resolve(relativePath));
                    added++;
                } catch (final IOException e) {
                    logger.warn("Failed to create hardlink for {}", relativePath, e);
                    failed++;
                }
            }
            reportProgress(progress, ++completed, total);
        }

        return new SyncResult(added, removed, failed, sourceFiles.size());
    }

    private static @Nullable Path locateSourceFile(final List<Path> sourceRoots, final String relativePath) {
        for (final Path root : sourceRoots) {
            final Path candidate = root.resolve(relativePath);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static Map<String, FileSignature> signatures(final Map<String, ScannedFile> files) {
        final Map<String, FileSignature> result = new HashMap<>();
        for (final Map.Entry<String, ScannedFile> entry : files.entrySet()) {
            result.put(entry.getKey(), entry.getValue().signature());
        }
        return result;
    }

    private static void reportProgress(final @Nullable ProgressListener progress, final int completed, final int total) {
        if (progress == null || total == 0) {
            return;
        }
        try {
            progress.onProgress((double) completed / total * 100);
        } catch (final RuntimeException e) {
            logger.debug("Progress listener failed", e);
        }
    }

    private void failSync(final UUID mirrorId, final @Nullable String message, final Exception cause) {
        logger.error("Failed to sync mirror {}", mirrorId, cause);
        store.updateMirror(mirrorId, m -> {
            m.setStatus(SyncStatus.ERROR);
            m.setLastError(message);
        });
    }

    /**
     * Sync every mirror of an alternative, one after the other. Cancellation is honoured between
     * mirrors; a mirror already in progress finishes its own error handling first.
     */
    public SyncAllResult syncAllMirrors(final UUID alternativeId,
                                        final @Nullable ProgressListener progress,
                                        final CancellationToken cancellation) {
        final Optional<LanguageAlternative> alternative = store.getAlternative(alternativeId);
        if (alternative.isEmpty()) {
            return new SyncAllResult(SyncAllResult.Status.ALTERNATIVE_NOT_FOUND, 0, 0, 0);
        }

        final List<LibraryMirror> mirrors = alternative.get().getMirroredLibraries();
        final int total = mirrors.size();
        int synced = 0;
        int failed = 0;

        for (int i = 0; i < total; i++) {
            if (cancellation.isCancelled()) {
                logger.info("Sync of alternative '{}' cancelled after {} of {} mirrors",
                        alternative.get().getName(), i, total);
                return new SyncAllResult(SyncAllResult.Status.CANCELLED, synced, failed, total);
            }
            final int index = i;
            final ProgressListener mirrorProgress = progress == null
                    ? null
                    : p -> progress.onProgress((index + p / 100.0) / total * 100);
            try {
                syncMirror(mirrors.get(i).getId(), mirrorProgress, cancellation);
                synced++;
            } catch (final CancellationException e) {
                return new SyncAllResult(SyncAllResult.Status.CANCELLED, synced, failed + 1, total);
            } catch (final PolyglotException e) {
                logger.error("Failed to sync mirror {} of alternative '{}': {}", mirrors.get(i).getId(),
                        alternative.get().getName(), e.getMessage());
                failed++;
            }
            reportProgress(progress, i + 1, total);
        }

        return new SyncAllResult(failed == 0 ? SyncAllResult.Status.COMPLETED : SyncAllResult.Status.COMPLETED_WITH_ERRORS,
                synced, failed, total);
    }

    // ==================== Delete ====================

    /**
     * Delete a mirror's host library and/or directory and then its configuration entry.
     * <p>
     * Without {@code force} any error keeps the configuration entry so the deletion can be retried.
     * With {@code force} the entry is removed regardless and the errors are only reported.
     */
    public DeleteMirrorResult deleteMirror(final UUID mirrorId,
                                           final boolean deleteLibrary,
                                           final boolean deleteFiles,
                                           final boolean force) throws PolyglotException {
        final ReentrantLock lock = acquire(mirrorId);
        boolean removed = false;
        try {
            final LibraryMirror mirror = store.getMirror(mirrorId)
                    .orElseThrow(() -> PolyglotException.notFound("Mirror " + mirrorId + " not found"));
            final DeleteMirrorResult result = deleteLocked(mirror, deleteLibrary, deleteFiles, force);
            removed = result.removedFromConfig();
            return result;
        } finally {
            lock.unlock();
            if (removed) {
                locks.evict(mirrorId);
            }
        }
    }

    /**
     * Like {@link #deleteMirror}, but only if the mirror still satisfies {@code condition} once its
     * lock is held. The condition is tested against a copy read after the lock was acquired, so a
     * create or sync that finished in the meantime is seen.
     *
     * @return empty when the mirror is gone or no longer satisfies the condition
     */
    public Optional<DeleteMirrorResult> deleteMirrorIf(final UUID mirrorId,
                                                       final Predicate<LibraryMirror> condition,
                                                       final boolean deleteLibrary,
                                                       final boolean deleteFiles,
                                                       final boolean force) {
        final ReentrantLock lock = acquire(mirrorId);
        boolean removed = false;
        try {
            final Optional<LibraryMirror> mirror = store.getMirror(mirrorId);
            if (mirror.isEmpty() || !condition.test(mirror.get())) {
                logger.info("Mirror {} no longer qualifies for deletion, skipping", mirrorId);
                return Optional.empty();
            }
            final DeleteMirrorResult result = deleteLocked(mirror.get(), deleteLibrary, deleteFiles, force);
            removed = result.removedFromConfig();
            return Optional.of(result);
        } finally {
            lock.unlock();
            if (removed) {
                locks.evict(mirrorId);
            }
        }
    }

    private DeleteMirrorResult deleteLocked(final LibraryMirror mirror,
                                            final boolean deleteLibrary,
                                            final boolean deleteFiles,
                                            final boolean force) {
        logger.info("Deleting mirror {} ({}), deleteLibrary={}, deleteFiles={}, force={}",
                mirror.getId(), mirror.getTargetLibraryName(), deleteLibrary, deleteFiles, force);

        String libraryError = null;
        if (deleteLibrary && mirror.getTargetLibraryId() != null) {
            final Optional<VirtualLibrary> library = findLibrary(mirror.getTargetLibraryId());
            if (library.isPresent()) {
                try {
                    libraryDirectory.removeVirtualLibrary(library.get().name(), true);
                    logger.info("Removed library '{}'", library.get().name());
                } catch (final IOException | RuntimeException e) {
                    logger.warn("Failed to remove library '{}'", library.get().name(), e);
                    libraryError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                }
            }
        }

        String fileError = null;
        if (deleteFiles && !mirror.getTargetPath().isBlank()) {
            final Path target = Paths.get(mirror.getTargetPath());
            try {
                FileSystemHelper.deleteRecursively(target);
                logger.info("Deleted mirror directory {}", target);
            } catch (final IOException | RuntimeException e) {
                logger.warn("Failed to delete mirror directory {}", target, e);
                fileError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }
        }

        if ((libraryError != null || fileError != null) && !force) {
            logger.warn("Keeping configuration of mirror {} after failed deletion", mirror.getId());
            return new DeleteMirrorResult(false, libraryError, fileError);
        }

        return new DeleteMirrorResult(store.removeMirror(mirror.getId()), libraryError, fileError);
    }

    // ==================== Libraries ====================

    /**
     * All host libraries, each flagged with whether it is a mirror target and which alternative owns it.
     */
    public List<LibraryInfo> getLibraries() {
        final Map<UUID, UUID> targetToAlternative = new HashMap<>();
        for (final LanguageAlternative alternative : store.getAlternatives()) {
            for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
                if (mirror.getTargetLibraryId() != null) {
                    targetToAlternative.put(mirror.getTargetLibraryId(), alternative.getId());
                }
            }
        }

        final List<LibraryInfo> result = new ArrayList<>();
        for (final VirtualLibrary library : libraryDirectory.getVirtualLibraries()) {
            final UUID alternativeId = targetToAlternative.get(library.id());
            result.add(new LibraryInfo(library.id(), library.name(), library.collectionType(),
                    List.copyOf(library.locations()), library.options().getPreferredMetadataLanguage(),
                    library.options().getMetadataCountryCode(), alternativeId != null, alternativeId));
        }
        return result;
    }

    // ==================== Helpers ====================

    private Optional<VirtualLibrary> findLibrary(final UUID libraryId) {
        return libraryDirectory.getVirtualLibraries().stream()
                .filter(l -> l.id().equals(libraryId))
                .findFirst();
    }

    private static List<Path> sourceRoots(final VirtualLibrary source) throws PolyglotException {
        if (source.locations().isEmpty()) {
            throw PolyglotException.validation("Source library '" + source.name() + "' has no paths");
        }
        final List<Path> roots = new ArrayList<>();
        for (final String location : source.locations()) {
            roots.add(Paths.get(location));
        }
        return roots;
    }

    private ReentrantLock acquire(final UUID mirrorId) {
        final ReentrantLock lock = locks.lockFor(mirrorId);
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for mirror " + mirrorId);
        }
        return lock;
    }
}
