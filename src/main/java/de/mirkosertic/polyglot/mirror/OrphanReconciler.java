package de.mirkosertic.polyglot.mirror;

import de.mirkosertic.polyglot.host.LibraryDirectory;
import de.mirkosertic.polyglot.host.VirtualLibrary;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.SyncStatus;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Removes mirrors that can no longer work.
 * <ul>
 *   <li><b>source deleted</b>: the source library is gone. The mirror's library (if still there),
 *       directory and configuration entry are removed.</li>
 *   <li><b>mirror deleted</b>: the mirror's library was removed from the host while the source
 *       remains. Directory and configuration entry are removed, the source is not touched.</li>
 *   <li><b>incomplete creation</b>: a mirror that never got a library and sits in
 *       {@link SyncStatus#PENDING} or {@link SyncStatus#ERROR} for longer than the ghost threshold.</li>
 * </ul>
 * Failures are collected into the report and never raised.
 */
public class OrphanReconciler {

    private static final Logger logger = LoggerFactory.getLogger(OrphanReconciler.class);

    static final String REASON_SOURCE_DELETED = "source deleted";
    static final String REASON_MIRROR_DELETED = "mirror deleted";
    static final String REASON_INCOMPLETE = "incomplete creation";

    private final ConfigurationStore store;
    private final LibraryDirectory libraryDirectory;
    private final MirrorService mirrorService;
    private final Duration ghostThreshold;
    private final Clock clock;

    public OrphanReconciler(final ConfigurationStore store,
                            final LibraryDirectory libraryDirectory,
                            final MirrorService mirrorService,
                            final Duration ghostThreshold,
                            final Clock clock) {
        this.store = store;
        this.libraryDirectory = libraryDirectory;
        this.mirrorService = mirrorService;
        this.ghostThreshold = ghostThreshold;
        this.clock = clock;
    }

    /**
     * Classification runs twice: once on a snapshot to find candidates, and again inside
     * {@link MirrorService#deleteMirrorIf} with the mirror's lock held and a fresh library list.
     * A mirror that recovered while waiting for its lock is left alone.
     */
    public OrphanCleanupResult cleanup(final CancellationToken cancellation) {
        final Set<UUID> existingLibraryIds = currentLibraryIds();

        final List<String> cleaned = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        final Set<UUID> sourcesWithoutMirrors = new LinkedHashSet<>();

        for (final LibraryMirror mirror : store.getAllMirrors()) {
            cancellation.throwIfCancelled();

            final String reason = classify(mirror, existingLibraryIds);
            if (reason == null) {
                continue;
            }
            logger.warn("Mirror {} ({}) looks orphaned: {}", mirror.getId(), mirror.getTargetLibraryName(), reason);

            final boolean deleteLibrary = REASON_SOURCE_DELETED.equals(reason);
            final Optional<DeleteMirrorResult> outcome = mirrorService.deleteMirrorIf(mirror.getId(),
                    current -> reason.equals(classify(current, currentLibraryIds())), deleteLibrary, true, true);
            if (outcome.isEmpty()) {
                logger.info("Mirror {} ({}) is no longer orphaned, kept", mirror.getId(), mirror.getTargetLibraryName());
                continue;
            }
            final DeleteMirrorResult result = outcome.get();
            if (!result.removedFromConfig()) {
                logger.error("Failed to remove orphaned mirror {} from configuration", mirror.getId());
                failed.add(mirror.getTargetLibraryName() + ": configuration entry could not be removed");
                continue;
            }
            if (result.hasErrors()) {
                logger.warn("Orphaned mirror {} removed with warnings: library={}, files={}", mirror.getId(),
                        result.libraryDeletionError(), result.fileDeletionError());
            }
            cleaned.add(mirror.getTargetLibraryName() + " (" + reason + ")");
            logger.info("Removed orphaned mirror {} ({})", mirror.getTargetLibraryName(), reason);

            if (REASON_MIRROR_DELETED.equals(reason) && !hasAnyMirror(mirror.getSourceLibraryId())) {
                sourcesWithoutMirrors.add(mirror.getSourceLibraryId());
                logger.info("Source library {} ({}) has no more mirrors", mirror.getSourceLibraryId(),
                        mirror.getSourceLibraryName());
            }
        }

        return new OrphanCleanupResult(cleaned, failed, sourcesWithoutMirrors);
    }

    private Set<UUID> currentLibraryIds() {
        final Set<UUID> ids = new HashSet<>();
        for (final VirtualLibrary library : libraryDirectory.getVirtualLibraries()) {
            ids.add(library.id());
        }
        return ids;
    }

    private @Nullable String classify(final LibraryMirror mirror, final Set<UUID> existingLibraryIds) {
        if (!existingLibraryIds.contains(mirror.getSourceLibraryId())) {
            return REASON_SOURCE_DELETED;
        }
        if (mirror.getTargetLibraryId() != null) {
            return existingLibraryIds.contains(mirror.getTargetLibraryId()) ? null : REASON_MIRROR_DELETED;
        }
        if (isGhost(mirror)) {
            return REASON_INCOMPLETE;
        }
        return null;
    }

    private boolean isGhost(final LibraryMirror mirror) {
        if (mirror.getStatus() != SyncStatus.PENDING && mirror.getStatus() != SyncStatus.ERROR) {
            return false;
        }
        final Instant createdAt = mirror.getCreatedAt();
        if (createdAt == null) {
            return true;
        }
        return Duration.between(createdAt, clock.instant()).compareTo(ghostThreshold) > 0;
    }

    private boolean hasAnyMirror(final UUID sourceLibraryId) {
        for (final LibraryMirror mirror : store.getAllMirrors()) {
            if (mirror.getSourceLibraryId().equals(sourceLibraryId)) {
                return true;
            }
        }
        return false;
    }
}
