package de.mirkosertic.polyglot.mirror;

import de.mirkosertic.polyglot.PolyglotException;
import de.mirkosertic.polyglot.access.LibraryAccessService;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.UserLanguageConfig;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic maintenance: remove orphaned mirrors, give users back sources that lost their last
 * mirror, then sync every alternative one after the other.
 * <p>
 * Only one run is active at a time; a second call while a run is in progress returns
 * immediately.
 */
public class MirrorSyncJob {

    private static final Logger logger = LoggerFactory.getLogger(MirrorSyncJob.class);

    private static final double CLEANUP_SHARE = 10.0;

    private final ConfigurationStore store;
    private final MirrorService mirrorService;
    private final OrphanReconciler orphanReconciler;
    private final LibraryAccessService libraryAccessService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MirrorSyncJob(final ConfigurationStore store,
                         final MirrorService mirrorService,
                         final OrphanReconciler orphanReconciler,
                         final LibraryAccessService libraryAccessService) {
        this.store = store;
        this.mirrorService = mirrorService;
        this.orphanReconciler = orphanReconciler;
        this.libraryAccessService = libraryAccessService;
    }

    /**
     * Summary of one run.
     */
    public record Summary(
            /** False if another run was already active and this call did nothing. */
            boolean executed,
            int orphansCleaned,
            int mirrorsSynced,
            int mirrorsFailed,
            boolean cancelled
    ) {
    }

    public Summary run(final @Nullable ProgressListener progress, final CancellationToken cancellation) {
        if (!running.compareAndSet(false, true)) {
            logger.info("Mirror sync job already running, skipping");
            return new Summary(false, 0, 0, 0, false);
        }
        try {
            return doRun(progress, cancellation);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private Summary doRun(final @Nullable ProgressListener progress, final CancellationToken cancellation) {
        logger.info("Starting mirror sync job");

        final int orphansCleaned;
        try {
            orphansCleaned = cleanupOrphans(cancellation);
        } catch (final CancellationException e) {
            logger.info("Mirror sync job cancelled during orphan cleanup");
            return new Summary(true, 0, 0, 0, true);
        }
        report(progress, CLEANUP_SHARE);

        final List<LanguageAlternative> alternatives = store.getAlternatives();
        int synced = 0;
        int failed = 0;
        for (int i = 0; i < alternatives.size(); i++) {
            if (cancellation.isCancelled()) {
                logger.info("Mirror sync job cancelled after {} of {} alternatives", i, alternatives.size());
                return new Summary(true, orphansCleaned, synced, failed, true);
            }
            final LanguageAlternative alternative = alternatives.get(i);
            final double base = CLEANUP_SHARE + (100 - CLEANUP_SHARE) * i / alternatives.size();
            final double span = (100 - CLEANUP_SHARE) / alternatives.size();
            final ProgressListener alternativeProgress = progress == null
                    ? null
                    : p -> progress.onProgress(base + span * p / 100);

            final SyncAllResult result = mirrorService.syncAllMirrors(alternative.getId(), alternativeProgress, cancellation);
            synced += result.mirrorsSynced();
            failed += result.mirrorsFailed();
            logger.info("Synced alternative '{}': {} of {} mirrors, {} failed", alternative.getName(),
                    result.mirrorsSynced(), result.totalMirrors(), result.mirrorsFailed());
            if (result.status() == SyncAllResult.Status.CANCELLED) {
                return new Summary(true, orphansCleaned, synced, failed, true);
            }
        }

        report(progress, 100);
        logger.info("Mirror sync job finished: {} orphans cleaned, {} mirrors synced, {} failed",
                orphansCleaned, synced, failed);
        return new Summary(true, orphansCleaned, synced, failed, false);
    }

    private int cleanupOrphans(final CancellationToken cancellation) {
        final OrphanCleanupResult result = orphanReconciler.cleanup(cancellation);
        if (result.totalCleaned() == 0) {
            return 0;
        }
        logger.info("Cleaned up {} orphaned mirrors", result.totalCleaned());

        if (!result.sourcesWithoutMirrors().isEmpty()) {
            for (final UserLanguageConfig userConfig : store.getUserLanguages()) {
                if (!userConfig.isPluginManaged()) {
                    continue;
                }
                try {
                    libraryAccessService.addLibrariesToUserAccess(userConfig.getUserId(), result.sourcesWithoutMirrors());
                } catch (final PolyglotException | RuntimeException e) {
                    logger.error("Failed to add sources to user {}", userConfig.getUserId(), e);
                }
            }
        }

        libraryAccessService.reconcileAllUsers(cancellation);
        return result.totalCleaned();
    }

    private static void report(final @Nullable ProgressListener progress, final double percent) {
        if (progress == null) {
            return;
        }
        try {
            progress.onProgress(percent);
        } catch (final RuntimeException e) {
            logger.debug("Progress listener failed", e);
        }
    }
}
