package de.mirkosertic.polyglot;

import de.mirkosertic.polyglot.access.LibraryAccessService;
import de.mirkosertic.polyglot.access.UserLanguageService;
import de.mirkosertic.polyglot.admin.AlternativeAdministration;
import de.mirkosertic.polyglot.config.ApplicationConfig;
import de.mirkosertic.polyglot.host.LibraryDirectory;
import de.mirkosertic.polyglot.host.UserDirectory;
import de.mirkosertic.polyglot.mirror.CancellationToken;
import de.mirkosertic.polyglot.mirror.MirrorLockRegistry;
import de.mirkosertic.polyglot.mirror.MirrorService;
import de.mirkosertic.polyglot.mirror.MirrorSyncJob;
import de.mirkosertic.polyglot.mirror.MirrorValidator;
import de.mirkosertic.polyglot.mirror.OrphanCleanupResult;
import de.mirkosertic.polyglot.mirror.OrphanReconciler;
import de.mirkosertic.polyglot.mirror.SyncExecutorService;
import de.mirkosertic.polyglot.store.ConfigurationPersistence;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import de.mirkosertic.polyglot.store.JsonConfigurationPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires the services against the host's library and user directories and owns their lifecycle.
 */
public class PolyglotRuntime {

    private static final Logger logger = LoggerFactory.getLogger(PolyglotRuntime.class);

    private final ApplicationConfig config;
    private final ConfigurationStore store;
    private final MirrorService mirrorService;
    private final MirrorValidator mirrorValidator;
    private final OrphanReconciler orphanReconciler;
    private final LibraryAccessService libraryAccessService;
    private final UserLanguageService userLanguageService;
    private final AlternativeAdministration administration;
    private final MirrorSyncJob syncJob;
    private final SyncExecutorService syncExecutor;
    private final AtomicReference<CancellationToken> currentJobToken = new AtomicReference<>();

    public PolyglotRuntime(final ApplicationConfig config,
                           final LibraryDirectory libraryDirectory,
                           final UserDirectory userDirectory) {
        this(config, new JsonConfigurationPersistence(config.getConfigurationFile()), libraryDirectory,
                userDirectory, Clock.systemUTC());
    }

    public PolyglotRuntime(final ApplicationConfig config,
                           final ConfigurationPersistence persistence,
                           final LibraryDirectory libraryDirectory,
                           final UserDirectory userDirectory,
                           final Clock clock) {
        this.config = config;

        // Initialize services in dependency order
        this.store = new ConfigurationStore(persistence);

        this.mirrorService = new MirrorService(store, libraryDirectory, new MirrorLockRegistry());

        this.mirrorValidator = new MirrorValidator(store, libraryDirectory);

        this.orphanReconciler = new OrphanReconciler(store, libraryDirectory, mirrorService,
                config.getGhostThreshold(), clock);

        this.libraryAccessService = new LibraryAccessService(store, libraryDirectory, userDirectory);

        this.userLanguageService = new UserLanguageService(store, userDirectory, libraryAccessService);

        this.administration = new AlternativeAdministration(store, mirrorService, mirrorValidator,
                libraryAccessService);

        this.syncJob = new MirrorSyncJob(store, mirrorService, orphanReconciler, libraryAccessService);

        this.syncExecutor = new SyncExecutorService(config);
    }

    /**
     * Load the configuration and run the startup sweep: orphan cleanup, then access reconciliation.
     */
    public void init() {
        logger.info("Initializing mirror manager...");

        store.init();
        if (!store.isAvailable()) {
            logger.error("Configuration unavailable, skipping startup sweep");
            return;
        }

        if (config.isCleanupOrphansOnStartup()) {
            try {
                final OrphanCleanupResult result = orphanReconciler.cleanup(CancellationToken.NONE);
                if (result.totalCleaned() > 0) {
                    logger.info("Startup cleanup removed {} orphaned mirrors: {}", result.totalCleaned(),
                            result.cleanedUpMirrors());
                }
            } catch (final RuntimeException e) {
                logger.error("Startup orphan cleanup failed", e);
            }
        }

        if (config.isReconcileOnStartup()) {
            try {
                libraryAccessService.reconcileAllUsers(CancellationToken.NONE);
            } catch (final RuntimeException e) {
                logger.error("Startup access reconciliation failed", e);
            }
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Run the sync job in the background. A running job can be stopped with {@link #cancelSyncJob()}.
     */
    public Future<?> scheduleSyncJob() {
        final CancellationToken token = new CancellationToken();
        currentJobToken.set(token);
        return syncExecutor.submit(() -> {
            try {
                syncJob.run(null, token);
            } catch (final RuntimeException e) {
                logger.error("Mirror sync job failed", e);
            } finally {
                currentJobToken.compareAndSet(token, null);
            }
        });
    }

    public void cancelSyncJob() {
        final CancellationToken token = currentJobToken.get();
        if (token != null) {
            logger.info("Cancelling mirror sync job");
            token.cancel();
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down mirror manager...");

        try {
            cancelSyncJob();
        } catch (final Exception e) {
            logger.error("Error cancelling sync job", e);
        }

        try {
            syncExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down sync executor", e);
        }

        logger.info("Mirror manager shutdown complete");
    }

    public ConfigurationStore getStore() {
        return store;
    }

    public MirrorService getMirrorService() {
        return mirrorService;
    }

    public MirrorValidator getMirrorValidator() {
        return mirrorValidator;
    }

    public OrphanReconciler getOrphanReconciler() {
        return orphanReconciler;
    }

    public LibraryAccessService getLibraryAccessService() {
        return libraryAccessService;
    }

    public UserLanguageService getUserLanguageService() {
        return userLanguageService;
    }

    public AlternativeAdministration getAdministration() {
        return administration;
    }

    public MirrorSyncJob getSyncJob() {
        return syncJob;
    }
}
