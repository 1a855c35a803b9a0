package de.mirkosertic.polyglot.access;

import de.mirkosertic.polyglot.PolyglotException;
import de.mirkosertic.polyglot.host.HostUser;
import de.mirkosertic.polyglot.host.LibraryDirectory;
import de.mirkosertic.polyglot.host.UserDirectory;
import de.mirkosertic.polyglot.host.VirtualLibrary;
import de.mirkosertic.polyglot.mirror.CancellationToken;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.UserLanguageConfig;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Decides which libraries a user may browse and writes that decision to the host.
 * <p>
 * Only <em>managed</em> libraries are decided here: every mirror's source and every existing
 * mirror target. Access to any other library is carried over from the user's current access
 * unchanged. For managed libraries:
 * <ul>
 *   <li>a target of the user's own alternative is shown;</li>
 *   <li>a target of any other alternative is hidden;</li>
 *   <li>a source is hidden if the user's alternative mirrors it and that mirror's library exists
 *       on the host, otherwise it is shown as a fallback;</li>
 *   <li>users without an alternative see every managed source and no mirror.</li>
 * </ul>
 */
public class LibraryAccessService {

    private static final Logger logger = LoggerFactory.getLogger(LibraryAccessService.class);

    static final String SET_BY_BULK_ENABLE = "bulk-enable";
    static final String SET_BY_ADMIN_DISABLED = "admin-disabled";

    private final ConfigurationStore store;
    private final LibraryDirectory libraryDirectory;
    private final UserDirectory userDirectory;

    public LibraryAccessService(final ConfigurationStore store,
                                final LibraryDirectory libraryDirectory,
                                final UserDirectory userDirectory) {
        this.store = store;
        this.libraryDirectory = libraryDirectory;
        this.userDirectory = userDirectory;
    }

    // ==================== Projection ====================

    /**
     * @return managed libraries the user should see; empty if the user is not assigned or not
     * managed, meaning the user's access must not be touched
     */
    public Set<UUID> getExpectedLibraryAccess(final UUID userId) {
        final Optional<UserLanguageConfig> userConfig = store.getUserLanguage(userId);
        if (userConfig.isEmpty() || !userConfig.get().isPluginManaged()) {
            return Set.of();
        }

        final List<LanguageAlternative> alternatives = store.getAlternatives();
        final UUID selectedId = userConfig.get().getSelectedAlternativeId();
        @Nullable LanguageAlternative selected = null;
        if (selectedId != null) {
            for (final LanguageAlternative alternative : alternatives) {
                if (alternative.getId().equals(selectedId)) {
                    selected = alternative;
                }
            }
            if (selected == null) {
                logger.warn("User {} is assigned to unknown alternative {}, treating as default", userId, selectedId);
            }
        }

        final Set<UUID> managed = new HashSet<>();
        final Map<UUID, UUID> targetToAlternative = new HashMap<>();
        for (final LanguageAlternative alternative : alternatives) {
            for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
                managed.add(mirror.getSourceLibraryId());
                if (mirror.getTargetLibraryId() != null) {
                    managed.add(mirror.getTargetLibraryId());
                    targetToAlternative.put(mirror.getTargetLibraryId(), alternative.getId());
                }
            }
        }

        final Set<UUID> hostLibraryIds = new LinkedHashSet<>();
        for (final VirtualLibrary library : libraryDirectory.getVirtualLibraries()) {
            hostLibraryIds.add(library.id());
        }

        final Set<UUID> result = new LinkedHashSet<>();
        for (final UUID libraryId : hostLibraryIds) {
            if (!managed.contains(libraryId)) {
                continue;
            }

            final UUID owner = targetToAlternative.get(libraryId);
            if (owner != null) {
                if (selected != null && owner.equals(selected.getId())) {
                    result.add(libraryId);
                }
                continue;
            }

            if (selected != null) {
                final LibraryMirror ownMirror = findMirrorForSource(selected, libraryId);
                if (ownMirror != null) {
                    if (ownMirror.getTargetLibraryId() != null && hostLibraryIds.contains(ownMirror.getTargetLibraryId())) {
                        continue;
                    }
                    logger.warn("Mirror of source library {} for '{}' is missing, showing the source as fallback",
                            libraryId, selected.getName());
                }
            }
            result.add(libraryId);
        }
        return result;
    }

    private static @Nullable LibraryMirror findMirrorForSource(final LanguageAlternative alternative, final UUID sourceId) {
        for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
            if (mirror.getSourceLibraryId().equals(sourceId)) {
                return mirror;
            }
        }
        return null;
    }

    private Set<UUID> getManagedLibraryIds() {
        final Set<UUID> managed = new HashSet<>();
        for (final LibraryMirror mirror : store.getAllMirrors()) {
            managed.add(mirror.getSourceLibraryId());
            if (mirror.getTargetLibraryId() != null) {
                managed.add(mirror.getTargetLibraryId());
            }
        }
        return managed;
    }

    // ==================== Applier ====================

    /**
     * Write the projected access for a managed user, keeping the user's current access to
     * unmanaged libraries. With no mirrors configured at all the current access is kept as is.
     */
    public void updateUserLibraryAccess(final UUID userId) throws PolyglotException {
        final Optional<HostUser> user = userDirectory.getUser(userId);
        if (user.isEmpty()) {
            logger.warn("User {} not found", userId);
            return;
        }
        if (!isManaged(userId)) {
            logger.debug("User {} is not managed, skipping library access update", user.get().username());
            return;
        }

        final Set<UUID> finalAccess = computeFinalAccess(user.get());
        writeAccess(user.get(), finalAccess);
    }

    private Set<UUID> computeFinalAccess(final HostUser user) {
        final Set<UUID> managed = getManagedLibraryIds();
        final Set<UUID> current = getCurrentLibraryAccess(user);
        final Set<UUID> expected = getExpectedLibraryAccess(user.id());

        final Set<UUID> result = new LinkedHashSet<>(expected);
        if (managed.isEmpty()) {
            result.addAll(current);
            logger.info("User {}: no mirrors configured yet, preserving current access to {} libraries",
                    user.username(), result.size());
            return result;
        }
        for (final UUID libraryId : current) {
            if (!managed.contains(libraryId)) {
                result.add(libraryId);
            }
        }
        logger.debug("User {}: {} managed libraries, {} unmanaged preserved",
                user.username(), expected.size(), result.size() - expected.size());
        return result;
    }

    private Set<UUID> getCurrentLibraryAccess(final HostUser user) {
        if (user.enableAllFolders()) {
            final Set<UUID> all = new LinkedHashSet<>();
            for (final VirtualLibrary library : libraryDirectory.getVirtualLibraries()) {
                all.add(library.id());
            }
            return all;
        }
        return new LinkedHashSet<>(user.enabledFolders());
    }

    private void writeAccess(final HostUser user, final Set<UUID> libraries) throws PolyglotException {
        try {
            userDirectory.updateLibraryAccess(user.id(), false, Set.copyOf(libraries));
            logger.info("Updated library access of user {}: {} libraries", user.username(), libraries.size());
        } catch (final IOException e) {
            throw PolyglotException.fatal("Failed to update library access of user " + user.username(), e);
        }
    }

    /**
     * Grant additional libraries without touching anything else. Used when a source lost its
     * last mirror and would otherwise stay hidden.
     */
    public void addLibrariesToUserAccess(final UUID userId, final Collection<UUID> libraryIds) throws PolyglotException {
        final Optional<HostUser> user = userDirectory.getUser(userId);
        if (user.isEmpty()) {
            logger.warn("User {} not found when adding libraries", userId);
            return;
        }
        final Set<UUID> access = getCurrentLibraryAccess(user.get());
        int addedCount = 0;
        for (final UUID libraryId : libraryIds) {
            if (access.add(libraryId)) {
                addedCount++;
            }
        }
        if (addedCount == 0) {
            return;
        }
        writeAccess(user.get(), access);
        logger.info("Added {} libraries to access of user {}", addedCount, user.get().username());
    }

    // ==================== Sweep ====================

    /**
     * Reapply the projection if the user's live access differs from it.
     *
     * @return {@code true} if the access was rewritten
     */
    public boolean reconcileUserAccess(final UUID userId) throws PolyglotException {
        final Optional<HostUser> user = userDirectory.getUser(userId);
        if (user.isEmpty() || !isManaged(userId)) {
            return false;
        }

        final Set<UUID> expected = computeFinalAccess(user.get());
        final Set<UUID> current = getCurrentLibraryAccess(user.get());
        if (!user.get().enableAllFolders() && expected.equals(current)) {
            return false;
        }

        logger.info("Reconciling library access of user {}: expected {}, current {}, enableAllFolders={}",
                user.get().username(), expected.size(), current.size(), user.get().enableAllFolders());
        writeAccess(user.get(), expected);
        return true;
    }

    /**
     * Reconcile every user with an assignment. Per-user failures are logged and skipped.
     *
     * @return number of users whose access changed
     */
    public int reconcileAllUsers(final CancellationToken cancellation) {
        int changed = 0;
        for (final UserLanguageConfig userConfig : store.getUserLanguages()) {
            cancellation.throwIfCancelled();
            try {
                if (reconcileUserAccess(userConfig.getUserId())) {
                    changed++;
                }
            } catch (final PolyglotException | RuntimeException e) {
                logger.error("Failed to reconcile user {}", userConfig.getUserId(), e);
            }
        }
        if (changed > 0) {
            logger.info("Reconciled library access of {} users", changed);
        }
        return changed;
    }

    // ==================== Bulk management ====================

    /**
     * Put every host user under management. Users without an assignment get the default
     * (source) libraries.
     *
     * @return number of users newly managed
     */
    public int enableAllUsers(final CancellationToken cancellation) {
        int enabled = 0;
        for (final HostUser user : userDirectory.getUsers()) {
            cancellation.throwIfCancelled();
            final boolean alreadyManaged = isManaged(user.id());
            if (!alreadyManaged) {
                store.updateOrCreateUserLanguage(user.id(), config -> {
                    config.setPluginManaged(true);
                    config.setSetAt(Instant.now());
                    config.setSetBy(SET_BY_BULK_ENABLE);
                });
                enabled++;
            }
            try {
                updateUserLibraryAccess(user.id());
            } catch (final PolyglotException | RuntimeException e) {
                logger.error("Failed to enable user {}", user.username(), e);
            }
        }
        logger.info("Enabled management for {} users", enabled);
        return enabled;
    }

    /**
     * Stop managing a user. Optionally give the user access to every library again.
     */
    public void disableUser(final UUID userId, final boolean restoreFullAccess) throws PolyglotException {
        final Optional<HostUser> user = userDirectory.getUser(userId);
        if (user.isEmpty()) {
            throw PolyglotException.notFound("User " + userId + " not found");
        }

        store.updateUserLanguage(userId, config -> {
            config.setPluginManaged(false);
            config.setSetAt(Instant.now());
            config.setSetBy(SET_BY_ADMIN_DISABLED);
        });

        if (restoreFullAccess) {
            try {
                userDirectory.updateLibraryAccess(userId, true, user.get().enabledFolders());
                logger.info("Restored access to all libraries for user {}", user.get().username());
            } catch (final IOException e) {
                throw PolyglotException.fatal("Failed to restore access of user " + user.get().username(), e);
            }
        }
        logger.info("Disabled management for user {}", user.get().username());
    }

    private boolean isManaged(final UUID userId) {
        return store.getUserLanguage(userId).map(UserLanguageConfig::isPluginManaged).orElse(false);
    }
}
