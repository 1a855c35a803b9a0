package de.mirkosertic.polyglot.access;

import de.mirkosertic.polyglot.PolyglotException;
import de.mirkosertic.polyglot.host.HostUser;
import de.mirkosertic.polyglot.host.UserDirectory;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.PolyglotSettings;
import de.mirkosertic.polyglot.model.UserInfo;
import de.mirkosertic.polyglot.model.UserLanguageConfig;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Assigns users to language alternatives and keeps their library access in line.
 */
public class UserLanguageService {

    private static final Logger logger = LoggerFactory.getLogger(UserLanguageService.class);

    public static final String SET_BY_ADMIN = "admin";
    public static final String SET_BY_AUTO = "auto";

    private final ConfigurationStore store;
    private final UserDirectory userDirectory;
    private final LibraryAccessService libraryAccessService;

    public UserLanguageService(final ConfigurationStore store,
                               final UserDirectory userDirectory,
                               final LibraryAccessService libraryAccessService) {
        this.store = store;
        this.userDirectory = userDirectory;
        this.libraryAccessService = libraryAccessService;
    }

    /**
     * Assign a user to an alternative, or to the source libraries when {@code alternativeId} is
     * {@code null}. Library access is updated right away for managed users.
     */
    public void assignLanguage(final UUID userId,
                               final @Nullable UUID alternativeId,
                               final String setBy,
                               final boolean manuallySet,
                               final boolean pluginManaged) throws PolyglotException {
        final HostUser user = userDirectory.getUser(userId)
                .orElseThrow(() -> PolyglotException.notFound("User " + userId + " not found"));

        String alternativeName = "Default";
        if (alternativeId != null) {
            alternativeName = store.getAlternative(alternativeId)
                    .map(LanguageAlternative::getName)
                    .orElseThrow(() -> PolyglotException.notFound("Language alternative " + alternativeId + " not found"));
        }

        store.updateOrCreateUserLanguage(userId, config -> {
            config.setSelectedAlternativeId(alternativeId);
            config.setManuallySet(manuallySet);
            config.setPluginManaged(pluginManaged);
            config.setSetAt(Instant.now());
            config.setSetBy(setBy);
        });
        logger.info("Assigned language {} to user {} (by: {}, manual: {}, managed: {})",
                alternativeName, user.username(), setBy, manuallySet, pluginManaged);

        if (pluginManaged) {
            libraryAccessService.updateUserLibraryAccess(userId);
        }
    }

    /**
     * Put the user back on the source libraries.
     */
    public void clearLanguage(final UUID userId) throws PolyglotException {
        final boolean updated = store.updateUserLanguage(userId, config -> {
            config.setSelectedAlternativeId(null);
            config.setSetAt(Instant.now());
            config.setSetBy(SET_BY_ADMIN);
        });
        if (updated) {
            logger.info("Cleared language assignment of user {}", userId);
            libraryAccessService.updateUserLibraryAccess(userId);
        } else {
            logger.debug("No language assignment found for user {}", userId);
        }
    }

    public Optional<UserLanguageConfig> getUserLanguage(final UUID userId) {
        return store.getUserLanguage(userId);
    }

    public Optional<LanguageAlternative> getUserLanguageAlternative(final UUID userId) {
        return store.getUserLanguage(userId)
                .map(UserLanguageConfig::getSelectedAlternativeId)
                .flatMap(store::getAlternative);
    }

    public boolean isManuallySet(final UUID userId) {
        return store.getUserLanguage(userId).map(UserLanguageConfig::isManuallySet).orElse(false);
    }

    public List<UserInfo> getAllUsersWithLanguages() {
        final Map<UUID, UserLanguageConfig> assignments = new HashMap<>();
        for (final UserLanguageConfig config : store.getUserLanguages()) {
            assignments.put(config.getUserId(), config);
        }
        final Map<UUID, String> alternativeNames = new HashMap<>();
        for (final LanguageAlternative alternative : store.getAlternatives()) {
            alternativeNames.put(alternative.getId(), alternative.getName());
        }

        final List<UserInfo> result = new ArrayList<>();
        for (final HostUser user : userDirectory.getUsers()) {
            final UserLanguageConfig config = assignments.get(user.id());
            if (config == null) {
                result.add(new UserInfo(user.id(), user.username(), user.administrator(), false,
                        null, null, false, null, null));
            } else {
                final UUID selected = config.getSelectedAlternativeId();
                result.add(new UserInfo(user.id(), user.username(), user.administrator(), config.isPluginManaged(),
                        selected, selected == null ? null : alternativeNames.get(selected),
                        config.isManuallySet(), config.getSetBy(), config.getSetAt()));
            }
        }
        return result;
    }

    /**
     * Forget a deleted user.
     */
    public void removeUser(final UUID userId) {
        if (store.removeUserLanguage(userId)) {
            logger.info("Removed language assignment of deleted user {}", userId);
        } else {
            logger.debug("No language assignment found for user {}", userId);
        }
    }

    /**
     * Called when the host reports a new user. Assigns the default alternative when new users
     * are managed automatically. Failures are logged, the user simply stays unmanaged.
     */
    public void onUserCreated(final UUID userId) {
        final PolyglotSettings settings = store.getSettings();
        if (!settings.isAutoManageNewUsers()) {
            return;
        }
        try {
            assignLanguage(userId, settings.getDefaultAlternativeId(), SET_BY_AUTO, false, true);
        } catch (final PolyglotException e) {
            logger.error("Failed to auto-assign language to new user {}", userId, e);
        }
    }
}
