package de.mirkosertic.polyglot.store;

import de.mirkosertic.polyglot.model.ConfigurationDocument;
import de.mirkosertic.polyglot.model.GroupLanguageMapping;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.PolyglotSettings;
import de.mirkosertic.polyglot.model.UserLanguageConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Single source of truth for alternatives, mirrors, user assignments, group mappings and settings.
 * <p>
 * All operations run under the store's monitor. Mutators look the canonical record up again
 * inside the critical section, check their precondition, apply the change and save the whole
 * document before releasing the lock. Readers only ever receive deep copies, so nothing handed
 * out can alter the canonical state.
 * <p>
 * Consumers passed to the {@code update*} methods run inside the critical section on the
 * canonical object. They must be short, must not block on I/O and must not keep a reference to
 * their argument.
 * <p>
 * When the document could not be loaded the store is <em>unavailable</em>: readers see nothing
 * and every mutator refuses. When a save fails the change is undone in memory as well and the
 * mutator reports failure, so memory never runs ahead of the persisted document.
 */
public class ConfigurationStore {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationStore.class);

    private final ConfigurationPersistence persistence;
    private @Nullable ConfigurationDocument document;

    public ConfigurationStore(final ConfigurationPersistence persistence) {
        this.persistence = persistence;
    }

    /**
     * Load the backing document. A load failure leaves the store unavailable.
     */
    public synchronized void init() {
        try {
            document = persistence.load();
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to load configuration, store is unavailable", e);
            document = null;
        }
    }

    public synchronized boolean isAvailable() {
        return document != null;
    }

    // ==================== Alternatives ====================

    public synchronized Optional<LanguageAlternative> getAlternative(final UUID id) {
        return Optional.ofNullable(findAlternative(id)).map(LanguageAlternative::deepCopy);
    }

    public synchronized List<LanguageAlternative> getAlternatives() {
        if (document == null) {
            return List.of();
        }
        final List<LanguageAlternative> result = new ArrayList<>();
        for (final LanguageAlternative alternative : document.getLanguageAlternatives()) {
            result.add(alternative.deepCopy());
        }
        return result;
    }

    /**
     * Add a new alternative. Refused when another alternative already has the same name
     * (case-insensitive) or the same id.
     */
    public synchronized boolean addAlternative(final LanguageAlternative alternative) {
        if (document == null) {
            logger.warn("Cannot add alternative '{}': configuration unavailable", alternative.getName());
            return false;
        }
        for (final LanguageAlternative existing : document.getLanguageAlternatives()) {
            if (existing.getId().equals(alternative.getId())
                    || existing.getName().equalsIgnoreCase(alternative.getName())) {
                logger.warn("Alternative '{}' already exists", alternative.getName());
                return false;
            }
        }
        final ConfigurationDocument before = document.deepCopy();
        document.getLanguageAlternatives().add(alternative.deepCopy());
        if (!commit(before)) {
            return false;
        }
        logger.info("Added language alternative '{}' ({})", alternative.getName(), alternative.getId());
        return true;
    }

    /**
     * Apply an update to an alternative. Refused, and undone, when the update changes the id or
     * gives the alternative a name another alternative already uses (case-insensitive).
     */
    public synchronized boolean updateAlternative(final UUID id, final Consumer<LanguageAlternative> update) {
        final LanguageAlternative alternative = findAlternative(id);
        if (alternative == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        update.accept(alternative);
        if (!id.equals(alternative.getId()) || isNameTakenByOther(alternative)) {
            logger.warn("Rejected update of alternative {}: id or name '{}' conflicts", id, alternative.getName());
            document = before;
            return false;
        }
        alternative.setModifiedAt(Instant.now());
        return commit(before);
    }

    public synchronized boolean removeAlternative(final UUID id) {
        final LanguageAlternative alternative = findAlternative(id);
        if (alternative == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        removeAlternativeAndReferences(alternative);
        return commit(before);
    }

    /**
     * Remove an alternative only if it still holds no mirrors besides the expected ones. Used by
     * alternative deletion after the observed mirrors have been torn down outside the lock: a
     * mirror added concurrently shows up here as {@code NEW_MIRRORS_ADDED}.
     */
    public synchronized RemoveAlternativeResult tryRemoveAlternativeAtomic(final UUID id,
                                                                           final Set<UUID> expectedMirrorIds) {
        if (document == null) {
            return RemoveAlternativeResult.unavailable();
        }
        final LanguageAlternative alternative = findAlternative(id);
        if (alternative == null) {
            return RemoveAlternativeResult.notFound();
        }
        final List<UUID> unexpected = new ArrayList<>();
        for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
            if (!expectedMirrorIds.contains(mirror.getId())) {
                unexpected.add(mirror.getId());
            }
        }
        if (!unexpected.isEmpty()) {
            logger.warn("Refusing to remove alternative '{}': {} mirror(s) were added concurrently",
                    alternative.getName(), unexpected.size());
            return RemoveAlternativeResult.newMirrorsAdded(unexpected);
        }
        final ConfigurationDocument before = document.deepCopy();
        removeAlternativeAndReferences(alternative);
        if (!commit(before)) {
            return RemoveAlternativeResult.unavailable();
        }
        logger.info("Removed language alternative '{}' ({})", alternative.getName(), id);
        return RemoveAlternativeResult.succeeded();
    }

    private void removeAlternativeAndReferences(final LanguageAlternative alternative) {
        document.getLanguageAlternatives().remove(alternative);
        final PolyglotSettings settings = document.getSettings();
        if (alternative.getId().equals(settings.getDefaultAlternativeId())) {
            settings.setDefaultAlternativeId(null);
        }
        document.getGroupMappings().removeIf(m -> alternative.getId().equals(m.getAlternativeId()));
    }

    // ==================== Mirrors ====================

    public synchronized Optional<LibraryMirror> getMirror(final UUID mirrorId) {
        return getMirrorWithAlternative(mirrorId).map(MirrorLocation::mirror);
    }

    public synchronized Optional<MirrorLocation> getMirrorWithAlternative(final UUID mirrorId) {
        if (document == null) {
            return Optional.empty();
        }
        for (final LanguageAlternative alternative : document.getLanguageAlternatives()) {
            for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
                if (mirror.getId().equals(mirrorId)) {
                    return Optional.of(new MirrorLocation(mirror.deepCopy(), alternative.deepCopy()));
                }
            }
        }
        return Optional.empty();
    }

    public synchronized List<LibraryMirror> getAllMirrors() {
        if (document == null) {
            return List.of();
        }
        final List<LibraryMirror> result = new ArrayList<>();
        for (final LanguageAlternative alternative : document.getLanguageAlternatives()) {
            for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
                result.add(mirror.deepCopy());
            }
        }
        return result;
    }

    /**
     * Add a mirror to an alternative. Refused when the alternative does not exist or already
     * mirrors the same source library.
     */
    public synchronized boolean addMirror(final UUID alternativeId, final LibraryMirror mirror) {
        final LanguageAlternative alternative = findAlternative(alternativeId);
        if (alternative == null) {
            logger.warn("Cannot add mirror: alternative {} not found", alternativeId);
            return false;
        }
        for (final LibraryMirror existing : alternative.getMirroredLibraries()) {
            if (existing.getSourceLibraryId().equals(mirror.getSourceLibraryId())) {
                logger.warn("Alternative '{}' already mirrors library {}", alternative.getName(),
                        mirror.getSourceLibraryId());
                return false;
            }
        }
        final ConfigurationDocument before = document.deepCopy();
        alternative.getMirroredLibraries().add(mirror.deepCopy());
        alternative.setModifiedAt(Instant.now());
        return commit(before);
    }

    public synchronized boolean updateMirror(final UUID mirrorId, final Consumer<LibraryMirror> update) {
        final LibraryMirror mirror = findMirror(mirrorId);
        if (mirror == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        update.accept(mirror);
        return commit(before);
    }

    public synchronized boolean removeMirror(final UUID mirrorId) {
        if (document == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        for (final LanguageAlternative alternative : document.getLanguageAlternatives()) {
            if (alternative.getMirroredLibraries().removeIf(m -> m.getId().equals(mirrorId))) {
                alternative.setModifiedAt(Instant.now());
                return commit(before);
            }
        }
        return false;
    }

    // ==================== Users ====================

    public synchronized Optional<UserLanguageConfig> getUserLanguage(final UUID userId) {
        return Optional.ofNullable(findUser(userId)).map(UserLanguageConfig::deepCopy);
    }

    public synchronized List<UserLanguageConfig> getUserLanguages() {
        if (document == null) {
            return List.of();
        }
        final List<UserLanguageConfig> result = new ArrayList<>();
        for (final UserLanguageConfig config : document.getUserLanguages()) {
            result.add(config.deepCopy());
        }
        return result;
    }

    /**
     * Apply an update to the user's assignment, creating the record first if needed.
     *
     * @return {@code true} if the record was newly created and saved
     */
    public synchronized boolean updateOrCreateUserLanguage(final UUID userId,
                                                           final Consumer<UserLanguageConfig> update) {
        if (document == null) {
            logger.warn("Cannot update language of user {}: configuration unavailable", userId);
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        UserLanguageConfig config = findUser(userId);
        final boolean created = config == null;
        if (created) {
            config = new UserLanguageConfig(userId);
            document.getUserLanguages().add(config);
        }
        update.accept(config);
        return commit(before) && created;
    }

    public synchronized boolean updateUserLanguage(final UUID userId, final Consumer<UserLanguageConfig> update) {
        final UserLanguageConfig config = findUser(userId);
        if (config == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        update.accept(config);
        return commit(before);
    }

    public synchronized boolean removeUserLanguage(final UUID userId) {
        if (document == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        if (document.getUserLanguages().removeIf(u -> u.getUserId().equals(userId))) {
            return commit(before);
        }
        return false;
    }

    // ==================== Group mappings ====================

    public synchronized List<GroupLanguageMapping> getGroupMappings() {
        if (document == null) {
            return List.of();
        }
        final List<GroupLanguageMapping> result = new ArrayList<>();
        for (final GroupLanguageMapping mapping : document.getGroupMappings()) {
            result.add(mapping.deepCopy());
        }
        return result;
    }

    public synchronized boolean addGroupMapping(final GroupLanguageMapping mapping) {
        if (document == null) {
            return false;
        }
        for (final GroupLanguageMapping existing : document.getGroupMappings()) {
            if (existing.getGroupDn().equalsIgnoreCase(mapping.getGroupDn())) {
                return false;
            }
        }
        final ConfigurationDocument before = document.deepCopy();
        document.getGroupMappings().add(mapping.deepCopy());
        return commit(before);
    }

    public synchronized boolean removeGroupMapping(final UUID mappingId) {
        if (document == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        if (document.getGroupMappings().removeIf(m -> m.getId().equals(mappingId))) {
            return commit(before);
        }
        return false;
    }

    // ==================== Settings ====================

    public synchronized PolyglotSettings getSettings() {
        return document == null ? new PolyglotSettings() : document.getSettings().deepCopy();
    }

    /**
     * Apply an update to the global settings. The predicate returns whether it changed anything;
     * the document is only saved in that case.
     */
    public synchronized boolean updateSettings(final Predicate<PolyglotSettings> update) {
        if (document == null) {
            return false;
        }
        final ConfigurationDocument before = document.deepCopy();
        if (update.test(document.getSettings())) {
            return commit(before);
        }
        return false;
    }

    public synchronized Set<String> getExcludedExtensions() {
        return caseInsensitiveSet(getSettingsInternal().getExcludedExtensions());
    }

    public synchronized Set<String> getExcludedDirectories() {
        return caseInsensitiveSet(getSettingsInternal().getExcludedDirectories());
    }

    public synchronized Set<String> getIncludedDirectories() {
        return caseInsensitiveSet(getSettingsInternal().getIncludedDirectories());
    }

    /**
     * Drop every alternative, assignment and mapping and restore default settings.
     */
    public synchronized boolean clearAll() {
        if (document == null) {
            return false;
        }
        final ConfigurationDocument before = document;
        document = new ConfigurationDocument();
        if (!commit(before)) {
            return false;
        }
        logger.info("Cleared all configuration");
        return true;
    }

    // ==================== Internals ====================

    private PolyglotSettings getSettingsInternal() {
        return document == null ? new PolyglotSettings() : document.getSettings();
    }

    private static Set<String> caseInsensitiveSet(final List<String> values) {
        final TreeSet<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(values);
        return Collections.unmodifiableSet(set);
    }

    private @Nullable LanguageAlternative findAlternative(final UUID id) {
        if (document == null) {
            return null;
        }
        for (final LanguageAlternative alternative : document.getLanguageAlternatives()) {
            if (alternative.getId().equals(id)) {
                return alternative;
            }
        }
        return null;
    }

    private @Nullable LibraryMirror findMirror(final UUID mirrorId) {
        if (document == null) {
            return null;
        }
        for (final LanguageAlternative alternative : document.getLanguageAlternatives()) {
            for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
                if (mirror.getId().equals(mirrorId)) {
                    return mirror;
                }
            }
        }
        return null;
    }

    private @Nullable UserLanguageConfig findUser(final UUID userId) {
        if (document == null) {
            return null;
        }
        for (final UserLanguageConfig config : document.getUserLanguages()) {
            if (config.getUserId().equals(userId)) {
                return config;
            }
        }
        return null;
    }

    private boolean isNameTakenByOther(final LanguageAlternative alternative) {
        for (final LanguageAlternative other : document.getLanguageAlternatives()) {
            if (other != alternative && other.getName().equalsIgnoreCase(alternative.getName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Save the document. On failure the document reverts to {@code before}.
     */
    private boolean commit(final ConfigurationDocument before) {
        try {
            persistence.save(document);
            return true;
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to save configuration, change reverted", e);
            document = before;
            return false;
        }
    }
}
