package de.mirkosertic.polyglot.admin;

import de.mirkosertic.polyglot.PolyglotException;
import de.mirkosertic.polyglot.access.LibraryAccessService;
import de.mirkosertic.polyglot.mirror.CancellationToken;
import de.mirkosertic.polyglot.mirror.DeleteMirrorResult;
import de.mirkosertic.polyglot.mirror.MirrorService;
import de.mirkosertic.polyglot.mirror.MirrorValidator;
import de.mirkosertic.polyglot.mirror.SyncAllResult;
import de.mirkosertic.polyglot.mirror.ValidationResult;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryInfo;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.SyncStatus;
import de.mirkosertic.polyglot.model.UserLanguageConfig;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import de.mirkosertic.polyglot.store.RemoveAlternativeResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Administrative workflows spanning store, mirror engine and access: creating and deleting
 * alternatives and adding or removing their mirrors.
 */
public class AlternativeAdministration {

    private static final Logger logger = LoggerFactory.getLogger(AlternativeAdministration.class);

    private final ConfigurationStore store;
    private final MirrorService mirrorService;
    private final MirrorValidator mirrorValidator;
    private final LibraryAccessService libraryAccessService;

    public AlternativeAdministration(final ConfigurationStore store,
                                     final MirrorService mirrorService,
                                     final MirrorValidator mirrorValidator,
                                     final LibraryAccessService libraryAccessService) {
        this.store = store;
        this.mirrorService = mirrorService;
        this.mirrorValidator = mirrorValidator;
        this.libraryAccessService = libraryAccessService;
    }

    // ==================== Alternatives ====================

    public LanguageAlternative createAlternative(final CreateAlternativeRequest request) throws PolyglotException {
        if (isBlank(request.name())) {
            throw PolyglotException.validation("Name is required");
        }
        if (isBlank(request.languageCode())) {
            throw PolyglotException.validation("Language code is required");
        }
        if (isBlank(request.destinationBasePath())) {
            throw PolyglotException.validation("Destination base path is required");
        }
        if (!isAbsolute(request.destinationBasePath())) {
            throw PolyglotException.validation("Destination base path must be an absolute path");
        }

        final LanguageAlternative alternative = new LanguageAlternative();
        alternative.setName(request.name().trim());
        alternative.setLanguageCode(request.languageCode().trim());
        alternative.setMetadataLanguage(request.metadataLanguage() != null
                ? request.metadataLanguage()
                : languageFromCode(alternative.getLanguageCode()));
        alternative.setMetadataCountry(request.metadataCountry() != null
                ? request.metadataCountry()
                : countryFromCode(alternative.getLanguageCode()));
        alternative.setDestinationBasePath(request.destinationBasePath());
        alternative.setCreatedAt(Instant.now());

        if (!store.addAlternative(alternative)) {
            throw PolyglotException.validation("Failed to create alternative: either configuration is unavailable "
                    + "or could not be saved, or an alternative named '" + request.name() + "' already exists");
        }
        logger.info("Created alternative {} ({})", alternative.getName(), alternative.getLanguageCode());
        return alternative;
    }

    static String languageFromCode(final String code) {
        final int dash = code.indexOf('-');
        return dash > 0 ? code.substring(0, dash) : code;
    }

    static String countryFromCode(final String code) {
        final int dash = code.indexOf('-');
        return dash > 0 ? code.substring(dash + 1) : "";
    }

    /**
     * Delete an alternative with all its mirrors.
     * <p>
     * The mirrors seen at the start are deleted first, outside the store lock. The alternative
     * itself is only removed if no other mirror appeared in the meantime; otherwise the call
     * reports a conflict and the new mirrors stay intact.
     */
    public DeleteAlternativeResult deleteAlternative(final UUID alternativeId,
                                                     final boolean deleteLibraries,
                                                     final boolean deleteFiles) {
        final LanguageAlternative alternative = store.getAlternative(alternativeId).orElse(null);
        if (alternative == null) {
            return new DeleteAlternativeResult(DeleteAlternativeResult.Outcome.NOT_FOUND, List.of(), List.of(), List.of());
        }

        final Set<UUID> observedMirrorIds = new HashSet<>();
        final List<UUID> deleted = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        for (final LibraryMirror mirror : alternative.getMirroredLibraries()) {
            observedMirrorIds.add(mirror.getId());
            try {
                final DeleteMirrorResult result = mirrorService.deleteMirror(mirror.getId(), deleteLibraries, deleteFiles, false);
                if (result.removedFromConfig()) {
                    deleted.add(mirror.getId());
                } else {
                    failed.add(mirror.getTargetLibraryName() + ": " + firstNonNull(result.libraryDeletionError(),
                            result.fileDeletionError(), "mirror was not removed from configuration"));
                }
            } catch (final PolyglotException e) {
                logger.error("Failed to delete mirror {} of alternative '{}'", mirror.getId(), alternative.getName(), e);
                failed.add(mirror.getTargetLibraryName() + ": " + e.getMessage());
            }
        }

        if (!failed.isEmpty()) {
            logger.warn("{} of {} mirrors failed to delete, keeping alternative '{}'",
                    failed.size(), observedMirrorIds.size(), alternative.getName());
            return new DeleteAlternativeResult(DeleteAlternativeResult.Outcome.MIRROR_DELETION_FAILED, deleted, failed, List.of());
        }

        final RemoveAlternativeResult removal = store.tryRemoveAlternativeAtomic(alternativeId, observedMirrorIds);
        switch (removal.outcome()) {
            case SUCCEEDED:
                logger.info("Deleted alternative '{}'", alternative.getName());
                refreshAccessOfUsers(alternativeId);
                return new DeleteAlternativeResult(DeleteAlternativeResult.Outcome.DELETED, deleted, List.of(), List.of());
            case NOT_FOUND:
                logger.info("Alternative '{}' was already removed", alternative.getName());
                return new DeleteAlternativeResult(DeleteAlternativeResult.Outcome.DELETED, deleted, List.of(), List.of());
            case NEW_MIRRORS_ADDED:
                logger.warn("New mirrors were added while deleting alternative '{}', aborting", alternative.getName());
                return new DeleteAlternativeResult(DeleteAlternativeResult.Outcome.CONFLICT, deleted, List.of(),
                        removal.unexpectedMirrorIds());
            default:
                return new DeleteAlternativeResult(DeleteAlternativeResult.Outcome.UNAVAILABLE, deleted, List.of(), List.of());
        }
    }

    // ==================== Mirrors ====================

    /**
     * Validate, record and create a mirror of {@code sourceLibraryId} for the alternative.
     * A failed creation removes the configuration entry again and rethrows.
     *
     * @param targetPath        defaults to the alternative's base path plus the source library name
     * @param targetLibraryName defaults to {@code "<source> (<alternative>)"}
     * @return the created mirror as stored
     */
    public LibraryMirror addLibraryMirror(final UUID alternativeId,
                                          final UUID sourceLibraryId,
                                          final @Nullable String targetPath,
                                          final @Nullable String targetLibraryName) throws PolyglotException {
        final LanguageAlternative alternative = store.getAlternative(alternativeId)
                .orElseThrow(() -> PolyglotException.notFound("Language alternative " + alternativeId + " not found"));
        final LibraryInfo source = mirrorService.getLibraries().stream()
                .filter(l -> l.id().equals(sourceLibraryId))
                .findFirst()
                .orElseThrow(() -> PolyglotException.validation("Source library " + sourceLibraryId + " not found"));
        if (source.mirror()) {
            throw PolyglotException.validation("Cannot create a mirror of a mirror library");
        }

        final String effectiveTargetPath = isBlank(targetPath)
                ? Paths.get(alternative.getDestinationBasePath(), sanitizeDirectoryName(source.name())).toString()
                : targetPath;
        final ValidationResult validation = mirrorValidator.validate(sourceLibraryId, effectiveTargetPath);
        if (!validation.valid()) {
            throw PolyglotException.validation(validation.errorMessage());
        }

        final LibraryMirror mirror = new LibraryMirror();
        mirror.setSourceLibraryId(sourceLibraryId);
        mirror.setSourceLibraryName(source.name());
        mirror.setTargetLibraryName(isBlank(targetLibraryName)
                ? source.name() + " (" + alternative.getName() + ")"
                : targetLibraryName);
        mirror.setTargetPath(effectiveTargetPath);
        mirror.setCollectionType(source.collectionType());
        mirror.setStatus(SyncStatus.PENDING);
        mirror.setCreatedAt(Instant.now());

        if (!store.addMirror(alternativeId, mirror)) {
            throw PolyglotException.conflict("Failed to add mirror: either the alternative was deleted or a mirror for '"
                    + source.name() + "' was created by another request");
        }

        try {
            mirrorService.createMirror(alternativeId, mirror.getId(), CancellationToken.NONE);
        } catch (final PolyglotException | RuntimeException e) {
            logger.error("Failed to create mirror {}, removing it from configuration", mirror.getTargetLibraryName(), e);
            if (store.removeMirror(mirror.getId())) {
                logger.info("Removed failed mirror {} from configuration", mirror.getTargetLibraryName());
            }
            throw e;
        }

        final int updated = refreshAccessOfUsers(alternativeId);
        logger.info("Created mirror {}, updated access for {} users", mirror.getTargetLibraryName(), updated);
        return store.getMirror(mirror.getId())
                .orElseThrow(() -> PolyglotException.notFound("Mirror " + mirror.getId() + " vanished after creation"));
    }

    /**
     * Delete the alternative's mirror of {@code sourceLibraryId} and refresh access of its users.
     */
    public DeleteMirrorResult deleteLibraryMirror(final UUID alternativeId,
                                                  final UUID sourceLibraryId,
                                                  final boolean deleteLibrary,
                                                  final boolean deleteFiles,
                                                  final boolean force) throws PolyglotException {
        final LibraryMirror mirror = store.getAlternative(alternativeId)
                .flatMap(a -> a.getMirroredLibraries().stream()
                        .filter(m -> m.getSourceLibraryId().equals(sourceLibraryId))
                        .findFirst())
                .orElseThrow(() -> PolyglotException.notFound("Language alternative or mirror not found"));

        final DeleteMirrorResult result = mirrorService.deleteMirror(mirror.getId(), deleteLibrary, deleteFiles, force);
        if (result.hasErrors()) {
            logger.warn("Mirror {} deleted with errors: library={}, files={}", mirror.getTargetLibraryName(),
                    result.libraryDeletionError(), result.fileDeletionError());
        }
        if (result.removedFromConfig()) {
            refreshAccessOfUsers(alternativeId);
        }
        return result;
    }

    public SyncAllResult syncAlternative(final UUID alternativeId, final CancellationToken cancellation) {
        final SyncAllResult result = mirrorService.syncAllMirrors(alternativeId, null, cancellation);
        logger.info("Synced alternative {}: status={}, {} of {} mirrors", alternativeId, result.status(),
                result.mirrorsSynced(), result.totalMirrors());
        return result;
    }

    // ==================== Helpers ====================

    private int refreshAccessOfUsers(final UUID alternativeId) {
        int updated = 0;
        for (final UserLanguageConfig userConfig : store.getUserLanguages()) {
            if (!userConfig.isPluginManaged() || !alternativeId.equals(userConfig.getSelectedAlternativeId())) {
                continue;
            }
            try {
                libraryAccessService.updateUserLibraryAccess(userConfig.getUserId());
                updated++;
            } catch (final PolyglotException | RuntimeException e) {
                logger.warn("Failed to update access for user {}", userConfig.getUserId(), e);
            }
        }
        return updated;
    }

    static String sanitizeDirectoryName(final String name) {
        final String sanitized = name.replaceAll("[\\\\/:*?\"<>|]", "_").trim();
        return sanitized.isEmpty() || ".".equals(sanitized) || "..".equals(sanitized) ? "_" : sanitized;
    }

    private static boolean isAbsolute(final String path) {
        try {
            return Paths.get(path).isAbsolute();
        } catch (final InvalidPathException e) {
            return false;
        }
    }

    private static boolean isBlank(final @Nullable String value) {
        return value == null || value.isBlank();
    }

    private static String firstNonNull(final @Nullable String first, final @Nullable String second, final String fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
