package de.mirkosertic.polyglot.mirror;

import de.mirkosertic.polyglot.host.LibraryDirectory;
import de.mirkosertic.polyglot.host.VirtualLibrary;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks a proposed mirror before anything is written. Every check is side-effect free.
 */
public class MirrorValidator {

    private static final Logger logger = LoggerFactory.getLogger(MirrorValidator.class);

    private final ConfigurationStore store;
    private final LibraryDirectory libraryDirectory;

    public MirrorValidator(final ConfigurationStore store, final LibraryDirectory libraryDirectory) {
        this.store = store;
        this.libraryDirectory = libraryDirectory;
    }

    public ValidationResult validate(final UUID sourceLibraryId, final String targetPath) {
        final Optional<VirtualLibrary> source = libraryDirectory.getVirtualLibraries().stream()
                .filter(l -> l.id().equals(sourceLibraryId))
                .findFirst();
        if (source.isEmpty()) {
            return ValidationResult.error("Source library not found: " + sourceLibraryId);
        }
        if (source.get().locations().isEmpty()) {
            return ValidationResult.error("Source library '" + source.get().name() + "' has no paths");
        }
        for (final LibraryMirror mirror : store.getAllMirrors()) {
            if (sourceLibraryId.equals(mirror.getTargetLibraryId())) {
                return ValidationResult.error("Library '" + source.get().name() + "' is itself a mirror and cannot be mirrored");
            }
        }

        if (targetPath == null || targetPath.isBlank()) {
            return ValidationResult.error("Target path is required");
        }
        if (FileSystemHelper.containsTraversal(targetPath)) {
            return ValidationResult.error("Target path must not contain '..'");
        }
        final Path target;
        try {
            target = Paths.get(targetPath);
        } catch (final InvalidPathException e) {
            return ValidationResult.error("Invalid target path: " + e.getMessage());
        }
        if (!target.isAbsolute()) {
            return ValidationResult.error("Target path must be absolute");
        }

        for (final String location : source.get().locations()) {
            final Path sourcePath = Paths.get(location);
            if (FileSystemHelper.isSameOrNested(target, sourcePath)) {
                return ValidationResult.error("Target path must not be inside source path " + location);
            }
            if (FileSystemHelper.isSameOrNested(sourcePath, target)) {
                return ValidationResult.error("Target path must not contain source path " + location);
            }
            try {
                if (!FileSystemHelper.isSameVolume(sourcePath, target)) {
                    return ValidationResult.error("Source path " + location + " and target path " + targetPath
                            + " are on different filesystems, hardlinks are not possible");
                }
            } catch (final IOException e) {
                logger.warn("Cannot determine filesystem of {} or {}", location, targetPath, e);
                return ValidationResult.error("Cannot determine filesystem of " + location + ": " + e.getMessage());
            }
        }

        if (Files.exists(target)) {
            if (!Files.isDirectory(target)) {
                return ValidationResult.error("Target path exists and is not a directory");
            }
            try {
                if (!FileSystemHelper.isDirectoryEmpty(target)) {
                    return ValidationResult.error("Target directory is not empty");
                }
            } catch (final IOException e) {
                return ValidationResult.error("Cannot read target directory: " + e.getMessage());
            }
        }

        return ValidationResult.ok();
    }
}
