package de.mirkosertic.polyglot.mirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filesystem primitives used by the mirror engine: hardlinking, volume checks, tree scanning
 * and pruning.
 */
public final class FileSystemHelper {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemHelper.class);

    private FileSystemHelper() {
    }

    /**
     * Hardlink {@code source} to {@code link}, creating parent directories as needed. An existing
     * file at {@code link} is replaced.
     */
    public static void createHardLink(final Path source, final Path link) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }
        final Path parent = link.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(link);
        Files.createLink(link, source);
    }

    /**
     * Two paths are on the same volume when the nearest existing ancestors of both belong to the
     * same {@link FileStore}. Paths that do not exist yet are judged by where they would be created.
     */
    public static boolean isSameVolume(final Path first, final Path second) throws IOException {
        final FileStore firstStore = Files.getFileStore(nearestExistingAncestor(first));
        final FileStore secondStore = Files.getFileStore(nearestExistingAncestor(second));
        return firstStore.equals(secondStore);
    }

    static Path nearestExistingAncestor(final Path path) throws IOException {
        Path current = path.toAbsolutePath().normalize();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        if (current == null) {
            throw new NoSuchFileException(path.toString(), null, "no existing ancestor");
        }
        return current;
    }

    /**
     * @return {@code true} if any segment of the raw path string is {@code ..}
     */
    public static boolean containsTraversal(final String path) {
        for (final String segment : path.split("[/\\\\]")) {
            if ("..".equals(segment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if {@code path} equals {@code ancestor} or lies below it
     */
    public static boolean isSameOrNested(final Path path, final Path ancestor) {
        final Path normalizedPath = path.toAbsolutePath().normalize();
        final Path normalizedAncestor = ancestor.toAbsolutePath().normalize();
        return normalizedPath.startsWith(normalizedAncestor);
    }

    public static boolean isDirectoryEmpty(final Path directory) throws IOException {
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            return !stream.iterator().hasNext();
        }
    }

    /**
     * Delete empty directories from {@code start} upwards. Stops at the first non-empty directory
     * and never deletes {@code root} itself.
     */
    public static void pruneEmptyDirectories(final Path start, final Path root) {
        final Path normalizedRoot = root.toAbsolutePath().normalize();
        Path current = start.toAbsolutePath().normalize();
        while (current != null && !current.equals(normalizedRoot) && current.startsWith(normalizedRoot)) {
            try {
                if (!Files.isDirectory(current) || !isDirectoryEmpty(current)) {
                    return;
                }
                Files.delete(current);
                logger.debug("Removed empty directory {}", current);
            } catch (final IOException e) {
                logger.warn("Failed to remove empty directory {}", current, e);
                return;
            }
            current = current.getParent();
        }
    }

    /**
     * Delete a directory tree. Missing directories are ignored. Hardlinked files only lose one
     * link, the data stays with the source.
     */
    public static void deleteRecursively(final Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Collect every qualifying file below the given roots, keyed by its path relative to the root it
     * was found in (with {@code /} as separator). When several roots contain the same relative path
     * the first root wins. Excluded directories are not descended into; unreadable entries are
     * logged and skipped.
     */
    public static Map<String, ScannedFile> scan(final List<Path> roots,
                                                final FileClassifier classifier,
                                                final CancellationToken cancellation) {
        final Map<String, ScannedFile> result = new LinkedHashMap<>();
        for (final Path root : roots) {
            if (!Files.isDirectory(root)) {
                logger.warn("Skipping non-existent or non-directory path: {}", root);
                continue;
            }
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                        cancellation.throwIfCancelled();
                        if (!dir.equals(root) && classifier.isExcludedDirectory(dir.getFileName().toString())) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                        if (!attrs.isRegularFile()) {
                            return FileVisitResult.CONTINUE;
                        }
                        final Path relative = root.relativize(file);
                        if (classifier.shouldHardlink(relative)) {
                            result.putIfAbsent(toKey(relative), new ScannedFile(file,
                                    new FileSignature(attrs.size(), attrs.lastModifiedTime().toMillis())));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                        logger.warn("Cannot read {}, skipping", file, exc);
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (final IOException e) {
                logger.error("Error walking directory {}", root, e);
            }
        }
        return result;
    }

    static String toKey(final Path relative) {
        final StringBuilder key = new StringBuilder();
        for (final Path component : relative) {
            if (key.length() > 0) {
                key.append('/');
            }
            key.append(component);
        }
        return key.toString();
    }
}
