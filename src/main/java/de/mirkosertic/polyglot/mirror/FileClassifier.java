package de.mirkosertic.polyglot.mirror;

import de.mirkosertic.polyglot.model.PolyglotSettings;
import de.mirkosertic.polyglot.store.ConfigurationStore;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides which files of a source tree are hardlinked into a mirror.
 * <p>
 * Everything is mirrored except language-specific metadata. Rules, in order:
 * <ol>
 *   <li>a file below a directory whose name is excluded is skipped, at any depth;</li>
 *   <li>a file below an included directory is mirrored regardless of its extension;</li>
 *   <li>a file with an excluded extension is skipped;</li>
 *   <li>everything else is mirrored.</li>
 * </ol>
 * Directory names and extensions compare case-insensitively. Only the directories between the
 * library root and the file count, so a library that happens to live below e.g. {@code /metadata}
 * is still mirrored.
 */
public class FileClassifier {

    private final Set<String> excludedExtensions;
    private final Set<String> excludedDirectories;
    private final Set<String> includedDirectories;

    public FileClassifier(final Collection<String> excludedExtensions,
                          final Collection<String> excludedDirectories,
                          final Collection<String> includedDirectories) {
        this.excludedExtensions = caseInsensitive(excludedExtensions);
        this.excludedDirectories = caseInsensitive(excludedDirectories);
        this.includedDirectories = caseInsensitive(includedDirectories);
    }

    public static FileClassifier withDefaults() {
        return new FileClassifier(PolyglotSettings.DEFAULT_EXCLUDED_EXTENSIONS,
                PolyglotSettings.DEFAULT_EXCLUDED_DIRECTORIES,
                PolyglotSettings.DEFAULT_INCLUDED_DIRECTORIES);
    }

    public static FileClassifier fromStore(final ConfigurationStore store) {
        return new FileClassifier(store.getExcludedExtensions(), store.getExcludedDirectories(),
                store.getIncludedDirectories());
    }

    /**
     * @param relativePath path of a file relative to the library root it was found in
     * @return {@code true} if the file belongs into the mirror
     */
    public boolean shouldHardlink(final Path relativePath) {
        final Path fileName = relativePath.getFileName();
        if (fileName == null || fileName.toString().isEmpty()) {
            return false;
        }

        final Path parent = relativePath.getParent();
        if (parent != null) {
            for (final Path component : parent) {
                if (excludedDirectories.contains(component.toString())) {
                    return false;
                }
            }
            for (final Path component : parent) {
                if (includedDirectories.contains(component.toString())) {
                    return true;
                }
            }
        }

        return !excludedExtensions.contains(extensionOf(fileName.toString()));
    }

    /**
     * @return {@code true} if the directory with the given name is skipped entirely
     */
    public boolean isExcludedDirectory(final String directoryName) {
        return excludedDirectories.contains(directoryName);
    }

    static String extensionOf(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static Set<String> caseInsensitive(final Collection<String> values) {
        final Set<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(values);
        return set;
    }
}
