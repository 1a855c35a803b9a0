package de.mirkosertic.polyglot.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Global settings stored alongside the alternatives and user assignments.
 */
public class PolyglotSettings {

    public static final List<String> DEFAULT_EXCLUDED_EXTENSIONS = List.of(
            ".nfo", ".jpg", ".jpeg", ".png", ".gif", ".webp", ".tbn", ".bmp");

    public static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of(
            "extrafanart", "extrathumbs", ".trickplay", "metadata", ".actors");

    public static final List<String> DEFAULT_INCLUDED_DIRECTORIES = List.of(
            ".trickplay", ".actors");

    private @Nullable UUID defaultAlternativeId;
    private boolean autoManageNewUsers;
    private List<String> excludedExtensions = new ArrayList<>(DEFAULT_EXCLUDED_EXTENSIONS);
    private List<String> excludedDirectories = new ArrayList<>(DEFAULT_EXCLUDED_DIRECTORIES);
    private List<String> includedDirectories = new ArrayList<>(DEFAULT_INCLUDED_DIRECTORIES);

    public PolyglotSettings deepCopy() {
        final PolyglotSettings copy = new PolyglotSettings();
        copy.defaultAlternativeId = defaultAlternativeId;
        copy.autoManageNewUsers = autoManageNewUsers;
        copy.excludedExtensions = new ArrayList<>(excludedExtensions);
        copy.excludedDirectories = new ArrayList<>(excludedDirectories);
        copy.includedDirectories = new ArrayList<>(includedDirectories);
        return copy;
    }

    public @Nullable UUID getDefaultAlternativeId() {
        return defaultAlternativeId;
    }

    public void setDefaultAlternativeId(final @Nullable UUID defaultAlternativeId) {
        this.defaultAlternativeId = defaultAlternativeId;
    }

    public boolean isAutoManageNewUsers() {
        return autoManageNewUsers;
    }

    public void setAutoManageNewUsers(final boolean autoManageNewUsers) {
        this.autoManageNewUsers = autoManageNewUsers;
    }

    public List<String> getExcludedExtensions() {
        return excludedExtensions;
    }

    public void setExcludedExtensions(final List<String> excludedExtensions) {
        this.excludedExtensions = excludedExtensions;
    }

    public List<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public void setExcludedDirectories(final List<String> excludedDirectories) {
        this.excludedDirectories = excludedDirectories;
    }

    public List<String> getIncludedDirectories() {
        return includedDirectories;
    }

    public void setIncludedDirectories(final List<String> includedDirectories) {
        this.includedDirectories = includedDirectories;
    }
}
