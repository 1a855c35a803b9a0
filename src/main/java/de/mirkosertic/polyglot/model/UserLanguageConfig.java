package de.mirkosertic.polyglot.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * Language assignment of a single user. A {@code null} alternative means the user sees the
 * source libraries.
 */
public class UserLanguageConfig {

    private UUID userId;
    private @Nullable UUID selectedAlternativeId;
    private boolean manuallySet;
    private boolean pluginManaged = true;
    private @Nullable String setBy;
    private @Nullable Instant setAt;

    public UserLanguageConfig() {
    }

    public UserLanguageConfig(final UUID userId) {
        this.userId = userId;
    }

    public UserLanguageConfig deepCopy() {
        final UserLanguageConfig copy = new UserLanguageConfig(userId);
        copy.selectedAlternativeId = selectedAlternativeId;
        copy.manuallySet = manuallySet;
        copy.pluginManaged = pluginManaged;
        copy.setBy = setBy;
        copy.setAt = setAt;
        return copy;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(final UUID userId) {
        this.userId = userId;
    }

    public @Nullable UUID getSelectedAlternativeId() {
        return selectedAlternativeId;
    }

    public void setSelectedAlternativeId(final @Nullable UUID selectedAlternativeId) {
        this.selectedAlternativeId = selectedAlternativeId;
    }

    public boolean isManuallySet() {
        return manuallySet;
    }

    public void setManuallySet(final boolean manuallySet) {
        this.manuallySet = manuallySet;
    }

    public boolean isPluginManaged() {
        return pluginManaged;
    }

    public void setPluginManaged(final boolean pluginManaged) {
        this.pluginManaged = pluginManaged;
    }

    public @Nullable String getSetBy() {
        return setBy;
    }

    public void setSetBy(final @Nullable String setBy) {
        this.setBy = setBy;
    }

    public @Nullable Instant getSetAt() {
        return setAt;
    }

    public void setSetAt(final @Nullable Instant setAt) {
        this.setAt = setAt;
    }
}
