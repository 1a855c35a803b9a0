package de.mirkosertic.polyglot.host;

import org.jspecify.annotations.Nullable;

/**
 * Per-library settings of the media host. Mirror libraries start from a copy of their source
 * library's options.
 */
public class LibraryOptions {

    private boolean enabled = true;
    private boolean enableRealtimeMonitor;
    private boolean enableInternetProviders;
    private boolean saveLocalMetadata;
    private boolean saveSubtitlesWithMedia;
    private boolean saveLyricsWithMedia;
    private @Nullable String preferredMetadataLanguage;
    private @Nullable String metadataCountryCode;

    public LibraryOptions copy() {
        final LibraryOptions copy = new LibraryOptions();
        copy.enabled = enabled;
        copy.enableRealtimeMonitor = enableRealtimeMonitor;
        copy.enableInternetProviders = enableInternetProviders;
        copy.saveLocalMetadata = saveLocalMetadata;
        copy.saveSubtitlesWithMedia = saveSubtitlesWithMedia;
        copy.saveLyricsWithMedia = saveLyricsWithMedia;
        copy.preferredMetadataLanguage = preferredMetadataLanguage;
        copy.metadataCountryCode = metadataCountryCode;
        return copy;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(final boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnableRealtimeMonitor() {
        return enableRealtimeMonitor;
    }

    public void setEnableRealtimeMonitor(final boolean enableRealtimeMonitor) {
        this.enableRealtimeMonitor = enableRealtimeMonitor;
    }

    public boolean isEnableInternetProviders() {
        return enableInternetProviders;
    }

    public void setEnableInternetProviders(final boolean enableInternetProviders) {
        this.enableInternetProviders = enableInternetProviders;
    }

    public boolean isSaveLocalMetadata() {
        return saveLocalMetadata;
    }

    public void setSaveLocalMetadata(final boolean saveLocalMetadata) {
        this.saveLocalMetadata = saveLocalMetadata;
    }

    public boolean isSaveSubtitlesWithMedia() {
        return saveSubtitlesWithMedia;
    }

    public void setSaveSubtitlesWithMedia(final boolean saveSubtitlesWithMedia) {
        this.saveSubtitlesWithMedia = saveSubtitlesWithMedia;
    }

    public boolean isSaveLyricsWithMedia() {
        return saveLyricsWithMedia;
    }

    public void setSaveLyricsWithMedia(final boolean saveLyricsWithMedia) {
        this.saveLyricsWithMedia = saveLyricsWithMedia;
    }

    public @Nullable String getPreferredMetadataLanguage() {
        return preferredMetadataLanguage;
    }

    public void setPreferredMetadataLanguage(final @Nullable String preferredMetadataLanguage) {
        this.preferredMetadataLanguage = preferredMetadataLanguage;
    }

    public @Nullable String getMetadataCountryCode() {
        return metadataCountryCode;
    }

    public void setMetadataCountryCode(final @Nullable String metadataCountryCode) {
        this.metadataCountryCode = metadataCountryCode;
    }
}
