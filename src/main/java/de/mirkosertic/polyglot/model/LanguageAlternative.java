package de.mirkosertic.polyglot.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A configured language variant: its metadata language/country, the base directory for its
 * mirrors and the mirrors themselves (at most one per source library).
 */
public class LanguageAlternative {

    private UUID id = UUID.randomUUID();
    private String name = "";
    private String languageCode = "";
    private String metadataLanguage = "";
    private String metadataCountry = "";
    private String destinationBasePath = "";
    private List<LibraryMirror> mirroredLibraries = new ArrayList<>();
    private Instant createdAt = Instant.now();
    private @Nullable Instant modifiedAt;

    public LanguageAlternative deepCopy() {
        final LanguageAlternative copy = new LanguageAlternative();
        copy.id = id;
        copy.name = name;
        copy.languageCode = languageCode;
        copy.metadataLanguage = metadataLanguage;
        copy.metadataCountry = metadataCountry;
        copy.destinationBasePath = destinationBasePath;
        copy.mirroredLibraries = new ArrayList<>(mirroredLibraries.size());
        for (final LibraryMirror mirror : mirroredLibraries) {
            copy.mirroredLibraries.add(mirror.deepCopy());
        }
        copy.createdAt = createdAt;
        copy.modifiedAt = modifiedAt;
        return copy;
    }

    public UUID getId() {
        return id;
    }

    public void setId(final UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public String getLanguageCode() {
        return languageCode;
    }

    public void setLanguageCode(final String languageCode) {
        this.languageCode = languageCode;
    }

    public String getMetadataLanguage() {
        return metadataLanguage;
    }

    public void setMetadataLanguage(final String metadataLanguage) {
        this.metadataLanguage = metadataLanguage;
    }

    public String getMetadataCountry() {
        return metadataCountry;
    }

    public void setMetadataCountry(final String metadataCountry) {
        this.metadataCountry = metadataCountry;
    }

    public String getDestinationBasePath() {
        return destinationBasePath;
    }

    public void setDestinationBasePath(final String destinationBasePath) {
        this.destinationBasePath = destinationBasePath;
    }

    public List<LibraryMirror> getMirroredLibraries() {
        return mirroredLibraries;
    }

    public void setMirroredLibraries(final List<LibraryMirror> mirroredLibraries) {
        this.mirroredLibraries = mirroredLibraries;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(final Instant createdAt) {
        this.createdAt = createdAt;
    }

    public @Nullable Instant getModifiedAt() {
        return modifiedAt;
    }

    public void setModifiedAt(final @Nullable Instant modifiedAt) {
        this.modifiedAt = modifiedAt;
    }

    @Override
    public String toString() {
        return "LanguageAlternative{id=" + id + ", name=" + name + ", languageCode=" + languageCode + "}";
    }
}
