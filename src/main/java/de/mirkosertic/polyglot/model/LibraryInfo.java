package de.mirkosertic.polyglot.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.UUID;

/**
 * Host library as seen by this system: flags whether the library is the target of a mirror
 * and, if so, which alternative owns it.
 */
public record LibraryInfo(
        UUID id,
        String name,
        @Nullable String collectionType,
        List<String> paths,
        @Nullable String preferredMetadataLanguage,
        @Nullable String metadataCountryCode,
        boolean mirror,
        @Nullable UUID languageAlternativeId
) {
}
