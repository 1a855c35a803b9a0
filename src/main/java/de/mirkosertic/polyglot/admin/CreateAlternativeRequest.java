package de.mirkosertic.polyglot.admin;

import org.jspecify.annotations.Nullable;

/**
 * Input for {@link AlternativeAdministration#createAlternative}. Metadata language and country
 * are derived from the language code when absent.
 */
public record CreateAlternativeRequest(
        String name,
        String languageCode,
        @Nullable String metadataLanguage,
        @Nullable String metadataCountry,
        String destinationBasePath
) {

    public CreateAlternativeRequest(final String name, final String languageCode, final String destinationBasePath) {
        this(name, languageCode, null, null, destinationBasePath);
    }
}
