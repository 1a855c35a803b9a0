package de.mirkosertic.polyglot.store;

import de.mirkosertic.polyglot.model.ConfigurationDocument;

import java.io.IOException;

/**
 * Durable backing of the {@link ConfigurationDocument}. The whole document is read and written
 * at once.
 */
public interface ConfigurationPersistence {

    /**
     * @return the stored document, or an empty document with default settings if nothing was stored yet
     */
    ConfigurationDocument load() throws IOException;

    void save(ConfigurationDocument document) throws IOException;
}
