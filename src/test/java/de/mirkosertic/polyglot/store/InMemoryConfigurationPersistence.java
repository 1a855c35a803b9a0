package de.mirkosertic.polyglot.store;

import de.mirkosertic.polyglot.model.ConfigurationDocument;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistence double counting successful saves. Can be made to fail on load or save.
 */
public class InMemoryConfigurationPersistence implements ConfigurationPersistence {

    private final AtomicInteger saveCount = new AtomicInteger();
    private volatile boolean failLoad;
    private volatile boolean failSave;

    public void setFailLoad(final boolean failLoad) {
        this.failLoad = failLoad;
    }

    public void setFailSave(final boolean failSave) {
        this.failSave = failSave;
    }

    public int getSaveCount() {
        return saveCount.get();
    }

    @Override
    public ConfigurationDocument load() throws IOException {
        if (failLoad) {
            throw new IOException("Corrupt configuration");
        }
        return new ConfigurationDocument();
    }

    @Override
    public void save(final ConfigurationDocument document) throws IOException {
        if (failSave) {
            throw new IOException("disk full");
        }
        saveCount.incrementAndGet();
    }
}
