package de.mirkosertic.polyglot.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.mirkosertic.polyglot.model.ConfigurationDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores the configuration document as pretty-printed JSON. Writes go to a temporary sibling
 * file which is then moved over the real one.
 */
public class JsonConfigurationPersistence implements ConfigurationPersistence {

    private static final Logger logger = LoggerFactory.getLogger(JsonConfigurationPersistence.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public JsonConfigurationPersistence(final Path file) {
        this.file = file;
    }

    @Override
    public ConfigurationDocument load() throws IOException {
        if (!Files.exists(file)) {
            logger.info("No configuration at {}, starting with an empty one", file);
            return new ConfigurationDocument();
        }
        final ConfigurationDocument document = OBJECT_MAPPER.readValue(file.toFile(), ConfigurationDocument.class);
        logger.info("Loaded configuration from {}: {} alternatives, {} user assignments",
                file, document.getLanguageAlternatives().size(), document.getUserLanguages().size());
        return document;
    }

    @Override
    public void save(final ConfigurationDocument document) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        OBJECT_MAPPER.writeValue(temp.toFile(), document);
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Saved configuration to {}", file);
    }

    public Path getFile() {
        return file;
    }
}
