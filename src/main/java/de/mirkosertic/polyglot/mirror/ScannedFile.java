package de.mirkosertic.polyglot.mirror;

import java.nio.file.Path;

/**
 * A qualifying file found while scanning a library root.
 */
public record ScannedFile(Path path, FileSignature signature) {
}
