package de.mirkosertic.polyglot.store;

import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryMirror;

/**
 * A mirror together with the alternative owning it. Both are detached copies.
 */
public record MirrorLocation(LibraryMirror mirror, LanguageAlternative alternative) {
}
