package de.mirkosertic.polyglot;

/**
 * Category of a {@link PolyglotException}. Callers branch on the kind, never on the message.
 */
public enum ErrorKind {
    /** Input rejected before any side effect happened. */
    VALIDATION,
    /** A referenced alternative, mirror, library or user does not exist. */
    NOT_FOUND,
    /** A concurrent modification or a duplicate made the operation impossible. */
    CONFLICT,
    /** An I/O or host failure after side effects may already have happened. */
    FATAL
}
