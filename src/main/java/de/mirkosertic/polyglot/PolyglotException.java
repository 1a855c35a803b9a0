package de.mirkosertic.polyglot;

/**
 * Checked exception raised by mirror, access and administration operations.
 */
public class PolyglotException extends Exception {

    private final ErrorKind kind;

    public PolyglotException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public PolyglotException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static PolyglotException notFound(final String message) {
        return new PolyglotException(ErrorKind.NOT_FOUND, message);
    }

    public static PolyglotException validation(final String message) {
        return new PolyglotException(ErrorKind.VALIDATION, message);
    }

    public static PolyglotException conflict(final String message) {
        return new PolyglotException(ErrorKind.CONFLICT, message);
    }

    public static PolyglotException fatal(final String message, final Throwable cause) {
        return new PolyglotException(ErrorKind.FATAL, message, cause);
    }
}
