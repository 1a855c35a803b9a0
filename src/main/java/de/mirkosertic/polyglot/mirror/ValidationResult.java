package de.mirkosertic.polyglot.mirror;

import org.jspecify.annotations.Nullable;

/**
 * Result of {@link MirrorValidator#validate}. Carries a description when invalid.
 */
public record ValidationResult(boolean valid, @Nullable String errorMessage) {

    public static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult error(final String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }
}
