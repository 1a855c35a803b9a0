package de.mirkosertic.polyglot.mirror;

/**
 * Receives progress of a sync in percent (0 to 100).
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(double percent);
}
