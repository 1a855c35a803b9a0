package de.mirkosertic.polyglot.mirror;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Diff between a source tree and its mirror, as relative paths.
 */
public record SyncPlan(
        /** Relative paths to delete from the mirror; executed first. */
        List<String> toRemove,
        /** Relative paths to hardlink from the source; executed after the removals. */
        List<String> toAdd,
        /** Number of files already up to date. */
        int unchangedCount
) {

    /**
     * A file missing from the target is added. A file whose size or modification time differs is
     * removed and added again so the link points at the current source inode. A target file with
     * no source counterpart is removed.
     */
    public static SyncPlan compute(final Map<String, FileSignature> source, final Map<String, FileSignature> target) {
        final List<String> toRemove = new ArrayList<>();
        final List<String> toAdd = new ArrayList<>();
        int unchanged = 0;

        for (final Map.Entry<String, FileSignature> entry : source.entrySet()) {
            final FileSignature targetSignature = target.get(entry.getKey());
            if (targetSignature == null) {
                toAdd.add(entry.getKey());
            } else if (!targetSignature.equals(entry.getValue())) {
                toRemove.add(entry.getKey());
                toAdd.add(entry.getKey());
            } else {
                unchanged++;
            }
        }

        for (final String relativePath : target.keySet()) {
            if (!source.containsKey(relativePath)) {
                toRemove.add(relativePath);
            }
        }

        return new SyncPlan(toRemove, toAdd, unchanged);
    }

    public int totalOperations() {
        return toRemove.size() + toAdd.size();
    }

    public boolean isEmpty() {
        return toRemove.isEmpty() && toAdd.isEmpty();
    }
}
