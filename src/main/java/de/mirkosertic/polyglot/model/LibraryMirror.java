package de.mirkosertic.polyglot.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * Binding of one source library to a hardlinked target directory and its host library.
 */
public class LibraryMirror {

    private UUID id = UUID.randomUUID();
    private UUID sourceLibraryId;
    private String sourceLibraryName = "";
    private @Nullable UUID targetLibraryId;
    private String targetLibraryName = "";
    private String targetPath = "";
    private @Nullable String collectionType;
    private SyncStatus status = SyncStatus.PENDING;
    private @Nullable Instant lastSyncedAt;
    private int lastSyncFileCount;
    private @Nullable String lastError;
    private @Nullable Instant createdAt = Instant.now();

    public LibraryMirror deepCopy() {
        final LibraryMirror copy = new LibraryMirror();
        copy.id = id;
        copy.sourceLibraryId = sourceLibraryId;
        copy.sourceLibraryName = sourceLibraryName;
        copy.targetLibraryId = targetLibraryId;
        copy.targetLibraryName = targetLibraryName;
        copy.targetPath = targetPath;
        copy.collectionType = collectionType;
        copy.status = status;
        copy.lastSyncedAt = lastSyncedAt;
        copy.lastSyncFileCount = lastSyncFileCount;
        copy.lastError = lastError;
        copy.createdAt = createdAt;
        return copy;
    }

    public UUID getId() {
        return id;
    }

    public void setId(final UUID id) {
        this.id = id;
    }

    public UUID getSourceLibraryId() {
        return sourceLibraryId;
    }

    public void setSourceLibraryId(final UUID sourceLibraryId) {
        this.sourceLibraryId = sourceLibraryId;
    }

    public String getSourceLibraryName() {
        return sourceLibraryName;
    }

    public void setSourceLibraryName(final String sourceLibraryName) {
        this.sourceLibraryName = sourceLibraryName;
    }

    public @Nullable UUID getTargetLibraryId() {
        return targetLibraryId;
    }

    public void setTargetLibraryId(final @Nullable UUID targetLibraryId) {
        this.targetLibraryId = targetLibraryId;
    }

    public String getTargetLibraryName() {
        return targetLibraryName;
    }

    public void setTargetLibraryName(final String targetLibraryName) {
        this.targetLibraryName = targetLibraryName;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public void setTargetPath(final String targetPath) {
        this.targetPath = targetPath;
    }

    public @Nullable String getCollectionType() {
        return collectionType;
    }

    public void setCollectionType(final @Nullable String collectionType) {
        this.collectionType = collectionType;
    }

    public SyncStatus getStatus() {
        return status;
    }

    public void setStatus(final SyncStatus status) {
        this.status = status;
    }

    public @Nullable Instant getLastSyncedAt() {
        return lastSyncedAt;
    }

    public void setLastSyncedAt(final @Nullable Instant lastSyncedAt) {
        this.lastSyncedAt = lastSyncedAt;
    }

    public int getLastSyncFileCount() {
        return lastSyncFileCount;
    }

    public void setLastSyncFileCount(final int lastSyncFileCount) {
        this.lastSyncFileCount = lastSyncFileCount;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    public void setLastError(final @Nullable String lastError) {
        this.lastError = lastError;
    }

    public @Nullable Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(final @Nullable Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "LibraryMirror{id=" + id + ", source=" + sourceLibraryName + ", target=" + targetLibraryName
                + ", status=" + status + "}";
    }
}
