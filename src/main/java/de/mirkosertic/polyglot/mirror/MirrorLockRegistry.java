package de.mirkosertic.polyglot.mirror;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One exclusive lock per mirror id. Locks are held weakly: an entry disappears once no thread
 * references its lock anymore, and a deleted mirror's entry is evicted explicitly.
 */
public class MirrorLockRegistry {

    private final Cache<UUID, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public ReentrantLock lockFor(final UUID mirrorId) {
        return locks.get(mirrorId, id -> new ReentrantLock());
    }

    public void evict(final UUID mirrorId) {
        locks.invalidate(mirrorId);
    }

    long size() {
        locks.cleanUp();
        return locks.estimatedSize();
    }
}
