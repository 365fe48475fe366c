package com.postrelay.accessor;

import com.postrelay.storage.StorageHandle;
import com.postrelay.storage.StoragePathResolver;
import com.postrelay.storage.ThreadAffineHandleCache;

/**
 * Storage accessor backed by a {@link ThreadAffineHandleCache}: every thread gets its own handle,
 * and a null path means the resolver's default path.
 *
 * @param <H> the handle type
 */
public final class ThreadAffineStorageAccessor<H extends StorageHandle> implements StorageAccessor<H> {

    private final ThreadAffineHandleCache<H> cache;
    private final StoragePathResolver defaultPath;

    public ThreadAffineStorageAccessor(ThreadAffineHandleCache<H> cache, StoragePathResolver defaultPath) {
        if (cache == null) {
            throw new IllegalArgumentException("cache must not be null");
        }
        if (defaultPath == null) {
            throw new IllegalArgumentException("defaultPath must not be null");
        }
        this.cache = cache;
        this.defaultPath = defaultPath;
    }

    @Override
    public H currentStorage(String path) {
        return cache.get(path != null ? path : defaultPath.resolveStoragePath());
    }

    /**
     * The cache this accessor reads through.
     */
    public ThreadAffineHandleCache<H> cache() {
        return cache;
    }
}
