package com.postrelay.accessor;

import com.postrelay.storage.StorageHandle;

/**
 * The "current storage handle" accessor that library code calls.
 *
 * @param <H> the handle type
 */
@FunctionalInterface
public interface StorageAccessor<H extends StorageHandle> {

    /**
     * Returns a handle for {@code path}, or for the default path when {@code path} is null.
     */
    H currentStorage(String path);
}
