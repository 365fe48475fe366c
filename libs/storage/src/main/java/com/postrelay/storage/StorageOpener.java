package com.postrelay.storage;

/**
 * Opens a {@link StorageHandle} for a resource path. Supplied by the storage engine.
 *
 * @param <H> the handle type
 */
@FunctionalInterface
public interface StorageOpener<H extends StorageHandle> {

    /**
     * Opens a fresh handle for {@code path}.
     *
     * @param path resource path (e.g. a database file)
     * @return the open handle, never null
     * @throws Exception if the engine cannot open the resource
     */
    H open(String path) throws Exception;
}
