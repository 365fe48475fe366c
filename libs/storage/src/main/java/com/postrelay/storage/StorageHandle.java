package com.postrelay.storage;

/**
 * An open connection to the scheduled-item store, as handed out by the storage engine.
 * <p>
 * A handle is thread-affine: only the thread that opened it may use or close it.
 * {@link ThreadAffineHandleCache} enforces that for cached handles.
 */
public interface StorageHandle extends AutoCloseable {

    /**
     * The resource path this handle was opened for.
     */
    String path();

    /**
     * Releases the handle. Implementations should be idempotent.
     */
    @Override
    void close();
}
