package com.postrelay.accessor;

import com.postrelay.security.UnauthenticatedException;
import com.postrelay.storage.StorageHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * The two accessor slots a library seam resolves through: the current client and the current
 * storage handle.
 *
 * <p>Each slot is written once at startup and read concurrently afterwards, so an
 * {@link AtomicReference} is enough; no lock is taken on the read path. Installing a slot twice
 * fails, so a late install cannot silently swap the identity source under running requests.
 *
 * <p>Until a slot is installed it fails loudly: {@link #currentClient()} throws
 * {@link UnauthenticatedException} and {@link #currentStorage(String)} throws
 * {@link AccessorNotInstalledException}. There is no single-tenant fallback.
 *
 * <p>The process holds one registry per library seam (tool dispatch, publisher loop); the seams
 * never share slots.
 *
 * @param <C> the library's client type
 * @param <H> the storage handle type
 */
public final class AmbientAccessorRegistry<C, H extends StorageHandle> {

    private static final Logger log = LoggerFactory.getLogger(AmbientAccessorRegistry.class);

    private final String name;
    private final AtomicReference<ClientAccessor<C>> clientAccessor = new AtomicReference<>();
    private final AtomicReference<StorageAccessor<H>> storageAccessor = new AtomicReference<>();

    /**
     * Creates an empty registry.
     *
     * @param name the seam this registry serves (e.g. "tools", "publisher")
     */
    public AmbientAccessorRegistry(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        this.name = name;
    }

    /**
     * Installs the client accessor. Must run before any library code can call
     * {@link #currentClient()}.
     *
     * @throws IllegalStateException if a client accessor is already installed
     */
    public void installClientAccessor(ClientAccessor<C> accessor) {
        if (accessor == null) {
            throw new IllegalArgumentException("accessor must not be null");
        }
        if (!clientAccessor.compareAndSet(null, accessor)) {
            throw new IllegalStateException("client accessor of registry '" + name + "' is already installed");
        }
        log.info("Installed client accessor for '{}'", name);
    }

    /**
     * Installs the storage accessor. Must run before any library code can call
     * {@link #currentStorage(String)}.
     *
     * @throws IllegalStateException if a storage accessor is already installed
     */
    public void installStorageAccessor(StorageAccessor<H> accessor) {
        if (accessor == null) {
            throw new IllegalArgumentException("accessor must not be null");
        }
        if (!storageAccessor.compareAndSet(null, accessor)) {
            throw new IllegalStateException("storage accessor of registry '" + name + "' is already installed");
        }
        log.info("Installed storage accessor for '{}'", name);
    }

    /**
     * Returns the client for whoever is asking.
     *
     * @throws UnauthenticatedException if no accessor is installed, or the installed accessor
     *                                  finds no credential in scope
     */
    public C currentClient() {
        ClientAccessor<C> accessor = clientAccessor.get();
        if (accessor == null) {
            throw new UnauthenticatedException(
                    "client accessor of registry '" + name + "' used before installation");
        }
        return accessor.currentClient();
    }

    /**
     * Returns the calling thread's storage handle for the default path.
     */
    public H currentStorage() {
        return currentStorage(null);
    }

    /**
     * Returns the calling thread's storage handle for {@code path} (default path when null).
     *
     * @throws AccessorNotInstalledException if no storage accessor is installed
     */
    public H currentStorage(String path) {
        StorageAccessor<H> accessor = storageAccessor.get();
        if (accessor == null) {
            throw new AccessorNotInstalledException(name, "storage");
        }
        return accessor.currentStorage(path);
    }

    public boolean isClientAccessorInstalled() {
        return clientAccessor.get() != null;
    }

    public boolean isStorageAccessorInstalled() {
        return storageAccessor.get() != null;
    }

    public String name() {
        return name;
    }
}
