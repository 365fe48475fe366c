package com.postrelay.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps one open {@link StorageHandle} per worker thread, keyed by the thread itself.
 *
 * <p>WHY an explicit map instead of a ThreadLocal: the cache has to be able to list and close
 * handles of threads that have died, and at shutdown. Each entry is only ever read, replaced or
 * closed by its owning thread; {@link #evictTerminated()} touches entries of dead threads only,
 * and {@link #closeAll()} is reserved for shutdown.
 *
 * <p>{@link #get(String)} returns the calling thread's cached handle when the path matches.
 * A different path closes the cached handle and opens a new one. If opening fails the entry stays
 * empty and {@link ResourceOpenException} propagates. Concurrent access to the same underlying
 * resource from several handles is the storage engine's concern (e.g. file locking).
 *
 * <p>Every open first evicts the entries of terminated threads, so a pool that replaces its
 * workers does not accumulate handles. Cache hits never scan.
 *
 * @param <H> the handle type
 */
public final class ThreadAffineHandleCache<H extends StorageHandle> {

    private static final Logger log = LoggerFactory.getLogger(ThreadAffineHandleCache.class);

    private final ConcurrentMap<Thread, Entry<H>> entries = new ConcurrentHashMap<>();
    private final StorageOpener<H> opener;
    private final String name;

    /**
     * Creates a cache.
     *
     * @param name   descriptive name used in log lines (e.g. "request", "publisher")
     * @param opener opens a fresh handle for a path
     */
    public ThreadAffineHandleCache(String name, StorageOpener<H> opener) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (opener == null) {
            throw new IllegalArgumentException("opener must not be null");
        }
        this.name = name;
        this.opener = opener;
    }

    /**
     * Returns the calling thread's handle for {@code path}, opening (and replacing) as needed.
     * Opening also evicts the handles of threads that have terminated.
     *
     * @param path resource path (must not be null or blank)
     * @return a handle owned by the calling thread
     * @throws ResourceOpenException if a new handle had to be opened and opening failed
     */
    public H get(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be null or blank");
        }
        Thread owner = Thread.currentThread();
        Entry<H> cached = entries.get(owner);
        if (cached != null) {
            if (cached.path().equals(path)) {
                return cached.handle();
            }
            entries.remove(owner);
            log.debug("[{}] path changed on {} from '{}' to '{}', closing cached handle",
                    name, owner.getName(), cached.path(), path);
            closeReplaced(cached);
        }

        evictTerminated();
        H handle = open(path);
        entries.put(owner, new Entry<>(path, handle));
        log.debug("[{}] opened storage handle for '{}' on {}", name, path, owner.getName());
        return handle;
    }

    /**
     * Returns the calling thread's cached handle without opening anything.
     */
    public Optional<H> peek() {
        Entry<H> cached = entries.get(Thread.currentThread());
        return cached == null ? Optional.empty() : Optional.of(cached.handle());
    }

    /**
     * Closes and removes the entries of threads that have terminated.
     *
     * @return number of entries evicted
     */
    public int evictTerminated() {
        int evicted = 0;
        for (Map.Entry<Thread, Entry<H>> e : entries.entrySet()) {
            if (!e.getKey().isAlive() && entries.remove(e.getKey(), e.getValue())) {
                closeReplaced(e.getValue());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("[{}] evicted {} handle(s) of terminated threads", name, evicted);
        }
        return evicted;
    }

    /**
     * Closes every cached handle. Only for process shutdown, once worker threads have stopped
     * using their handles.
     */
    public void closeAll() {
        for (Thread owner : entries.keySet()) {
            Entry<H> removed = entries.remove(owner);
            if (removed != null) {
                closeReplaced(removed);
            }
        }
        log.debug("[{}] closed all cached storage handles", name);
    }

    /**
     * Number of threads currently holding a cached handle.
     */
    public int size() {
        return entries.size();
    }

    private H open(String path) {
        H handle;
        try {
            handle = opener.open(path);
        } catch (ResourceOpenException e) {
            throw e;
        } catch (Exception e) {
            throw new ResourceOpenException(path, e);
        }
        if (handle == null) {
            throw new ResourceOpenException(path, "storage opener returned no handle");
        }
        return handle;
    }

    private void closeReplaced(Entry<H> entry) {
        try {
            entry.handle().close();
        } catch (RuntimeException e) {
            log.warn("[{}] failed to close storage handle for '{}': {}", name, entry.path(), e.getMessage(), e);
        }
    }

    private record Entry<H>(String path, H handle) {}
}
