package com.postrelay.storage;

/**
 * Thrown when a storage handle cannot be opened for a path.
 * <p>
 * Propagates to whoever asked for the handle; the asking thread's cache entry is left empty so
 * the next request for the same path tries again.
 */
public class ResourceOpenException extends RuntimeException {

    private final String path;

    public ResourceOpenException(String path, Throwable cause) {
        super("Failed to open storage at '%s': %s".formatted(path, cause.getMessage()), cause);
        this.path = path;
    }

    public ResourceOpenException(String path, String reason) {
        super("Failed to open storage at '%s': %s".formatted(path, reason));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
