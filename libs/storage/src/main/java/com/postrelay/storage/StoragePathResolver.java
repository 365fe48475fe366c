package com.postrelay.storage;

/**
 * Supplies the default resource path used when library code asks for storage without naming one.
 */
@FunctionalInterface
public interface StoragePathResolver {

    String resolveStoragePath();
}
