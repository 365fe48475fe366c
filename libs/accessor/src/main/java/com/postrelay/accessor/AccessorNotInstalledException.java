package com.postrelay.accessor;

/**
 * Thrown when library code calls the storage accessor before one was installed.
 * <p>
 * WHY an IllegalStateException: it means startup ordering is wrong (library code ran before the
 * accessors were installed), not that the caller did something recoverable.
 */
public class AccessorNotInstalledException extends IllegalStateException {

    private final String registry;

    public AccessorNotInstalledException(String registry, String accessor) {
        super("%s accessor of registry '%s' used before installation".formatted(accessor, registry));
        this.registry = registry;
    }

    public String registry() {
        return registry;
    }
}
