package com.postrelay.accessor;

/**
 * The "current API client" accessor that library code calls without arguments.
 *
 * @param <C> the library's client type
 */
@FunctionalInterface
public interface ClientAccessor<C> {

    C currentClient();
}
