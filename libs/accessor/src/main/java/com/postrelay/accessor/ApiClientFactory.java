package com.postrelay.accessor;

import com.postrelay.security.Credential;

/**
 * Builds a library client that acts as the holder of {@code credential}. Supplied by the library.
 *
 * @param <C> the library's client type
 */
@FunctionalInterface
public interface ApiClientFactory<C> {

    C create(Credential credential);
}
