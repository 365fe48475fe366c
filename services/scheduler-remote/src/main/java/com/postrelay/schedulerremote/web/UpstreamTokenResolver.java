package com.postrelay.schedulerremote.web;

import com.postrelay.security.Credential;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Finds the upstream credential of the verified caller of a request.
 *
 * <p>Implemented by the OAuth layer, which knows where the verified session keeps the upstream
 * token. Must not authenticate anything itself: a request that was not verified resolves to empty.
 */
@FunctionalInterface
public interface UpstreamTokenResolver {

    Optional<Credential> resolve(HttpServletRequest request);
}
