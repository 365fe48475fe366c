package com.postrelay.schedulerremote.web;

import com.postrelay.schedulerremote.config.AuthProperties;
import com.postrelay.security.Credential;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Reads the upstream token and subject id from request attributes set by the OAuth layer after it
 * verified the caller's bearer token (default keys {@code linkedin_access_token} and {@code sub}).
 */
public class RequestAttributeTokenResolver implements UpstreamTokenResolver {

    private final String tokenKey;
    private final String subjectKey;

    public RequestAttributeTokenResolver(AuthProperties properties) {
        this.tokenKey = properties.upstreamTokenKey();
        this.subjectKey = properties.subjectKey();
    }

    @Override
    public Optional<Credential> resolve(HttpServletRequest request) {
        String token = attribute(request, tokenKey);
        if (token == null) {
            return Optional.empty();
        }
        return Optional.of(new Credential(token, attribute(request, subjectKey)));
    }

    private static String attribute(HttpServletRequest request, String key) {
        Object value = request.getAttribute(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
