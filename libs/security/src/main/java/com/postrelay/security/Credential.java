package com.postrelay.security;

import com.postrelay.observability.TokenMasker;

import java.util.Optional;

/**
 * One authenticated caller's right to act against the upstream API.
 *
 * <p>WHY a record: immutable, compared by value, safe to hand between threads. Built fresh per
 * request from the verified session, or by the publisher daemon from whatever the token store
 * holds. Never persisted by this layer.
 *
 * <p>{@link #toString()} masks the access token so a credential can appear in a log statement
 * without leaking it.
 *
 * @param accessToken opaque upstream access token (required, non-blank)
 * @param subjectId   upstream subject identifier (nullable when the provider did not supply one)
 */
public record Credential(String accessToken, String subjectId) {

    public Credential {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be null or blank");
        }
        if (subjectId != null && subjectId.isBlank()) {
            subjectId = null;
        }
    }

    /**
     * Creates a credential without a subject identifier.
     */
    public static Credential of(String accessToken) {
        return new Credential(accessToken, null);
    }

    /**
     * Returns the subject identifier, if the provider supplied one.
     */
    public Optional<String> subject() {
        return Optional.ofNullable(subjectId);
    }

    @Override
    public String toString() {
        return "Credential[accessToken=" + TokenMasker.mask(accessToken)
                + ", subjectId=" + subjectId + "]";
    }
}
