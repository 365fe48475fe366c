package com.postrelay.observability;

/**
 * Masks bearer tokens before they reach a log line: a short prefix plus the total length.
 */
public final class TokenMasker {

    /** Number of leading characters kept by {@link #mask(String)}. */
    public static final int VISIBLE_PREFIX = 4;

    private TokenMasker() {
        // utility class
    }

    /**
     * Masks a secret for logging: keeps the first {@value #VISIBLE_PREFIX} characters and the
     * total length, e.g. {@code "AQXd…(212 chars)"}. Secrets no longer than the prefix are fully
     * hidden. {@code null} is rendered as {@code "<none>"}.
     *
     * @param secret the secret to mask
     * @return a log-safe rendering
     */
    public static String mask(String secret) {
        if (secret == null) {
            return "<none>";
        }
        if (secret.length() <= VISIBLE_PREFIX) {
            return "****";
        }
        return secret.substring(0, VISIBLE_PREFIX) + "…(" + secret.length() + " chars)";
    }
}
