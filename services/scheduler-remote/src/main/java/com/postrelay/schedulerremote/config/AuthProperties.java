package com.postrelay.schedulerremote.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the OAuth layer leaves the verified caller's upstream identity on the request.
 *
 * @param upstreamTokenKey request attribute holding the upstream access token
 * @param subjectKey       request attribute holding the subject id
 */
@ConfigurationProperties(prefix = "postrelay.auth")
public record AuthProperties(String upstreamTokenKey, String subjectKey) {

    public AuthProperties {
        if (upstreamTokenKey == null || upstreamTokenKey.isBlank()) {
            upstreamTokenKey = "linkedin_access_token";
        }
        if (subjectKey == null || subjectKey.isBlank()) {
            subjectKey = "sub";
        }
    }
}
