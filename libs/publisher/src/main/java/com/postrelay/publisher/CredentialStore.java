package com.postrelay.publisher;

import com.postrelay.security.Credential;

import java.util.Optional;

/**
 * Read access to the token store for the publisher, which has no inbound request to take an
 * identity from. Supplied by the OAuth collaborator.
 */
@FunctionalInterface
public interface CredentialStore {

    /**
     * Returns any one stored upstream credential, or empty when nobody has authenticated yet.
     * Which one is returned when several are stored is up to the store.
     */
    Optional<Credential> findAnyStoredCredential();
}
