package com.postrelay.publisher;

/**
 * Thrown when the publisher needs an upstream credential and the token store has none.
 * <p>
 * Expected until the first user completes OAuth; the daemon treats it as a skipped tick.
 */
public class NoCredentialAvailableException extends RuntimeException {

    public NoCredentialAvailableException() {
        super("No upstream credentials in token store; authenticate via OAuth first");
    }

    public NoCredentialAvailableException(String message) {
        super(message);
    }
}
