package com.postrelay.security;

/**
 * Thrown when code asks for the caller's identity and none is in scope.
 * <p>
 * WHY a RuntimeException: reaching a client accessor outside an authenticated request is a wiring
 * error, not something the caller can retry. It surfaces to the request caller, which turns it
 * into a 401.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
