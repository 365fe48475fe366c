package com.postrelay.publisher;

/**
 * Thrown by {@link PublisherDaemon#start()} when a startup check fails. The loop is not started.
 */
public class DaemonStartupException extends RuntimeException {

    public DaemonStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
