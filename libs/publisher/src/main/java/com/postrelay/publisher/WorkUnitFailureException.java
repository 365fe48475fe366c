package com.postrelay.publisher;

/**
 * Records why a publisher tick failed. Logged and kept as the daemon's last failure; never thrown
 * out of the loop.
 */
public class WorkUnitFailureException extends RuntimeException {

    private final long tick;

    public WorkUnitFailureException(long tick, Throwable cause) {
        super("Publisher tick %d failed: %s".formatted(tick, cause.getMessage()), cause);
        this.tick = tick;
    }

    public long tick() {
        return tick;
    }
}
