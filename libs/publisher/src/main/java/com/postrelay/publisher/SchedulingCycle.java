package com.postrelay.publisher;

/**
 * One unit of scheduled work: publish whatever is due. Supplied by the scheduling library.
 * <p>
 * The cycle reaches its client and storage through the publisher's accessor registry, never
 * through parameters.
 */
@FunctionalInterface
public interface SchedulingCycle {

    /**
     * Runs one cycle.
     *
     * @throws Exception on any internal failure; the daemon logs it and carries on
     */
    void runOnce() throws Exception;
}
