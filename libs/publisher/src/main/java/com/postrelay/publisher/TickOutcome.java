package com.postrelay.publisher;

/**
 * Result of one publisher tick.
 */
public enum TickOutcome {

    /** The scheduling cycle ran to completion. */
    SUCCESS,

    /** No stored credential was available; the cycle was not run. */
    SKIPPED,

    /** The cycle (or credential lookup) failed; logged, loop continues. */
    FAILED
}
