package com.postrelay.publisher;

/**
 * Lifecycle of the publisher daemon: {@code IDLE → AWAIT_TICK ⇄ RUN_UNIT}. {@code STOPPED} is
 * only reached at process shutdown.
 */
public enum DaemonState {
    IDLE,
    AWAIT_TICK,
    RUN_UNIT,
    STOPPED
}
