package com.postrelay.publisher;

import java.time.Duration;

/**
 * Tuning for {@link PublisherDaemon}.
 *
 * @param pollInterval    delay between the end of one tick and the start of the next
 * @param threadName      name of the dedicated daemon thread
 * @param shutdownTimeout how long {@link PublisherDaemon#stop()} waits for a running tick
 */
public record DaemonSettings(Duration pollInterval, String threadName, Duration shutdownTimeout) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
    public static final String DEFAULT_THREAD_NAME = "publisher-daemon";
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public DaemonSettings {
        if (pollInterval == null) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (threadName == null || threadName.isBlank()) {
            threadName = DEFAULT_THREAD_NAME;
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        }
    }

    /**
     * Default settings: 60 s interval, thread "publisher-daemon".
     */
    public static DaemonSettings defaults() {
        return new DaemonSettings(DEFAULT_POLL_INTERVAL, DEFAULT_THREAD_NAME, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Default settings with the given interval in seconds.
     */
    public static DaemonSettings everySeconds(long seconds) {
        return new DaemonSettings(Duration.ofSeconds(seconds), DEFAULT_THREAD_NAME, DEFAULT_SHUTDOWN_TIMEOUT);
    }
}
