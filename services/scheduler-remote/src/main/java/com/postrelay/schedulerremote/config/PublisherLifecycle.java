package com.postrelay.schedulerremote.config;

import com.postrelay.publisher.PublisherDaemon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the publisher daemon once the context is up and stops it on shutdown.
 *
 * <p>A failing startup check surfaces as {@code DaemonStartupException} and aborts application
 * startup.
 */
public class PublisherLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PublisherLifecycle.class);

    private final PublisherDaemon<?, ?> daemon;
    private final boolean enabled;
    private volatile boolean running;

    public PublisherLifecycle(PublisherDaemon<?, ?> daemon, boolean enabled) {
        this.daemon = daemon;
        this.enabled = enabled;
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("Publisher daemon disabled (postrelay.publisher.enabled=false)");
            return;
        }
        daemon.start();
        running = true;
    }

    @Override
    public void stop() {
        if (running) {
            daemon.stop();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
