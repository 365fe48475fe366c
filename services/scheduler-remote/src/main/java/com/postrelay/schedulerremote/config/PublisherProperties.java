package com.postrelay.schedulerremote.config;

import com.postrelay.publisher.DaemonSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Publisher daemon settings, bound from {@code postrelay.publisher.*}.
 *
 * <pre>
 * postrelay:
 *   publisher:
 *     enabled: true
 *     poll-interval-seconds: 60
 *     data-dir: data
 *     storage-file: scheduled_posts.db
 *     thread-name: publisher-daemon
 * </pre>
 *
 * @param enabled             whether the daemon is started with the application (default true)
 * @param pollIntervalSeconds seconds between ticks (default 60; 0 means default)
 * @param dataDir             directory holding the storage file; created at startup, must be writable
 * @param storageFile         storage file name inside {@code dataDir}
 * @param threadName          name of the daemon thread
 */
@ConfigurationProperties(prefix = "postrelay.publisher")
@Validated
public record PublisherProperties(
        Boolean enabled,
        @Positive int pollIntervalSeconds,
        @NotBlank String dataDir,
        @NotBlank String storageFile,
        String threadName) {

    /**
     * Applies defaults. Runs before Bean Validation, so only explicit bad values are rejected.
     */
    public PublisherProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (pollIntervalSeconds == 0) {
            pollIntervalSeconds = 60;
        }
        if (dataDir == null || dataDir.isBlank()) {
            dataDir = "data";
        }
        if (storageFile == null || storageFile.isBlank()) {
            storageFile = "scheduled_posts.db";
        }
        if (threadName == null || threadName.isBlank()) {
            threadName = DaemonSettings.DEFAULT_THREAD_NAME;
        }
    }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    /**
     * Default storage path handed to the library: {@code dataDir/storageFile}.
     */
    public Path storagePath() {
        return dataPath().resolve(storageFile);
    }

    public DaemonSettings toDaemonSettings() {
        return new DaemonSettings(Duration.ofSeconds(pollIntervalSeconds), threadName, null);
    }
}
