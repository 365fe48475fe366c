package com.postrelay.publisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A precondition verified once before the publisher loop starts. A failing check means the daemon
 * could never do useful work, so it is not started at all.
 */
@FunctionalInterface
public interface StartupCheck {

    void verify() throws Exception;

    /**
     * A check that passes unconditionally.
     */
    static StartupCheck none() {
        return () -> { };
    }

    /**
     * Creates {@code directory} if missing and requires it to be writable.
     */
    static StartupCheck writableDirectory(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        return () -> {
            Files.createDirectories(directory);
            if (!Files.isWritable(directory)) {
                throw new IOException("data directory is not writable: " + directory.toAbsolutePath());
            }
        };
    }
}
