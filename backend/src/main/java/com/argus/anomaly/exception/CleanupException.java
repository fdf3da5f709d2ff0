package com.argus.anomaly.exception;

import java.nio.file.Path;

/** Scratch file removal failed. Logged, never surfaced to the client. */
public class CleanupException extends RuntimeException {

    private final Path path;

    public CleanupException(Path path, Throwable cause) {
        super("Failed to remove scratch file " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
