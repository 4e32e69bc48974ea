package com.layergen.writer;

import java.nio.file.Path;

/**
 * Thrown when a generated file could not be written. The destination is left as it was.
 */
public class WriteFailureException extends RuntimeException {
    private final transient Path path;

    public WriteFailureException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
