package org.dxworks.codegraph.engine;

import java.nio.file.Path;

/** A source file could not be read: missing, not permitted, or not valid UTF-8. */
public class SourceReadException extends Exception {
    private final Path path;

    public SourceReadException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
