package com.vidnyan.codequest.application.port.out;

import java.nio.file.Path;

/**
 * A single source file could not be read or parsed.
 */
public class SourceParseException extends Exception {

    private final Path file;

    public SourceParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public SourceParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
