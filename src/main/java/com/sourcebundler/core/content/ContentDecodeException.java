package com.sourcebundler.core.content;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when no configured encoding decodes a file into text that passes the
 * binary-content check.
 */
public class ContentDecodeException extends IOException {

    /** Message written into the bundle's error block for this failure. */
    public static final String CANONICAL_MESSAGE = "Cannot read file (binary or unsupported encoding)";

    public ContentDecodeException(Path file) {
        super("Failed to decode " + file + " with supported encodings");
    }
}
