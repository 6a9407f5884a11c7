package com.sourcebundler.core.security;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when no free collision-suffixed name was found for a target within
 * the configured number of attempts. Fatal only for that one entry.
 */
public class RenameAttemptsExhaustedException extends IOException {

    private final Path target;

    public RenameAttemptsExhaustedException(Path target, int attempts) {
        super("No free name for " + target + " after " + attempts + " attempts");
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
