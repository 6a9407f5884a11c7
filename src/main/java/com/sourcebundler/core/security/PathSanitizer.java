package com.sourcebundler.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves display paths declared in a bundle against an output root and
 * refuses any resolution that leaves the root.
 * <p>
 * Resolution never throws: unsafe or unparsable paths are logged and yield an
 * empty result so the split can move on to the next entry.
 */
@Service
public class PathSanitizer {

    private static final Logger log = LoggerFactory.getLogger(PathSanitizer.class);

    /**
     * Canonical form of the output root used for all containment checks: the
     * real path when the root exists, otherwise its absolute normalized form.
     */
    public Path canonicalRoot(Path outputRoot) throws IOException {
        Path absolute = outputRoot.toAbsolutePath().normalize();
        return Files.exists(absolute) ? absolute.toRealPath() : absolute;
    }

    /**
     * Resolves {@code declaredPath} (POSIX syntax) below {@code outputRoot}.
     * <p>
     * A leading POSIX root is stripped, so {@code /etc/x} lands at {@code <root>/etc/x}.
     * Paths still absolute by host rules (drive letters, UNC) are rejected, as is
     * anything whose {@code ..} segments climb out of the root after normalization.
     *
     * @return the normalized target inside the root, or empty if the path is rejected
     */
    public Optional<Path> resolve(Path outputRoot, String declaredPath) {
        try {
            String relative = stripPosixRoot(declaredPath);
            if (relative.isEmpty()) {
                log.warn("Skipping empty path: {}", declaredPath);
                return Optional.empty();
            }

            Path relativePath = outputRoot.getFileSystem().getPath(relative);
            if (relativePath.isAbsolute() || relativePath.getRoot() != null) {
                log.warn("Skipping absolute path: {}", declaredPath);
                return Optional.empty();
            }

            Path base = canonicalRoot(outputRoot);
            Path target = base.resolve(relativePath).normalize();
            if (!target.startsWith(base) || target.equals(base)) {
                log.warn("Skipping unsafe path: {}", declaredPath);
                return Optional.empty();
            }
            return Optional.of(target);
        } catch (Exception e) {
            log.warn("Error processing path {}: {}", declaredPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns {@code true} if an existing path, with every symbolic link
     * resolved, still lies inside the output root.
     */
    public boolean staysInside(Path outputRoot, Path existing) {
        try {
            return existing.toRealPath().startsWith(canonicalRoot(outputRoot));
        } catch (IOException e) {
            log.warn("Cannot verify location of {}: {}", existing, e.getMessage());
            return false;
        }
    }

    private static String stripPosixRoot(String declaredPath) {
        int start = 0;
        while (start < declaredPath.length() && declaredPath.charAt(start) == '/') {
            start++;
        }
        return declaredPath.substring(start);
    }
}
