package com.sourcebundler.core.security;

import com.sourcebundler.core.config.BundlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Picks the file a split entry is written to when its target already exists.
 * <p>
 * An existing entry is renamed around as {@code <stem>_<n><ext>} unless overwrite
 * is on and the entry is a plain file. Symbolic links count as non-file entries,
 * so a link is never written through.
 */
@Service
public class CollisionResolver {

    private static final Logger log = LoggerFactory.getLogger(CollisionResolver.class);

    private final int maxAttempts;

    @Autowired
    public CollisionResolver(BundlerProperties properties) {
        this(properties.getSplit().getMaxRenameAttempts());
    }

    CollisionResolver(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param target    the sanitized target path
     * @param overwrite whether an existing plain file may be replaced in place
     * @return {@code target} itself, or the first free suffixed sibling
     * @throws RenameAttemptsExhaustedException if {@code maxAttempts} suffixes are all taken
     */
    public Path resolve(Path target, boolean overwrite) throws RenameAttemptsExhaustedException {
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return target;
        }
        if (overwrite && Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
            log.debug("Overwriting existing file {}", target);
            return target;
        }

        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        boolean hasExt = dot > 0 && dot < name.length() - 1;
        String stem = hasExt ? name.substring(0, dot) : name;
        String ext = hasExt ? name.substring(dot) : "";

        for (int n = 1; n <= maxAttempts; n++) {
            Path candidate = target.resolveSibling(stem + "_" + n + ext);
            if (!Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
                log.info("Duplicate filename detected. Renamed to: {}", candidate.getFileName());
                return candidate;
            }
        }
        throw new RenameAttemptsExhaustedException(target, maxAttempts);
    }
}
