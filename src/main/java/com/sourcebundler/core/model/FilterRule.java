package com.sourcebundler.core.model;

/**
 * A glob pattern excluding matching entries from both merge and split.
 * <p>
 * The pattern is matched against a single path segment (a file or directory
 * name), never against a whole path.
 *
 * @param globPattern glob in {@link java.nio.file.FileSystem#getPathMatcher} syntax, without the {@code glob:} prefix
 * @param active      inactive rules are kept for display but never match
 */
public record FilterRule(
    String globPattern,
    boolean active
) {

    public static FilterRule of(String globPattern) {
        return new FilterRule(globPattern, true);
    }
}
