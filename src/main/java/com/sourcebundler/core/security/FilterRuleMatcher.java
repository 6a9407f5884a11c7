package com.sourcebundler.core.security;

import com.sourcebundler.core.model.FilterRule;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches the active {@link FilterRule}s against single path segments.
 * <p>
 * A path is excluded when its file name or any of its directory names matches
 * any active rule. Matchers are compiled once; an invalid glob fails at
 * construction with {@link IllegalArgumentException}.
 */
public class FilterRuleMatcher {

    private final List<PathMatcher> matchers;

    public FilterRuleMatcher(List<FilterRule> rules) {
        var compiled = new ArrayList<PathMatcher>();
        for (FilterRule rule : rules) {
            if (rule.active() && rule.globPattern() != null && !rule.globPattern().isBlank()) {
                compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + rule.globPattern()));
            }
        }
        this.matchers = List.copyOf(compiled);
    }

    public boolean matchesSegment(String segment) {
        if (matchers.isEmpty() || segment.isEmpty()) {
            return false;
        }
        Path name;
        try {
            name = Paths.get(segment);
        } catch (InvalidPathException e) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if any name element of the relative path matches.
     */
    public boolean excludes(Path relativePath) {
        for (Path component : relativePath) {
            if (matchesSegment(component.toString())) {
                return true;
            }
        }
        return false;
    }
}
