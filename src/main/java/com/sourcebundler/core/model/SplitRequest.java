package com.sourcebundler.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Inputs of one split, supplied by the caller at invocation time.
 */
public record SplitRequest(
    Path bundleFile,
    Path outputRoot,
    boolean overwrite,
    List<FilterRule> filters
) {
    public SplitRequest {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
