package com.sourcebundler.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Inputs of one merge, supplied by the caller at invocation time.
 */
public record MergeRequest(
    Path sourceRoot,
    Path outputFile,
    ExtensionSet extensions,
    List<FilterRule> filters
) {
    public MergeRequest {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
