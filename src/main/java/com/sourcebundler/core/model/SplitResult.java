package com.sourcebundler.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a split.
 *
 * @param writtenFiles        every target opened, in bundle order (a path repeats when overwritten)
 * @param renamedCount        targets written under a collision-suffixed name
 * @param skippedCount        entries rejected as unsafe or excluded by a filter rule
 * @param failedCount         entries abandoned on an I/O error or exhausted renames
 * @param errorBlockCount     error blocks passed over
 * @param unterminatedCount   targets still open at end of stream
 */
public record SplitResult(
    List<Path> writtenFiles,
    int renamedCount,
    int skippedCount,
    int failedCount,
    int errorBlockCount,
    int unterminatedCount
) {
    public SplitResult {
        writtenFiles = List.copyOf(writtenFiles);
    }

    public int writtenCount() {
        return writtenFiles.size();
    }
}
