package com.sourcebundler.core.model;

/**
 * Outcome of a merge.
 *
 * @param fileCount       files listed in the bundle, readable or not
 * @param errorCount      files written as error blocks
 * @param charCount       characters emitted into the bundle
 * @param estimatedTokens {@code charCount / 4}; a sizing hint, not a tokenizer result
 */
public record MergeResult(
    int fileCount,
    int errorCount,
    long charCount,
    long estimatedTokens
) {
    public static MergeResult of(int fileCount, int errorCount, long charCount) {
        return new MergeResult(fileCount, errorCount, charCount, charCount / 4);
    }

    public int bundledCount() {
        return fileCount - errorCount;
    }
}
