package com.sourcebundler.core.bundle;

/**
 * Synchronous progress callback, invoked inline on the calling thread.
 * Merge reports per file; split reports at a fixed line stride and once on completion.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total) -> {};

    void onProgress(int current, int total);
}
