package com.sourcebundler.core.metrics;

import com.sourcebundler.core.model.MergeResult;
import com.sourcebundler.core.model.SplitResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for merge and split runs.
 */
@Service
public class BundlerMetrics {

    private final MeterRegistry registry;

    public BundlerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMerge(MergeResult result, long ms) {
        Timer.builder("bundler.merge.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        incrementFiles("bundled", result.bundledCount());
        incrementFiles("error", result.errorCount());
    }

    public void recordSplit(SplitResult result, long ms) {
        Timer.builder("bundler.split.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        incrementEntries("written", result.writtenCount());
        incrementEntries("renamed", result.renamedCount());
        incrementEntries("skipped", result.skippedCount());
        incrementEntries("failed", result.failedCount());
    }

    private void incrementFiles(String result, int amount) {
        Counter.builder("bundler.merge.files")
                .description("Files listed in merged bundles")
                .tag("result", result)
                .register(registry)
                .increment(amount);
    }

    private void incrementEntries(String result, int amount) {
        Counter.builder("bundler.split.entries")
                .description("Bundle entries processed by split")
                .tag("result", result)
                .register(registry)
                .increment(amount);
    }
}
