package com.sourcebundler.core.metrics;

import com.sourcebundler.core.model.MergeResult;
import com.sourcebundler.core.model.SplitResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BundlerMetricsTest {

    private SimpleMeterRegistry registry;
    private BundlerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new BundlerMetrics(registry);
    }

    @Test
    @DisplayName("recordMerge times the run and counts files by result")
    void recordMerge() {
        metrics.recordMerge(MergeResult.of(4, 1, 100), 250);

        var timer = registry.find("bundler.merge.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(3.0, registry.find("bundler.merge.files").tag("result", "bundled").counter().count());
        assertEquals(1.0, registry.find("bundler.merge.files").tag("result", "error").counter().count());
    }

    @Test
    @DisplayName("recordSplit counts entries by result")
    void recordSplit() {
        var result = new SplitResult(List.of(Path.of("a"), Path.of("b")), 1, 3, 1, 0, 0);
        metrics.recordSplit(result, 40);
        metrics.recordSplit(result, 60);

        assertEquals(2, registry.find("bundler.split.duration").timer().count());
        assertEquals(4.0, registry.find("bundler.split.entries").tag("result", "written").counter().count());
        assertEquals(2.0, registry.find("bundler.split.entries").tag("result", "renamed").counter().count());
        assertEquals(6.0, registry.find("bundler.split.entries").tag("result", "skipped").counter().count());
        assertEquals(2.0, registry.find("bundler.split.entries").tag("result", "failed").counter().count());
    }
}
