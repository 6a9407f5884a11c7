package com.sourcebundler.core.config;

import com.sourcebundler.core.model.ExtensionSet;
import com.sourcebundler.core.model.FilterRule;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Defaults for merge and split, bound from {@code bundler.*}.
 * <p>
 * Callers may override any of these per invocation; the codec itself only ever
 * sees the values passed in with a request.
 */
@Component
@ConfigurationProperties(prefix = "bundler")
public class BundlerProperties {

    private List<String> extensions = List.of(".py", ".rs", ".c", ".h", ".cpp", ".hpp", ".css");
    private List<Filter> filters = List.of();
    private boolean overwrite = false;
    private List<String> encodings = List.of("UTF-8", "windows-1252", "ISO-8859-1");
    private Binary binary = new Binary();
    private Split split = new Split();

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public void setFilters(List<Filter> filters) {
        this.filters = filters;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public void setOverwrite(boolean overwrite) {
        this.overwrite = overwrite;
    }

    public List<String> getEncodings() {
        return encodings;
    }

    public void setEncodings(List<String> encodings) {
        this.encodings = encodings;
    }

    public Binary getBinary() {
        return binary;
    }

    public void setBinary(Binary binary) {
        this.binary = binary;
    }

    public Split getSplit() {
        return split;
    }

    public void setSplit(Split split) {
        this.split = split;
    }

    public ExtensionSet extensionSet() {
        return ExtensionSet.of(extensions);
    }

    public List<FilterRule> filterRules() {
        return filters.stream()
                .map(f -> new FilterRule(f.getPattern(), f.isActive()))
                .toList();
    }

    public static class Filter {
        private String pattern;
        private boolean active = true;

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }

    /** Tuning of the binary-content heuristic. */
    public static class Binary {
        private int sampleSize = 8192;
        private double maxNonPrintableRatio = 0.10;

        public int getSampleSize() {
            return sampleSize;
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
        }

        public double getMaxNonPrintableRatio() {
            return maxNonPrintableRatio;
        }

        public void setMaxNonPrintableRatio(double maxNonPrintableRatio) {
            this.maxNonPrintableRatio = maxNonPrintableRatio;
        }
    }

    public static class Split {
        private int maxRenameAttempts = 10_000;
        private int maxErrorBlockLines = 1_000;
        private int progressStride = 100;

        public int getMaxRenameAttempts() {
            return maxRenameAttempts;
        }

        public void setMaxRenameAttempts(int maxRenameAttempts) {
            this.maxRenameAttempts = maxRenameAttempts;
        }

        public int getMaxErrorBlockLines() {
            return maxErrorBlockLines;
        }

        public void setMaxErrorBlockLines(int maxErrorBlockLines) {
            this.maxErrorBlockLines = maxErrorBlockLines;
        }

        public int getProgressStride() {
            return progressStride;
        }

        public void setProgressStride(int progressStride) {
            this.progressStride = progressStride;
        }
    }
}
