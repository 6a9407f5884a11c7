package com.sourcebundler.dispatch.cli;

import com.sourcebundler.core.config.BundlerProperties;
import com.sourcebundler.core.engine.BundleEngine;
import com.sourcebundler.core.model.ExtensionSet;
import com.sourcebundler.core.model.FilterRule;
import com.sourcebundler.core.model.MergeRequest;
import com.sourcebundler.core.model.MergeResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: scb merge &lt;source-dir&gt; &lt;output-file&gt;
 * <p>
 * Bundles every matching file below the source directory into one file.
 * Extensions and exclusion globs default to the configured {@code bundler.*} values.
 */
@Command(name = "merge", mixinStandardHelpOptions = true, description = "Merge a source tree into one bundle file")
@Component
public class MergeCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "SOURCE_DIR", description = "Directory to bundle")
    private Path sourceDir;

    @Parameters(index = "1", paramLabel = "OUTPUT_FILE", description = "Bundle file to write (replaced if present)")
    private Path outputFile;

    @Option(names = {"--extensions", "-e"}, split = ",", paramLabel = "EXT",
            description = "Extensions to include, e.g. .py,.rs (default: configured set)")
    private List<String> extensions;

    @Option(names = {"--exclude", "-x"}, paramLabel = "GLOB",
            description = "Exclude files or directories whose name matches the glob (repeatable)")
    private List<String> excludes;

    private final BundleEngine bundleEngine;
    private final BundlerProperties properties;

    public MergeCommand(BundleEngine bundleEngine, BundlerProperties properties) {
        this.bundleEngine = bundleEngine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ExtensionSet extensionSet = extensions != null ? ExtensionSet.of(extensions) : properties.extensionSet();
        if (extensionSet.isEmpty()) {
            ConsoleOutput.error("No file extensions selected");
            return 2;
        }

        var filters = new ArrayList<FilterRule>(properties.filterRules());
        if (excludes != null) {
            excludes.forEach(glob -> filters.add(FilterRule.of(glob)));
        }

        ConsoleOutput.info("Merging " + sourceDir + " -> " + outputFile);
        MergeResult result;
        try {
            result = bundleEngine.merge(new MergeRequest(sourceDir, outputFile, extensionSet, filters),
                    ConsoleOutput::progress);
        } catch (Exception e) {
            ConsoleOutput.error("Merge failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        if (result.fileCount() == 0) {
            ConsoleOutput.warn("No matching files found; wrote an empty bundle");
        } else {
            ConsoleOutput.success("Bundle written to " + outputFile);
        }
        ConsoleOutput.mergeSummary(result);
        return 0;
    }
}
