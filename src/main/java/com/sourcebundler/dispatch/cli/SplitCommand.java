package com.sourcebundler.dispatch.cli;

import com.sourcebundler.core.config.BundlerProperties;
import com.sourcebundler.core.engine.BundleEngine;
import com.sourcebundler.core.model.FilterRule;
import com.sourcebundler.core.model.SplitRequest;
import com.sourcebundler.core.model.SplitResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: scb split &lt;bundle&gt; &lt;output-dir&gt;
 * <p>
 * Recreates the files of a bundle below the output directory. Entries whose path
 * would escape it are skipped; existing files are renamed around unless
 * {@code --overwrite} is given.
 */
@Command(name = "split", mixinStandardHelpOptions = true, description = "Split a bundle file back into files")
@Component
public class SplitCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "BUNDLE", description = "Bundle file to read")
    private Path bundleFile;

    @Parameters(index = "1", paramLabel = "OUTPUT_DIR", description = "Directory receiving the files")
    private Path outputDir;

    @Option(names = "--overwrite", description = "Replace existing files instead of writing name_1.ext copies")
    private Boolean overwrite;

    @Option(names = {"--exclude", "-x"}, paramLabel = "GLOB",
            description = "Skip entries with a path segment matching the glob (repeatable)")
    private List<String> excludes;

    private final BundleEngine bundleEngine;
    private final BundlerProperties properties;

    public SplitCommand(BundleEngine bundleEngine, BundlerProperties properties) {
        this.bundleEngine = bundleEngine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean replace = overwrite != null ? overwrite : properties.isOverwrite();
        var filters = new ArrayList<FilterRule>(properties.filterRules());
        if (excludes != null) {
            excludes.forEach(glob -> filters.add(FilterRule.of(glob)));
        }

        ConsoleOutput.info("Splitting " + bundleFile + " -> " + outputDir);
        SplitResult result;
        try {
            result = bundleEngine.split(new SplitRequest(bundleFile, outputDir, replace, filters),
                    ConsoleOutput::progress);
        } catch (Exception e) {
            ConsoleOutput.error("Split failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        if (result.writtenCount() == 0) {
            ConsoleOutput.warn("No files were reconstructed");
        } else {
            ConsoleOutput.success("Files written to " + outputDir);
        }
        ConsoleOutput.splitSummary(result);
        return 0;
    }
}
