package com.sourcebundler.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcebundler.core.engine.BundleEngine;
import com.sourcebundler.core.model.IndexEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: scb inspect &lt;bundle&gt;
 * <p>
 * Lists the index block of a bundle without extracting anything.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "List the files indexed in a bundle")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "BUNDLE", description = "Bundle file to inspect")
    private Path bundleFile;

    @Option(names = "--json", description = "Print the index as JSON")
    private boolean json;

    private final BundleEngine bundleEngine;
    private final ObjectMapper objectMapper;

    public InspectCommand(BundleEngine bundleEngine, ObjectMapper objectMapper) {
        this.bundleEngine = bundleEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        List<IndexEntry> entries;
        try {
            entries = bundleEngine.inspect(bundleFile);
        } catch (Exception e) {
            ConsoleOutput.error("Cannot read bundle: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot render JSON: " + e.getOriginalMessage());
                return 1;
            }
            return 0;
        }

        ConsoleOutput.printBanner();
        if (entries.isEmpty()) {
            ConsoleOutput.info("Bundle has no index");
            return 0;
        }

        System.out.println();
        System.out.println("INDEX " + bundleFile.getFileName() + " (" + entries.size() + " files)");
        System.out.println("──────────────────────────────────");
        for (IndexEntry entry : entries) {
            if (entry.readError()) {
                System.out.println("  " + entry.displayPath() + "  [unreadable]");
            } else {
                System.out.println(String.format(Locale.ROOT, "  %s  %.1fkb  %d lines",
                        entry.displayPath(), entry.sizeKiB(), entry.lineCount()));
            }
        }
        return 0;
    }
}
