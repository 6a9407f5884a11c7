package com.sourcebundler.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: merge, split, inspect.
 */
@Command(
        name = "scb",
        mixinStandardHelpOptions = true,
        version = "Source Code Bundler 1.0.0",
        description = "Merges a source tree into one bundle file and splits bundles back into files",
        subcommands = {
                MergeCommand.class,
                SplitCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BundlerCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
