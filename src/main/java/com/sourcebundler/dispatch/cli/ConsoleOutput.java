package com.sourcebundler.dispatch.cli;

import com.sourcebundler.core.model.MergeResult;
import com.sourcebundler.core.model.SplitResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the bundler CLI.
 */
public class ConsoleOutput {

    private static final int BAR_WIDTH = 30;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SOURCE CODE BUNDLER v1.0.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SCB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /**
     * Redraws a single progress line; the line is finished once {@code current}
     * reaches {@code total}.
     */
    public static void progress(int current, int total) {
        if (total <= 0) return;
        int filled = (int) ((long) current * BAR_WIDTH / total);
        int percent = (int) ((long) current * 100 / total);
        System.out.print("\r[" + "#".repeat(filled) + " ".repeat(BAR_WIDTH - filled) + "] "
                + String.format("%3d%%", percent));
        if (current >= total) {
            System.out.println();
        }
    }

    public static void mergeSummary(MergeResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Files: @|fg(green) " + result.bundledCount() + " bundled|@"
                + (result.errorCount() > 0 ? ", @|fg(red) " + result.errorCount() + " unreadable|@" : "")));
        System.out.println("  Size: " + result.charCount() + " chars (~" + result.estimatedTokens() + " tokens)");
    }

    public static void splitSummary(SplitResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Files: @|fg(green) " + result.writtenCount() + " written|@"
                + (result.renamedCount() > 0 ? ", " + result.renamedCount() + " renamed" : "")));
        if (result.skippedCount() > 0 || result.failedCount() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Entries: @|fg(yellow) " + result.skippedCount() + " skipped|@, @|fg(red) "
                    + result.failedCount() + " failed|@"));
        }
        if (result.errorBlockCount() > 0) {
            System.out.println("  Error blocks passed over: " + result.errorBlockCount());
        }
        if (result.unterminatedCount() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) Bundle was truncated; last file kept as written|@"));
        }
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
