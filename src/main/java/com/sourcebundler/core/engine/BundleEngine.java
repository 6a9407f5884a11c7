package com.sourcebundler.core.engine;

import com.sourcebundler.core.bundle.BundleIndex;
import com.sourcebundler.core.bundle.BundleLines;
import com.sourcebundler.core.bundle.BundleParser;
import com.sourcebundler.core.bundle.BundleWriter;
import com.sourcebundler.core.bundle.ProgressListener;
import com.sourcebundler.core.logging.MdcContext;
import com.sourcebundler.core.metrics.BundlerMetrics;
import com.sourcebundler.core.model.IndexEntry;
import com.sourcebundler.core.model.MergeRequest;
import com.sourcebundler.core.model.MergeResult;
import com.sourcebundler.core.model.SourceFile;
import com.sourcebundler.core.model.SplitRequest;
import com.sourcebundler.core.model.SplitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for merge, split and inspect, bridging callers such as the CLI to
 * the bundle codec.
 * <p>
 * Only structural failures escape as {@link IOException}: a missing or unreadable
 * source, a bundle that is not UTF-8, an output location that cannot be created.
 * Every per-file problem is handled inside the codec and shows up in the result
 * counts and the log.
 */
@Service
public class BundleEngine {

    private static final Logger log = LoggerFactory.getLogger(BundleEngine.class);

    private final BundleWriter bundleWriter;
    private final BundleParser bundleParser;
    private final BundlerMetrics metrics;

    public BundleEngine(BundleWriter bundleWriter, BundleParser bundleParser, BundlerMetrics metrics) {
        this.bundleWriter = bundleWriter;
        this.bundleParser = bundleParser;
        this.metrics = metrics;
    }

    /**
     * Bundles {@code request.sourceRoot()} into {@code request.outputFile()},
     * replacing any existing file there.
     */
    public MergeResult merge(MergeRequest request, ProgressListener progress) throws IOException {
        MdcContext.setOperation("merge");
        long start = System.currentTimeMillis();
        try {
            Path source = request.sourceRoot();
            if (!Files.exists(source)) {
                throw new NoSuchFileException(source.toString(), null, "Source path does not exist");
            }
            if (!Files.isDirectory(source)) {
                throw new NotDirectoryException(source.toString());
            }
            log.info("Merging {} into {} (extensions: {})", source, request.outputFile(), request.extensions());

            List<SourceFile> files = bundleWriter.prepare(source, request.extensions(), request.filters(),
                    request.outputFile());

            Path parent = request.outputFile().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MergeResult result;
            try (Writer out = Files.newBufferedWriter(request.outputFile(), StandardCharsets.UTF_8)) {
                result = bundleWriter.write(files, out, progress);
            }

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordMerge(result, elapsed);
            log.info("Merged {} files ({} unreadable, ~{} tokens) in {}ms",
                    result.fileCount(), result.errorCount(), result.estimatedTokens(), elapsed);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Reconstructs the files of {@code request.bundleFile()} below
     * {@code request.outputRoot()}, creating the root if needed.
     */
    public SplitResult split(SplitRequest request, ProgressListener progress) throws IOException {
        MdcContext.setOperation("split");
        long start = System.currentTimeMillis();
        try {
            List<String> lines = readBundle(request.bundleFile());
            Files.createDirectories(request.outputRoot());
            log.info("Splitting {} into {} (overwrite: {})", request.bundleFile(), request.outputRoot(),
                    request.overwrite());

            SplitResult result = bundleParser.parse(lines, request.outputRoot(), request.overwrite(),
                    request.filters(), progress);

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordSplit(result, elapsed);
            log.info("Split wrote {} files ({} renamed, {} skipped, {} failed) in {}ms",
                    result.writtenCount(), result.renamedCount(), result.skippedCount(), result.failedCount(),
                    elapsed);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Lists the entries of a bundle's index block.
     *
     * @return the index entries, empty if the bundle has no index
     */
    public List<IndexEntry> inspect(Path bundleFile) throws IOException {
        MdcContext.setOperation("inspect");
        try {
            List<IndexEntry> entries = BundleIndex.parse(readBundle(bundleFile));
            log.debug("Index of {} lists {} entries", bundleFile, entries.size());
            return entries;
        } finally {
            MdcContext.clear();
        }
    }

    private static List<String> readBundle(Path bundleFile) throws IOException {
        if (!Files.isRegularFile(bundleFile)) {
            throw new NoSuchFileException(bundleFile.toString(), null, "Bundle must be an existing file");
        }
        return BundleLines.split(Files.readString(bundleFile, StandardCharsets.UTF_8));
    }
}
