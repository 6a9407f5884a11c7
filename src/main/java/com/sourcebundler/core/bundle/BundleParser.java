package com.sourcebundler.core.bundle;

import com.sourcebundler.core.config.BundlerProperties;
import com.sourcebundler.core.logging.MdcContext;
import com.sourcebundler.core.marker.MarkerCodec;
import com.sourcebundler.core.model.FilterRule;
import com.sourcebundler.core.model.Marker;
import com.sourcebundler.core.model.MarkerKind;
import com.sourcebundler.core.model.SplitResult;
import com.sourcebundler.core.security.CollisionResolver;
import com.sourcebundler.core.security.FilterRuleMatcher;
import com.sourcebundler.core.security.PathSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconstructs files from bundle lines in a single pass.
 * <p>
 * The parser is either idle or writing one open target. A START FILE marker
 * closes any open target and opens the next; a matching END FILE closes it.
 * Payload lines go verbatim to the open target and are dropped while idle.
 * Error blocks never produce files. Malformed input is tolerated: stray markers
 * are swallowed and a target still open at end of stream is closed with what
 * it has received.
 */
@Service
public class BundleParser {

    private static final Logger log = LoggerFactory.getLogger(BundleParser.class);

    private final MarkerCodec markerCodec;
    private final PathSanitizer pathSanitizer;
    private final CollisionResolver collisionResolver;
    private final int maxErrorBlockLines;
    private final int progressStride;

    @Autowired
    public BundleParser(MarkerCodec markerCodec, PathSanitizer pathSanitizer,
                        CollisionResolver collisionResolver, BundlerProperties properties) {
        this(markerCodec, pathSanitizer, collisionResolver,
                properties.getSplit().getMaxErrorBlockLines(), properties.getSplit().getProgressStride());
    }

    public BundleParser(MarkerCodec markerCodec, PathSanitizer pathSanitizer, CollisionResolver collisionResolver,
                        int maxErrorBlockLines, int progressStride) {
        this.markerCodec = markerCodec;
        this.pathSanitizer = pathSanitizer;
        this.collisionResolver = collisionResolver;
        this.maxErrorBlockLines = maxErrorBlockLines;
        this.progressStride = Math.max(1, progressStride);
    }

    /**
     * Splits bundle lines into files below {@code outputRoot}, which must exist.
     *
     * @param lines      bundle lines with their terminators, see {@link BundleLines#split}
     * @param outputRoot directory receiving the files
     * @param overwrite  replace existing plain files instead of renaming around them
     * @param filters    rules excluding entries by any segment of their path
     * @param progress   notified every {@code progressStride} lines and on completion
     * @throws IOException if the output root cannot be canonicalized
     */
    public SplitResult parse(List<String> lines, Path outputRoot, boolean overwrite,
                             List<FilterRule> filters, ProgressListener progress) throws IOException {
        var run = new Run(pathSanitizer.canonicalRoot(outputRoot), overwrite, new FilterRuleMatcher(filters));
        int total = lines.size();
        int i = 0;
        try {
            while (i < total) {
                if (i % progressStride == 0) {
                    progress.onProgress(i, total);
                }
                String line = lines.get(i);
                Optional<Marker> recognized = markerCodec.recognize(line);
                if (recognized.isEmpty()) {
                    run.append(line);
                    i++;
                    continue;
                }

                Marker marker = recognized.get();
                switch (marker.kind()) {
                    case START_FILE -> {
                        run.closeActive();
                        run.open(marker.value());
                        i++;
                    }
                    case END_FILE -> {
                        if (run.isActive(marker.value())) {
                            run.closeActive();
                            i++;
                            if (i < total && BundleLines.isBlank(lines.get(i))) {
                                i++;
                            }
                        } else {
                            run.append(line);
                            i++;
                        }
                    }
                    case START_ERROR -> {
                        run.errorBlocks++;
                        i = skipErrorBlock(lines, i);
                    }
                    case ERROR_MSG, END_ERROR -> {
                        log.debug("Ignoring stray {} line {}", marker.kind(), i + 1);
                        i++;
                    }
                }
            }
        } finally {
            if (run.active != null) {
                log.warn("Bundle ended before END FILE for {}; keeping what was written", run.active.declaredPath());
                run.unterminated++;
                run.closeActive();
            }
            MdcContext.clearEntry();
        }
        progress.onProgress(total, total);
        return run.result();
    }

    /**
     * Returns the index of the first line after the error block starting at
     * {@code start}, including any blank lines that follow it. If no END ERROR is
     * found within {@code maxErrorBlockLines}, scanning resumes right after the
     * START ERROR line.
     */
    private int skipErrorBlock(List<String> lines, int start) {
        int limit = Math.min(lines.size(), start + 1 + maxErrorBlockLines);
        for (int j = start + 1; j < limit; j++) {
            Optional<Marker> marker = markerCodec.recognize(lines.get(j));
            if (marker.isPresent() && marker.get().kind() == MarkerKind.END_ERROR) {
                int next = j + 1;
                while (next < lines.size() && BundleLines.isBlank(lines.get(next))) {
                    next++;
                }
                return next;
            }
        }
        log.warn("No END ERROR within {} lines of line {}; resuming after it", maxErrorBlockLines, start + 1);
        return start + 1;
    }

    /** Mutable state of one parse. */
    private final class Run {
        private final Path root;
        private final boolean overwrite;
        private final FilterRuleMatcher filters;
        private final List<Path> written = new ArrayList<>();
        private Target active;
        private int renamed;
        private int skipped;
        private int failed;
        private int errorBlocks;
        private int unterminated;

        Run(Path root, boolean overwrite, FilterRuleMatcher filters) {
            this.root = root;
            this.overwrite = overwrite;
            this.filters = filters;
        }

        boolean isActive(String declaredPath) {
            return active != null && active.declaredPath().equals(declaredPath);
        }

        void open(String declaredPath) {
            MdcContext.setEntry(declaredPath);
            Optional<Path> resolved = pathSanitizer.resolve(root, declaredPath);
            if (resolved.isEmpty()) {
                skipped++;
                return;
            }
            Path target = resolved.get();
            if (filters.excludes(root.relativize(target))) {
                log.info("Skipping filtered entry: {}", declaredPath);
                skipped++;
                return;
            }
            try {
                Path parent = target.getParent();
                Files.createDirectories(parent);
                if (!pathSanitizer.staysInside(root, parent)) {
                    log.warn("Skipping path leaving the output root through a link: {}", declaredPath);
                    skipped++;
                    return;
                }
                Path destination = collisionResolver.resolve(target, overwrite);
                if (!destination.equals(target)) {
                    renamed++;
                }
                Writer writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8);
                active = new Target(declaredPath, destination, writer);
                written.add(destination);
                log.debug("Writing {}", destination);
            } catch (IOException e) {
                log.error("Cannot create file for {}: {}", declaredPath, e.getMessage());
                failed++;
            }
        }

        void append(String line) {
            if (active == null) {
                return;
            }
            try {
                active.writer().write(line);
            } catch (IOException e) {
                log.error("Write to {} failed: {}", active.path(), e.getMessage());
                failed++;
                closeActive();
            }
        }

        void closeActive() {
            if (active == null) {
                return;
            }
            Target closing = active;
            active = null;
            try {
                closing.writer().close();
            } catch (IOException e) {
                log.error("Closing {} failed: {}", closing.path(), e.getMessage());
                failed++;
            }
            MdcContext.clearEntry();
        }

        SplitResult result() {
            return new SplitResult(written, renamed, skipped, failed, errorBlocks, unterminated);
        }
    }

    private record Target(String declaredPath, Path path, Writer writer) {}
}
