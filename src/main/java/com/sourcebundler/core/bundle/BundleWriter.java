package com.sourcebundler.core.bundle;

import com.sourcebundler.core.content.ContentDecodeException;
import com.sourcebundler.core.content.ContentLoader;
import com.sourcebundler.core.logging.MdcContext;
import com.sourcebundler.core.marker.CommentSyntax;
import com.sourcebundler.core.marker.MarkerCodec;
import com.sourcebundler.core.model.ExtensionSet;
import com.sourcebundler.core.model.FilterRule;
import com.sourcebundler.core.model.MergeResult;
import com.sourcebundler.core.model.SourceFile;
import com.sourcebundler.core.scanner.DisplayPaths;
import com.sourcebundler.core.scanner.FileCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes a directory tree into bundle text.
 * <p>
 * Writing happens in two phases. {@link #prepare} collects, sorts and loads every
 * file up front, recording per-file failures instead of throwing, so the index
 * columns can be aligned before anything is emitted. {@link #write} then emits
 * the index block followed by one content or error block per file.
 */
@Service
public class BundleWriter {

    private static final Logger log = LoggerFactory.getLogger(BundleWriter.class);

    private final FileCollector fileCollector;
    private final ContentLoader contentLoader;
    private final MarkerCodec markerCodec;

    public BundleWriter(FileCollector fileCollector, ContentLoader contentLoader, MarkerCodec markerCodec) {
        this.fileCollector = fileCollector;
        this.contentLoader = contentLoader;
        this.markerCodec = markerCodec;
    }

    /**
     * Collects and loads the files of a tree, sorted by display path.
     *
     * @param sourceRoot the directory to bundle
     * @param extensions extensions to include
     * @param filters    exclusion rules
     * @param exclude    a file never to include (the bundle being written), may be {@code null}
     * @throws IOException if the directory walk fails
     */
    public List<SourceFile> prepare(Path sourceRoot, ExtensionSet extensions, List<FilterRule> filters,
                                    Path exclude) throws IOException {
        Path excluded = exclude == null ? null : exclude.toAbsolutePath().normalize();
        var candidates = new ArrayList<Candidate>();
        for (Path file : fileCollector.collect(sourceRoot, extensions, filters)) {
            if (file.equals(excluded)) {
                log.debug("Skipping bundle output {}", file);
                continue;
            }
            candidates.add(new Candidate(file, DisplayPaths.of(sourceRoot, file)));
        }
        candidates.sort(Comparator.comparing(Candidate::displayPath, DisplayPaths.CODE_POINT_ORDER));

        var files = new ArrayList<SourceFile>(candidates.size());
        for (Candidate candidate : candidates) {
            files.add(load(candidate));
        }
        return files;
    }

    /**
     * Emits the bundle for prepared files. Nothing is written for an empty list.
     *
     * @return counts for the written bundle
     * @throws IOException if writing to {@code out} fails
     */
    public MergeResult write(List<SourceFile> files, Writer out, ProgressListener progress) throws IOException {
        var emitter = new Emitter(out);
        int total = files.size();
        int errors = 0;

        if (total > 0) {
            for (String line : BundleIndex.render(files)) {
                emitter.line(line);
            }
            emitter.line("");
        }

        int index = 0;
        for (SourceFile file : files) {
            CommentSyntax syntax = CommentSyntax.forExtension(file.extension());
            String path = file.displayPath();
            if (file.isLoaded()) {
                emitter.line(markerCodec.startFile(syntax, path));
                String content = file.content();
                emitter.text(content);
                if (!content.isEmpty() && !content.endsWith("\n") && !content.endsWith("\r")) {
                    emitter.text("\n");
                }
                emitter.line(markerCodec.endFile(syntax, path));
            } else {
                errors++;
                emitter.line(markerCodec.startError(syntax, path));
                emitter.line(markerCodec.errorMessage(syntax, file.loadError()));
                emitter.line(markerCodec.endError(syntax, path));
            }
            emitter.line("");
            progress.onProgress(++index, total);
        }

        out.flush();
        return MergeResult.of(total, errors, emitter.chars);
    }

    private SourceFile load(Candidate candidate) {
        MdcContext.setEntry(candidate.displayPath());
        try {
            String content = contentLoader.read(candidate.file());
            return SourceFile.loaded(candidate.file(), candidate.displayPath(), content);
        } catch (ContentDecodeException e) {
            log.warn("Cannot decode {}: binary or unsupported encoding", candidate.displayPath());
            return SourceFile.failed(candidate.file(), candidate.displayPath(), ContentDecodeException.CANONICAL_MESSAGE);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", candidate.displayPath(), e.toString());
            return SourceFile.failed(candidate.file(), candidate.displayPath(), describe(e));
        } finally {
            MdcContext.clearEntry();
        }
    }

    static String describe(IOException e) {
        if (e instanceof AccessDeniedException) {
            return "Permission denied: " + e.getMessage();
        }
        if (e instanceof NoSuchFileException) {
            return "No such file or directory: " + e.getMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record Candidate(Path file, String displayPath) {}

    /** Writes bundle text while counting emitted code points. */
    private static final class Emitter {
        private final Writer out;
        private long chars;

        Emitter(Writer out) {
            this.out = out;
        }

        void text(String s) throws IOException {
            out.write(s);
            chars += s.codePointCount(0, s.length());
        }

        void line(String s) throws IOException {
            text(s);
            text("\n");
        }
    }
}
