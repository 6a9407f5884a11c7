package com.sourcebundler.core.engine;

import com.sourcebundler.core.bundle.ProgressListener;
import com.sourcebundler.core.config.BundlerProperties;
import com.sourcebundler.core.model.ExtensionSet;
import com.sourcebundler.core.model.FilterRule;
import com.sourcebundler.core.model.MergeRequest;
import com.sourcebundler.core.model.SplitRequest;
import com.sourcebundler.core.model.SplitResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Merges real trees and splits the result back, checking the reconstructed files.
 */
class RoundTripTest {

    private static final ExtensionSet EXTENSIONS = ExtensionSet.of(".py", ".rs", ".c", ".h", ".cpp", ".hpp", ".css");

    @TempDir
    Path tempDir;

    private BundleEngine engine;
    private Path src;
    private Path bundle;
    private Path out;

    @BeforeEach
    void setUp() throws IOException {
        engine = BundleEngineTest.newEngine(new BundlerProperties(), new SimpleMeterRegistry());
        src = Files.createDirectories(tempDir.resolve("src"));
        bundle = tempDir.resolve("bundle.txt");
        out = tempDir.resolve("out");
    }

    private void write(String relative, String content) throws IOException {
        Path file = src.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private void mergeAndSplit(boolean overwrite) throws IOException {
        engine.merge(new MergeRequest(src, bundle, EXTENSIONS, List.of()), ProgressListener.NONE);
        engine.split(new SplitRequest(bundle, out, overwrite, List.of()), ProgressListener.NONE);
    }

    private String restored(String relative) throws IOException {
        return Files.readString(out.resolve("src").resolve(relative), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("text files come back with identical content")
    void textRoundTrip() throws IOException {
        write("main.py", "import os\r\n\r\nprint(os.sep)\r\n");
        write("lib.rs", "/// doc\nfn f() {}\n");
        write("style.css", "/* c */\nbody { margin: 0; }\n");
        write("deep/nested/dir/util.cpp", "int x;\rint y;\r");
        write("include/api.h", "#pragma once\n\n\n");
        write("unicode/naive.c", "// ü ✓ 😀\n");

        mergeAndSplit(false);

        assertEquals("import os\r\n\r\nprint(os.sep)\r\n", restored("main.py"));
        assertEquals("/// doc\nfn f() {}\n", restored("lib.rs"));
        assertEquals("/* c */\nbody { margin: 0; }\n", restored("style.css"));
        assertEquals("int x;\rint y;\r", restored("deep/nested/dir/util.cpp"));
        assertEquals("#pragma once\n\n\n", restored("include/api.h"));
        assertEquals("// ü ✓ 😀\n", restored("unicode/naive.c"));
    }

    @Test
    @DisplayName("content mentioning markers of other files survives")
    void markerLikeContent() throws IOException {
        String content = "x = 1\n# [[ SCB ]] END FILE: ./src/other.py\n# [[ SCB ]] FILE INDEX START\n";
        write("tricky.py", content);
        mergeAndSplit(false);
        assertEquals(content, restored("tricky.py"));
    }

    @Test
    @DisplayName("a missing final newline is added, empty files stay empty")
    void trailingNewline() throws IOException {
        write("no_eol.py", "last line");
        write("empty.py", "");
        mergeAndSplit(false);
        assertEquals("last line\n", restored("no_eol.py"));
        assertEquals("", restored("empty.py"));
    }

    @Test
    @DisplayName("non-UTF-8 text is re-encoded as UTF-8")
    void latinFile() throws IOException {
        Files.write(src.resolve("latin.py"), new byte[]{'c', 'a', 'f', (byte) 0xE9, '\n'});
        mergeAndSplit(false);
        assertEquals("café\n", restored("latin.py"));
    }

    @Test
    @DisplayName("binary files are listed as errors and never recreated")
    void binaryFile() throws IOException {
        Files.write(src.resolve("blob.py"), new byte[]{0, 0, 0, 1});
        write("ok.py", "ok\n");

        mergeAndSplit(false);

        String text = Files.readString(bundle);
        assertTrue(text.contains("# ./src/blob.py [Error reading file]"));
        assertTrue(text.contains("# [[ SCB ]] START ERROR: ./src/blob.py"));
        assertFalse(Files.exists(out.resolve("src/blob.py")));
        assertEquals("ok\n", restored("ok.py"));
    }

    @Test
    @DisplayName("hidden and filtered entries are left out")
    void exclusions() throws IOException {
        write(".hidden.py", "h\n");
        write(".venv/lib.py", "v\n");
        write("build/gen.py", "g\n");
        write("keep.py", "k\n");

        engine.merge(new MergeRequest(src, bundle, EXTENSIONS, List.of(FilterRule.of("build"))), ProgressListener.NONE);
        SplitResult result = engine.split(new SplitRequest(bundle, out, false, List.of()), ProgressListener.NONE);

        assertEquals(1, result.writtenCount());
        assertEquals("k\n", restored("keep.py"));
    }

    @Test
    @DisplayName("merging the same tree twice gives identical bundles")
    void deterministic() throws IOException {
        write("b.py", "b\n");
        write("a/z.py", "z\n");
        write("A.py", "A\n");
        Path second = tempDir.resolve("bundle2.txt");

        engine.merge(new MergeRequest(src, bundle, EXTENSIONS, List.of()), ProgressListener.NONE);
        engine.merge(new MergeRequest(src, second, EXTENSIONS, List.of()), ProgressListener.NONE);

        assertArrayEquals(Files.readAllBytes(bundle), Files.readAllBytes(second));
    }

    @Test
    @DisplayName("splitting twice renames around existing files unless overwriting")
    void repeatedSplit() throws IOException {
        write("dup.py", "d\n");
        mergeAndSplit(false);

        SplitResult renamed = engine.split(new SplitRequest(bundle, out, false, List.of()), ProgressListener.NONE);
        assertEquals(1, renamed.renamedCount());
        assertEquals("d\n", restored("dup_1.py"));

        SplitResult overwritten = engine.split(new SplitRequest(bundle, out, true, List.of()), ProgressListener.NONE);
        assertEquals(0, overwritten.renamedCount());
        assertFalse(Files.exists(out.resolve("src/dup_2.py")));
    }

    @Test
    @DisplayName("an empty tree round-trips to nothing")
    void emptyTree() throws IOException {
        mergeAndSplit(false);
        assertEquals(0, Files.size(bundle));
        try (var entries = Files.list(out)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    @DisplayName("a bundle cut off mid-file still restores what it holds")
    void truncatedBundle() throws IOException {
        write("a.py", "a1\na2\n");
        write("b.py", "b1\nb2\n");
        engine.merge(new MergeRequest(src, bundle, EXTENSIONS, List.of()), ProgressListener.NONE);

        String text = Files.readString(bundle);
        Files.writeString(bundle, text.substring(0, text.indexOf("b2\n")));
        SplitResult result = engine.split(new SplitRequest(bundle, out, false, List.of()), ProgressListener.NONE);

        assertEquals("a1\na2\n", restored("a.py"));
        assertEquals("b1\n", restored("b.py"));
        assertEquals(1, result.unterminatedCount());
    }
}
