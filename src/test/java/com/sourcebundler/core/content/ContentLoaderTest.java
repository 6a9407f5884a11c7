package com.sourcebundler.core.content;

import com.sourcebundler.core.config.BundlerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentLoaderTest {

    @TempDir
    Path tempDir;

    private final ContentLoader loader = new ContentLoader(new BundlerProperties());

    @Nested
    @DisplayName("Decoding")
    class DecodingTests {

        @Test
        @DisplayName("reads UTF-8 text with line terminators untouched")
        void utf8() throws IOException {
            Path file = tempDir.resolve("a.py");
            Files.writeString(file, "print('ü')\r\nx = 1\ry = 2\n", StandardCharsets.UTF_8);
            assertEquals("print('ü')\r\nx = 1\ry = 2\n", loader.read(file));
        }

        @Test
        @DisplayName("falls back to a single-byte encoding for non-UTF-8 bytes")
        void latinFallback() throws IOException {
            Path file = tempDir.resolve("latin.py");
            Files.write(file, new byte[]{'c', 'a', 'f', (byte) 0xE9});
            assertEquals("café", loader.read(file));
        }

        @Test
        @DisplayName("empty file decodes to empty text")
        void emptyFile() throws IOException {
            Path file = Files.createFile(tempDir.resolve("empty.py"));
            assertEquals("", loader.read(file));
        }

        @Test
        @DisplayName("binary content is rejected by every encoding")
        void binary() throws IOException {
            Path file = tempDir.resolve("blob.py");
            Files.write(file, new byte[]{0, 0, 0, 1});
            assertThrows(ContentDecodeException.class, () -> loader.read(file));
        }

        @Test
        @DisplayName("missing file surfaces as an I/O error, not a decode error")
        void missingFile() {
            var e = assertThrows(IOException.class, () -> loader.read(tempDir.resolve("gone.py")));
            assertInstanceOf(NoSuchFileException.class, e);
        }

        @Test
        @DisplayName("encodings are tried in the configured order")
        void encodingOrder() throws IOException {
            var latinFirst = new ContentLoader(List.of(StandardCharsets.ISO_8859_1, StandardCharsets.UTF_8), 8192, 0.10);
            Path file = tempDir.resolve("u.py");
            Files.writeString(file, "é", StandardCharsets.UTF_8);
            assertEquals("Ã©", latinFirst.read(file));
        }

        @Test
        @DisplayName("requires at least one encoding")
        void noEncodings() {
            assertThrows(IllegalArgumentException.class, () -> new ContentLoader(List.<Charset>of(), 8192, 0.10));
        }
    }

    @Nested
    @DisplayName("Binary heuristic")
    class BinaryHeuristicTests {

        @Test
        @DisplayName("up to ten percent non-printable is still text")
        void threshold() {
            assertFalse(loader.looksBinary("a".repeat(90) + "\u0000".repeat(10)));
            assertTrue(loader.looksBinary("a".repeat(89) + "\u0000".repeat(11)));
        }

        @Test
        @DisplayName("tab, line feed, form feed and carriage return count as text")
        void allowedControls() {
            assertFalse(loader.looksBinary("\t\n\f\r\t\n\f\r"));
        }

        @Test
        @DisplayName("only the configured sample is inspected")
        void sampleOnly() {
            var small = new ContentLoader(List.of(StandardCharsets.UTF_8), 100, 0.10);
            assertFalse(small.looksBinary("a".repeat(100) + "\u0000".repeat(500)));
        }

        @Test
        @DisplayName("printable classification follows Unicode categories")
        void printableCategories() {
            assertTrue(ContentLoader.isPrintable(' '));
            assertTrue(ContentLoader.isPrintable('é'));
            assertTrue(ContentLoader.isPrintable(0x1F600));
            assertFalse(ContentLoader.isPrintable(0x00A0));
            assertFalse(ContentLoader.isPrintable(0x200B));
            assertFalse(ContentLoader.isPrintable(0x07));
            assertFalse(ContentLoader.isPrintable(0xE000));
        }
    }
}
