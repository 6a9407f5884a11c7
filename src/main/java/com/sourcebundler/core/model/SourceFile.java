package com.sourcebundler.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * A file prepared for one merge pass: either its decoded content or the reason
 * it could not be read. Discarded once the bundle is written.
 *
 * @param absolutePath where the file was read from
 * @param displayPath  POSIX, {@code ./}-prefixed path written into the bundle
 * @param content      decoded text, {@code null} when loading failed
 * @param loadError    single-line failure message, {@code null} when loaded
 * @param sizeKiB      UTF-8 byte length of the content divided by 1024
 * @param lineCount    newline count plus one
 */
public record SourceFile(
    Path absolutePath,
    String displayPath,
    String content,
    String loadError,
    double sizeKiB,
    int lineCount
) {

    public static SourceFile loaded(Path absolutePath, String displayPath, String content) {
        long bytes = content.getBytes(StandardCharsets.UTF_8).length;
        int newlines = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') newlines++;
        }
        return new SourceFile(absolutePath, displayPath, content, null, bytes / 1024.0, newlines + 1);
    }

    public static SourceFile failed(Path absolutePath, String displayPath, String loadError) {
        return new SourceFile(absolutePath, displayPath, null, loadError, 0, 0);
    }

    public boolean isLoaded() {
        return loadError == null;
    }

    /**
     * Size in KiB to one decimal place, as shown in the index block. Ties round
     * to even, so 256 bytes shows as {@code 0.2}.
     */
    public String formattedSize() {
        return new BigDecimal(sizeKiB).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    public String extension() {
        return ExtensionSet.extensionOf(absolutePath.getFileName().toString());
    }
}
