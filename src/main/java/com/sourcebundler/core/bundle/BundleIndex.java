package com.sourcebundler.core.bundle;

import com.sourcebundler.core.marker.MarkerCodec;
import com.sourcebundler.core.model.IndexEntry;
import com.sourcebundler.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders and reads the index block at the top of a bundle:
 * <pre>
 * # [[ SCB ]] FILE INDEX START
 * # Total Files: 2
 * #
 * # ./src/a.py   | SIZE: 0.1kb | LINES:  3
 * # ./src/bin.py [Error reading file]
 * # [[ SCB ]] FILE INDEX END
 * </pre>
 * Paths are padded to the longest path, sizes and line counts right-aligned.
 */
public final class BundleIndex {

    public static final String HEADER = "# " + MarkerCodec.SENTINEL + " FILE INDEX START";
    public static final String FOOTER = "# " + MarkerCodec.SENTINEL + " FILE INDEX END";
    static final String READ_ERROR = "[Error reading file]";

    private static final Pattern ENTRY_PATTERN =
            Pattern.compile("^# (.+?)\\s+\\| SIZE:\\s+(\\d+\\.\\d)kb \\| LINES:\\s+(\\d+)$");
    private static final Pattern ERROR_PATTERN =
            Pattern.compile("^# (.+?)\\s+" + Pattern.quote(READ_ERROR) + "$");

    private BundleIndex() {}

    /**
     * Renders the index block for files already in bundle order, without line
     * terminators. The blank separator line after the footer is not included.
     */
    public static List<String> render(List<SourceFile> files) {
        int pathWidth = 0;
        int sizeWidth = 0;
        int linesWidth = 0;
        for (SourceFile file : files) {
            pathWidth = Math.max(pathWidth, width(file.displayPath()));
            if (file.isLoaded()) {
                sizeWidth = Math.max(sizeWidth, file.formattedSize().length());
                linesWidth = Math.max(linesWidth, String.valueOf(file.lineCount()).length());
            }
        }

        var lines = new ArrayList<String>();
        lines.add(HEADER);
        lines.add("# Total Files: " + files.size());
        lines.add("# ");
        for (SourceFile file : files) {
            String path = padRight(file.displayPath(), pathWidth);
            if (file.isLoaded()) {
                lines.add("# " + path
                        + " | SIZE: " + padLeft(file.formattedSize(), sizeWidth)
                        + "kb | LINES: " + padLeft(String.valueOf(file.lineCount()), linesWidth));
            } else {
                lines.add("# " + path + " " + READ_ERROR);
            }
        }
        lines.add(FOOTER);
        return lines;
    }

    /**
     * Reads the entries of the first index block found in the bundle lines.
     *
     * @return the listed entries, empty when the bundle carries no index
     */
    public static List<IndexEntry> parse(List<String> bundleLines) {
        var entries = new ArrayList<IndexEntry>();
        boolean inside = false;
        for (String raw : bundleLines) {
            String line = raw.stripTrailing();
            if (!inside) {
                inside = line.equals(HEADER);
                continue;
            }
            if (line.equals(FOOTER)) {
                break;
            }
            Matcher entry = ENTRY_PATTERN.matcher(line);
            if (entry.matches()) {
                entries.add(new IndexEntry(entry.group(1), Double.parseDouble(entry.group(2)),
                        Integer.parseInt(entry.group(3)), false));
                continue;
            }
            Matcher error = ERROR_PATTERN.matcher(line);
            if (error.matches()) {
                entries.add(new IndexEntry(error.group(1), 0, 0, true));
            }
        }
        return entries;
    }

    private static int width(String s) {
        return s.codePointCount(0, s.length());
    }

    private static String padRight(String s, int width) {
        int pad = width - width(s);
        return pad > 0 ? s + " ".repeat(pad) : s;
    }

    private static String padLeft(String s, int width) {
        int pad = width - width(s);
        return pad > 0 ? " ".repeat(pad) + s : s;
    }
}
