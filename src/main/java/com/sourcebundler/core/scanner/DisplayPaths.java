package com.sourcebundler.core.scanner;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.StringJoiner;

/**
 * Computes the display path recorded for a file in a bundle.
 * <p>
 * The path is taken relative to the parent of the source root, so the root's own
 * directory name becomes the leading component. For a root without a parent
 * (a filesystem root) the root's name, if any, is prepended instead. The result
 * always uses forward slashes and starts with {@code ./}.
 */
public final class DisplayPaths {

    /** Orders display paths by Unicode code point, independent of host collation. */
    public static final Comparator<String> CODE_POINT_ORDER = DisplayPaths::compareCodePoints;

    private DisplayPaths() {}

    public static String of(Path sourceRoot, Path file) {
        Path root = sourceRoot.toAbsolutePath().normalize();
        Path parent = root.getParent();
        if (parent == null) {
            String relative = toPosix(root.relativize(file));
            Path name = root.getFileName();
            return name != null ? "./" + name + "/" + relative : "./" + relative;
        }
        return "./" + toPosix(parent.relativize(file));
    }

    static String toPosix(Path relative) {
        var joiner = new StringJoiner("/");
        for (Path component : relative) {
            joiner.add(component.toString());
        }
        return joiner.toString();
    }

    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
