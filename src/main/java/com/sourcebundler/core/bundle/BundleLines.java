package com.sourcebundler.core.bundle;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits bundle text into lines that keep their terminators, so payload can be
 * written back byte for byte. {@code \n}, {@code \r\n} and a lone {@code \r}
 * each end a line; a final line without terminator is kept as is.
 */
public final class BundleLines {

    private BundleLines() {}

    public static List<String> split(String text) {
        var lines = new ArrayList<String>();
        int start = 0;
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = ++i;
            } else if (c == '\r') {
                int end = (i + 1 < length && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = i = end;
            } else {
                i++;
            }
        }
        if (start < length) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }
}
