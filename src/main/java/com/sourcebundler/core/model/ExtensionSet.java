package com.sourcebundler.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lower-cased, dot-prefixed file extensions selecting which files a merge collects.
 */
public final class ExtensionSet {

    private final Set<String> extensions;

    private ExtensionSet(Set<String> extensions) {
        this.extensions = Collections.unmodifiableSet(extensions);
    }

    /**
     * Normalizes each entry: surrounding whitespace trimmed, lower-cased, and a
     * leading dot added when missing. Blank entries are dropped.
     */
    public static ExtensionSet of(Collection<String> rawExtensions) {
        var normalized = new LinkedHashSet<String>();
        for (String raw : rawExtensions) {
            if (raw == null || raw.isBlank()) continue;
            String ext = raw.trim().toLowerCase(Locale.ROOT);
            normalized.add(ext.startsWith(".") ? ext : "." + ext);
        }
        return new ExtensionSet(normalized);
    }

    public static ExtensionSet of(String... rawExtensions) {
        return of(Arrays.asList(rawExtensions));
    }

    /**
     * Returns the extension of a file name the way the set stores it: the text
     * from the last dot on, lower-cased. Names without a dot, names whose only
     * dot is the leading one, and names ending in a dot have no extension.
     */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    public boolean matches(String fileName) {
        String ext = extensionOf(fileName);
        return !ext.isEmpty() && extensions.contains(ext);
    }

    public Set<String> extensions() {
        return extensions;
    }

    public boolean isEmpty() {
        return extensions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExtensionSet other && extensions.equals(other.extensions);
    }

    @Override
    public int hashCode() {
        return extensions.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", extensions);
    }
}
