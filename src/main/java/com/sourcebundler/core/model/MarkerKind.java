package com.sourcebundler.core.model;

import java.util.List;

/**
 * The five structural line kinds of a bundle, each carrying the keyword written
 * after the sentinel. Legacy keywords are only accepted when reading.
 */
public enum MarkerKind {
    START_FILE("START FILE"),
    END_FILE("END FILE"),
    START_ERROR("START ERROR", "ERROR START"),
    ERROR_MSG("ERROR"),
    END_ERROR("END ERROR", "ERROR END");

    private final String keyword;
    private final List<String> legacyKeywords;

    MarkerKind(String keyword, String... legacyKeywords) {
        this.keyword = keyword;
        this.legacyKeywords = List.of(legacyKeywords);
    }

    public String keyword() {
        return keyword;
    }

    public static MarkerKind fromKeyword(String keyword) {
        for (MarkerKind kind : values()) {
            if (kind.keyword.equals(keyword) || kind.legacyKeywords.contains(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown marker keyword: " + keyword);
    }
}
