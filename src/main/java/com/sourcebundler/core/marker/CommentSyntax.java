package com.sourcebundler.core.marker;

import java.util.Map;

/**
 * Comment conventions used to prefix marker lines, keyed by file extension.
 * <p>
 * Only {@link #BLOCK} needs a closing suffix; every marker line written for it
 * ends with {@code " *}{@code /"} so the line stays a valid comment.
 */
public enum CommentSyntax {
    HASH("#", false),
    DOUBLE_SLASH("//", false),
    TRIPLE_SLASH("///", false),
    DOUBLE_DASH("--", false),
    BLOCK("/*", true);

    private static final String CLOSING_SUFFIX = " */";

    private static final Map<String, CommentSyntax> BY_EXTENSION = Map.ofEntries(
            Map.entry(".py", HASH),
            Map.entry(".rs", TRIPLE_SLASH),
            Map.entry(".c", DOUBLE_SLASH),
            Map.entry(".h", DOUBLE_SLASH),
            Map.entry(".cpp", DOUBLE_SLASH),
            Map.entry(".hpp", DOUBLE_SLASH),
            Map.entry(".css", BLOCK),
            Map.entry(".java", DOUBLE_SLASH),
            Map.entry(".kt", DOUBLE_SLASH),
            Map.entry(".scala", DOUBLE_SLASH),
            Map.entry(".go", DOUBLE_SLASH),
            Map.entry(".js", DOUBLE_SLASH),
            Map.entry(".ts", DOUBLE_SLASH),
            Map.entry(".cs", DOUBLE_SLASH),
            Map.entry(".swift", DOUBLE_SLASH),
            Map.entry(".sh", HASH),
            Map.entry(".rb", HASH),
            Map.entry(".pl", HASH),
            Map.entry(".r", HASH),
            Map.entry(".yml", HASH),
            Map.entry(".yaml", HASH),
            Map.entry(".toml", HASH),
            Map.entry(".sql", DOUBLE_DASH),
            Map.entry(".lua", DOUBLE_DASH),
            Map.entry(".hs", DOUBLE_DASH)
    );

    private final String leader;
    private final boolean needsClosingSuffix;

    CommentSyntax(String leader, boolean needsClosingSuffix) {
        this.leader = leader;
        this.needsClosingSuffix = needsClosingSuffix;
    }

    public String leader() {
        return leader;
    }

    public boolean needsClosingSuffix() {
        return needsClosingSuffix;
    }

    public String closingSuffix() {
        return needsClosingSuffix ? CLOSING_SUFFIX : "";
    }

    /**
     * @param extension lower-cased, dot-prefixed extension, may be empty
     * @return the mapped syntax, {@link #DOUBLE_SLASH} when unmapped
     */
    public static CommentSyntax forExtension(String extension) {
        return BY_EXTENSION.getOrDefault(extension, DOUBLE_SLASH);
    }
}
