package com.sourcebundler.core.model;

/**
 * One recognized marker line.
 *
 * @param kind             which boundary the line encodes
 * @param value            the display path, or the message text for {@link MarkerKind#ERROR_MSG}
 * @param commentLeader    the token before the sentinel, e.g. {@code #} or {@code /*}
 * @param hasClosingSuffix whether the line ended with a block-comment close
 */
public record Marker(
    MarkerKind kind,
    String value,
    String commentLeader,
    boolean hasClosingSuffix
) {}
