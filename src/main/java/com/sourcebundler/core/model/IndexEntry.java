package com.sourcebundler.core.model;

/**
 * One row of a bundle's index block.
 *
 * @param displayPath the path as listed
 * @param sizeKiB     listed size, 0 for unreadable entries
 * @param lineCount   listed line count, 0 for unreadable entries
 * @param readError   {@code true} when the row carries the read-error annotation
 */
public record IndexEntry(
    String displayPath,
    double sizeKiB,
    int lineCount,
    boolean readError
) {}
