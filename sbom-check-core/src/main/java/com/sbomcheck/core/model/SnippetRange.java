package com.sbomcheck.core.model;

/**
 * A byte or line range of a snippet within its file.
 *
 * @param startPointer start of the range
 * @param endPointer end of the range
 */
public record SnippetRange(
    RangePointer startPointer,
    RangePointer endPointer
) {}
