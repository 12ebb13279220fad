package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One end of a snippet range. Byte ranges set {@code offset}, line ranges {@code lineNumber}.
 *
 * @param reference SPDXID of the file the pointer refers to
 * @param offset 1-based byte offset, or null
 * @param lineNumber 1-based line number, or null
 */
public record RangePointer(
    String reference,
    Integer offset,
    Integer lineNumber
) {
    /**
     * Returns true if this pointer addresses a byte offset.
     *
     * @return true for byte pointers
     */
    @JsonIgnore
    public boolean isByteOffset() {
        return offset != null;
    }
}
