package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A snippet of a file described by an SPDX document (clause 9).
 *
 * @param spdxId SPDXID of the snippet
 * @param name optional snippet name
 * @param snippetFromFile SPDXID of the file containing the snippet
 * @param ranges byte and line ranges
 * @param licenseConcluded concluded license expression
 * @param licenseInfoInSnippets licenses found in the snippet
 * @param licenseComments comments on the license
 * @param copyrightText copyright text
 * @param comment snippet comment
 * @param attributionTexts attribution texts
 * @param extraFields fields not known to SPDX 2.3, kept but not validated
 */
public record SpdxSnippet(
    @JsonProperty("SPDXID") String spdxId,
    String name,
    String snippetFromFile,
    List<SnippetRange> ranges,
    String licenseConcluded,
    List<String> licenseInfoInSnippets,
    String licenseComments,
    String copyrightText,
    String comment,
    List<String> attributionTexts,
    @JsonIgnore Map<String, JsonNode> extraFields
) implements SpdxElement {

    /**
     * Compact constructor with validation.
     */
    public SpdxSnippet {
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
        licenseInfoInSnippets = licenseInfoInSnippets == null ? List.of() : List.copyOf(licenseInfoInSnippets);
        attributionTexts = attributionTexts == null ? List.of() : List.copyOf(attributionTexts);
        extraFields = extraFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    @Override
    public EntityType entityType() {
        return EntityType.SNIPPET;
    }
}
