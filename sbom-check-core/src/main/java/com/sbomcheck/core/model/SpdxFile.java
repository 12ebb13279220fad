package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A file described by an SPDX document (clause 8).
 *
 * @param spdxId SPDXID of the file
 * @param fileName relative file path
 * @param fileTypes raw file type values
 * @param checksums file checksums, SHA1 required by SPDX
 * @param licenseConcluded concluded license expression
 * @param licenseInfoInFiles licenses found in the file
 * @param licenseComments comments on the license
 * @param copyrightText copyright text
 * @param comment file comment
 * @param noticeText notice text
 * @param fileContributors contributors
 * @param attributionTexts attribution texts
 * @param extraFields fields not known to SPDX 2.3, kept but not validated
 */
public record SpdxFile(
    @JsonProperty("SPDXID") String spdxId,
    String fileName,
    List<String> fileTypes,
    List<Checksum> checksums,
    String licenseConcluded,
    List<String> licenseInfoInFiles,
    String licenseComments,
    String copyrightText,
    String comment,
    String noticeText,
    List<String> fileContributors,
    List<String> attributionTexts,
    @JsonIgnore Map<String, JsonNode> extraFields
) implements SpdxElement {

    /**
     * Compact constructor with validation.
     */
    public SpdxFile {
        fileTypes = fileTypes == null ? List.of() : List.copyOf(fileTypes);
        checksums = checksums == null ? List.of() : List.copyOf(checksums);
        licenseInfoInFiles = licenseInfoInFiles == null ? List.of() : List.copyOf(licenseInfoInFiles);
        fileContributors = fileContributors == null ? List.of() : List.copyOf(fileContributors);
        attributionTexts = attributionTexts == null ? List.of() : List.copyOf(attributionTexts);
        extraFields = extraFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    @Override
    public EntityType entityType() {
        return EntityType.FILE;
    }
}
