package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A package described by an SPDX document (clause 7).
 *
 * <p>All fields are optional at the model level; presence requirements are enforced
 * by rules. {@code filesAnalyzed} is null when the document omits it (SPDX default: true).
 *
 * @param spdxId SPDXID of the package
 * @param name package name
 * @param versionInfo package version
 * @param packageFileName file name of the package archive
 * @param supplier supplier actor or {@code NOASSERTION}
 * @param originator originator actor or {@code NOASSERTION}
 * @param downloadLocation download URL, {@code NONE} or {@code NOASSERTION}
 * @param filesAnalyzed whether the package files were analyzed
 * @param packageVerificationCode verification code over the package files
 * @param checksums package checksums
 * @param homepage home page URL
 * @param sourceInfo source information
 * @param licenseConcluded concluded license expression
 * @param licenseInfoFromFiles licenses found in the package files
 * @param licenseDeclared declared license expression
 * @param licenseComments comments on the license
 * @param copyrightText copyright text
 * @param summary short description
 * @param description detailed description
 * @param comment package comment
 * @param externalRefs external references
 * @param attributionTexts attribution texts
 * @param primaryPackagePurpose raw primary purpose
 * @param releaseDate release date
 * @param builtDate build date
 * @param validUntilDate end of support date
 * @param hasFiles SPDXIDs of files contained in the package
 * @param extraFields fields not known to SPDX 2.3, kept but not validated
 */
public record SpdxPackage(
    @JsonProperty("SPDXID") String spdxId,
    String name,
    String versionInfo,
    String packageFileName,
    String supplier,
    String originator,
    String downloadLocation,
    Boolean filesAnalyzed,
    PackageVerificationCode packageVerificationCode,
    List<Checksum> checksums,
    String homepage,
    String sourceInfo,
    String licenseConcluded,
    List<String> licenseInfoFromFiles,
    String licenseDeclared,
    String licenseComments,
    String copyrightText,
    String summary,
    String description,
    String comment,
    List<ExternalRef> externalRefs,
    List<String> attributionTexts,
    String primaryPackagePurpose,
    String releaseDate,
    String builtDate,
    String validUntilDate,
    List<String> hasFiles,
    @JsonIgnore Map<String, JsonNode> extraFields
) implements SpdxElement {

    /**
     * Compact constructor with validation.
     */
    public SpdxPackage {
        checksums = checksums == null ? List.of() : List.copyOf(checksums);
        licenseInfoFromFiles = licenseInfoFromFiles == null ? List.of() : List.copyOf(licenseInfoFromFiles);
        externalRefs = externalRefs == null ? List.of() : List.copyOf(externalRefs);
        attributionTexts = attributionTexts == null ? List.of() : List.copyOf(attributionTexts);
        hasFiles = hasFiles == null ? List.of() : List.copyOf(hasFiles);
        extraFields = extraFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    @Override
    public EntityType entityType() {
        return EntityType.PACKAGE;
    }

    /**
     * Returns the effective files-analyzed flag, applying the SPDX default of true.
     *
     * @return false only if the document explicitly sets {@code filesAnalyzed: false}
     */
    public boolean effectiveFilesAnalyzed() {
        return filesAnalyzed == null || filesAnalyzed;
    }
}
