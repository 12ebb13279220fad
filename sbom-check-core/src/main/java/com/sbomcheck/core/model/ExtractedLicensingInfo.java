package com.sbomcheck.core.model;

import java.util.List;

/**
 * A license not on the SPDX license list, referenced from license expressions
 * as {@code LicenseRef-<id>}.
 *
 * @param licenseId identifier, {@code LicenseRef-...}
 * @param extractedText verbatim license text
 * @param name optional license name
 * @param seeAlsos optional cross reference URLs
 * @param comment optional comment
 */
public record ExtractedLicensingInfo(
    String licenseId,
    String extractedText,
    String name,
    List<String> seeAlsos,
    String comment
) implements SpdxEntity {

    /**
     * Compact constructor with validation.
     */
    public ExtractedLicensingInfo {
        seeAlsos = seeAlsos == null ? List.of() : List.copyOf(seeAlsos);
    }

    @Override
    public EntityType entityType() {
        return EntityType.EXTRACTED_LICENSING_INFO;
    }

    @Override
    public String entityId() {
        return licenseId;
    }
}
