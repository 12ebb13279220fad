package com.sbomcheck.core.resolver;

import com.sbomcheck.core.model.SpdxEntity;

/**
 * An identifier declared by more than one entity.
 *
 * @param identifier the duplicated SPDXID or LicenseRef id
 * @param canonical first occurrence, used for all lookups
 * @param duplicate a later occurrence that lookups ignore
 */
public record DuplicateIdentifier(
    String identifier,
    SpdxEntity canonical,
    SpdxEntity duplicate
) {}
