package com.sbomcheck.core.model;

/**
 * An external reference of a package (e.g. a purl or CPE).
 *
 * @param referenceCategory raw category, e.g. {@code PACKAGE-MANAGER}
 * @param referenceType type within the category, e.g. {@code purl}
 * @param referenceLocator locator string
 * @param comment optional comment
 */
public record ExternalRef(
    String referenceCategory,
    String referenceType,
    String referenceLocator,
    String comment
) {}
