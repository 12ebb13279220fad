package com.sbomcheck.core.license;

import java.util.List;

/**
 * A parsed SPDX license expression, reduced to the identifiers it mentions.
 *
 * <p>Operator structure is not kept: rules only need to know which licenses,
 * custom {@code LicenseRef-} ids and exceptions an expression refers to.
 *
 * @param text original expression text
 * @param licenseIds license ids from the SPDX list, in appearance order ({@code +} stripped)
 * @param licenseRefs local {@code LicenseRef-} ids that must resolve within the document
 * @param externalLicenseRefs {@code DocumentRef-x:LicenseRef-y} ids pointing at other documents
 * @param exceptionIds exception ids following {@code WITH}
 * @param placeholder true for the standalone values {@code NONE} and {@code NOASSERTION}
 */
public record LicenseExpression(
    String text,
    List<String> licenseIds,
    List<String> licenseRefs,
    List<String> externalLicenseRefs,
    List<String> exceptionIds,
    boolean placeholder
) {
    /**
     * Compact constructor with validation.
     */
    public LicenseExpression {
        licenseIds = licenseIds == null ? List.of() : List.copyOf(licenseIds);
        licenseRefs = licenseRefs == null ? List.of() : List.copyOf(licenseRefs);
        externalLicenseRefs = externalLicenseRefs == null ? List.of() : List.copyOf(externalLicenseRefs);
        exceptionIds = exceptionIds == null ? List.of() : List.copyOf(exceptionIds);
    }

    static LicenseExpression placeholder(String text) {
        return new LicenseExpression(text, List.of(), List.of(), List.of(), List.of(), true);
    }

    /**
     * Returns true if the expression is a single license or LicenseRef id, without operators or exceptions.
     *
     * @return true for a simple expression
     */
    public boolean isSingleIdentifier() {
        return placeholder
            || (licenseIds.size() + licenseRefs.size() + externalLicenseRefs.size() == 1
                && exceptionIds.isEmpty()
                && !text.contains("("));
    }
}
