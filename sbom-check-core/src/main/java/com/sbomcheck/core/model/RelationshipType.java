package com.sbomcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Relationship types defined by SPDX 2.3 (clause 11.1).
 *
 * <p>Relationships keep the raw type string from the document; this enum is used to
 * check membership so that unknown values are reported instead of dropped.
 */
public enum RelationshipType {
    DESCRIBES,
    DESCRIBED_BY,
    CONTAINS,
    CONTAINED_BY,
    DEPENDS_ON,
    DEPENDENCY_OF,
    DEPENDENCY_MANIFEST_OF,
    BUILD_DEPENDENCY_OF,
    DEV_DEPENDENCY_OF,
    OPTIONAL_DEPENDENCY_OF,
    PROVIDED_DEPENDENCY_OF,
    TEST_DEPENDENCY_OF,
    RUNTIME_DEPENDENCY_OF,
    EXAMPLE_OF,
    GENERATES,
    GENERATED_FROM,
    ANCESTOR_OF,
    DESCENDANT_OF,
    VARIANT_OF,
    DISTRIBUTION_ARTIFACT,
    PATCH_FOR,
    PATCH_APPLIED,
    COPY_OF,
    FILE_ADDED,
    FILE_DELETED,
    FILE_MODIFIED,
    EXPANDED_FROM_ARCHIVE,
    DYNAMIC_LINK,
    STATIC_LINK,
    DATA_FILE_OF,
    TEST_CASE_OF,
    BUILD_TOOL_OF,
    DEV_TOOL_OF,
    TEST_OF,
    TEST_TOOL_OF,
    DOCUMENTATION_OF,
    OPTIONAL_COMPONENT_OF,
    METAFILE_OF,
    PACKAGE_OF,
    AMENDS,
    PREREQUISITE_FOR,
    HAS_PREREQUISITE,
    REQUIREMENT_DESCRIPTION_FOR,
    SPECIFICATION_FOR,
    OTHER;

    /**
     * Looks up a relationship type by its SPDX JSON name.
     *
     * @param value raw value from the document
     * @return matching type, or empty if the value is not an SPDX 2.3 relationship type
     */
    public static Optional<RelationshipType> fromSpdxName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.name().equals(value))
            .findFirst();
    }
}
