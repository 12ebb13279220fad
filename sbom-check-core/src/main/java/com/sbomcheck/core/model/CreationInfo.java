package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creation information block of an SPDX document.
 *
 * @param creators creator strings ({@code Person: }, {@code Organization: } or {@code Tool: })
 * @param created creation timestamp, {@code YYYY-MM-DDThh:mm:ssZ}
 * @param licenseListVersion SPDX license list version used, e.g. {@code 3.20}
 * @param comment optional creator comment
 * @param extraFields fields not known to SPDX 2.3, kept but not validated
 */
public record CreationInfo(
    List<String> creators,
    String created,
    String licenseListVersion,
    String comment,
    @JsonIgnore Map<String, JsonNode> extraFields
) {
    /**
     * Compact constructor with validation.
     */
    public CreationInfo {
        creators = creators == null ? List.of() : List.copyOf(creators);
        extraFields = extraFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }
}
