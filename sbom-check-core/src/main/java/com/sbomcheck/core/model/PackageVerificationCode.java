package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Verification code computed over the files of a package.
 *
 * @param value 40 hex character SHA1 value
 * @param excludedFiles files excluded from the computation
 */
public record PackageVerificationCode(
    @JsonProperty("packageVerificationCodeValue") String value,
    @JsonProperty("packageVerificationCodeExcludedFiles") List<String> excludedFiles
) {
    /**
     * Compact constructor with validation.
     */
    public PackageVerificationCode {
        excludedFiles = excludedFiles == null ? List.of() : List.copyOf(excludedFiles);
    }
}
