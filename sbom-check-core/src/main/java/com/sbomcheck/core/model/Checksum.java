package com.sbomcheck.core.model;

/**
 * A checksum of a package, file or external document.
 *
 * @param algorithm raw algorithm name, e.g. {@code SHA1}
 * @param checksumValue hex digest
 */
public record Checksum(
    String algorithm,
    String checksumValue
) {}
