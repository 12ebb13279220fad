package com.sbomcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Checksum algorithms defined by SPDX 2.3, with the hex digest length each one produces.
 *
 * <p>BLAKE3 and MD6 have variable output sizes and declare a length range instead.
 */
public enum ChecksumAlgorithm {
    SHA1("SHA1", 40, 40),
    SHA224("SHA224", 56, 56),
    SHA256("SHA256", 64, 64),
    SHA384("SHA384", 96, 96),
    SHA512("SHA512", 128, 128),
    SHA3_256("SHA3-256", 64, 64),
    SHA3_384("SHA3-384", 96, 96),
    SHA3_512("SHA3-512", 128, 128),
    BLAKE2B_256("BLAKE2b-256", 64, 64),
    BLAKE2B_384("BLAKE2b-384", 96, 96),
    BLAKE2B_512("BLAKE2b-512", 128, 128),
    BLAKE3("BLAKE3", 64, Integer.MAX_VALUE),
    MD2("MD2", 32, 32),
    MD4("MD4", 32, 32),
    MD5("MD5", 32, 32),
    MD6("MD6", 1, 128),
    ADLER32("ADLER32", 8, 8);

    private final String spdxName;
    private final int minHexLength;
    private final int maxHexLength;

    ChecksumAlgorithm(String spdxName, int minHexLength, int maxHexLength) {
        this.spdxName = spdxName;
        this.minHexLength = minHexLength;
        this.maxHexLength = maxHexLength;
    }

    public String spdxName() {
        return spdxName;
    }

    /**
     * Returns true if a digest of the given length is valid for this algorithm.
     *
     * @param hexLength number of hex characters in the digest
     * @return true if the length matches
     */
    public boolean acceptsLength(int hexLength) {
        return hexLength >= minHexLength && hexLength <= maxHexLength;
    }

    /**
     * Returns a human-readable description of the expected digest length.
     *
     * @return e.g. {@code "40"} or {@code "at least 64"}
     */
    public String describeLength() {
        if (minHexLength == maxHexLength) {
            return String.valueOf(minHexLength);
        }
        if (maxHexLength == Integer.MAX_VALUE) {
            return "at least " + minHexLength;
        }
        return minHexLength + " to " + maxHexLength;
    }

    /**
     * Looks up an algorithm by its SPDX JSON name (e.g. {@code SHA3-256}).
     *
     * @param value raw value from the document
     * @return matching algorithm, or empty if unknown
     */
    public static Optional<ChecksumAlgorithm> fromSpdxName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(algorithm -> algorithm.spdxName.equals(value))
            .findFirst();
    }
}
