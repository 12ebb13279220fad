package com.sbomcheck.core.rule.spdx;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Value formats defined by SPDX 2.3.
 */
public final class SpdxFormats {

    public static final String DOCUMENT_SPDX_ID = "SPDXRef-DOCUMENT";
    public static final String SPDX_VERSION = "SPDX-2.3";
    public static final String DATA_LICENSE = "CC0-1.0";
    public static final String NOASSERTION = "NOASSERTION";
    public static final String NONE = "NONE";

    private static final Pattern ELEMENT_ID = Pattern.compile("SPDXRef-[A-Za-z0-9.\\-]+");
    private static final Pattern LICENSE_REF = Pattern.compile("LicenseRef-[A-Za-z0-9.\\-]+");
    private static final Pattern DOCUMENT_REF = Pattern.compile("DocumentRef-[A-Za-z0-9.\\-]+");
    private static final Pattern CREATOR = Pattern.compile("(Person|Organization|Tool): \\S.*");
    private static final Pattern ACTOR = Pattern.compile("(Person|Organization): \\S.*");
    private static final Pattern LICENSE_LIST_VERSION = Pattern.compile("\\d+\\.\\d+");
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");
    private static final Pattern SHA1_HEX = Pattern.compile("[0-9a-fA-F]{40}");

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
        .ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'")
        .withResolverStyle(ResolverStyle.STRICT);

    private SpdxFormats() {
    }

    public static boolean isElementId(String value) {
        return ELEMENT_ID.matcher(value).matches();
    }

    public static boolean isLicenseRef(String value) {
        return LICENSE_REF.matcher(value).matches();
    }

    public static boolean isDocumentRef(String value) {
        return DOCUMENT_REF.matcher(value).matches();
    }

    public static boolean isCreator(String value) {
        return CREATOR.matcher(value).matches();
    }

    /**
     * Returns true for a supplier or originator value.
     *
     * @param value value to test
     * @return true for {@code Person: ...}, {@code Organization: ...} or {@code NOASSERTION}
     */
    public static boolean isActorOrNoAssertion(String value) {
        return NOASSERTION.equals(value) || ACTOR.matcher(value).matches();
    }

    public static boolean isLicenseListVersion(String value) {
        return LICENSE_LIST_VERSION.matcher(value).matches();
    }

    public static boolean isHex(String value) {
        return HEX.matcher(value).matches();
    }

    public static boolean isSha1Hex(String value) {
        return SHA1_HEX.matcher(value).matches();
    }

    /**
     * Returns true for a UTC timestamp {@code YYYY-MM-DDThh:mm:ssZ} naming a real instant.
     *
     * @param value value to test
     * @return true if the value parses strictly
     */
    public static boolean isTimestamp(String value) {
        try {
            LocalDateTime.parse(value, TIMESTAMP);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Returns true for an absolute URI without a fragment, as required for document namespaces.
     *
     * @param value value to test
     * @return true for a usable namespace
     */
    public static boolean isNamespace(String value) {
        if (value.indexOf('#') >= 0) {
            return false;
        }
        try {
            URI uri = new URI(value);
            return uri.isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Returns true if the value contains no whitespace, as required for external ref locators.
     *
     * @param value value to test
     * @return true if there is no blank character
     */
    public static boolean hasNoWhitespace(String value) {
        return value.chars().noneMatch(Character::isWhitespace);
    }
}
