package com.sbomcheck.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.parser.SpdxJsonBinder;
import com.sbomcheck.core.resolver.ReferenceResolver;
import com.sbomcheck.core.rule.RuleContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Shared SPDX documents for tests.
 *
 * <p>{@link #valid()} returns a fresh, mutable copy of a document that passes every
 * specification rule and the bundled policy, so tests can break exactly one thing.
 */
public final class SpdxFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final String VALID_RESOURCE = "/fixtures/valid.spdx.json";
    public static final String PACKAGE_ID = "SPDXRef-Package-example-app";
    public static final String FILE_ID = "SPDXRef-File-main";

    private SpdxFixtures() {
    }

    public static ObjectNode valid() {
        try (InputStream in = SpdxFixtures.class.getResourceAsStream(VALID_RESOURCE)) {
            return (ObjectNode) MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String validJson() {
        return valid().toPrettyString();
    }

    public static ObjectNode firstPackage(ObjectNode document) {
        return (ObjectNode) document.get("packages").get(0);
    }

    public static ObjectNode firstFile(ObjectNode document) {
        return (ObjectNode) document.get("files").get(0);
    }

    public static ArrayNode relationships(ObjectNode document) {
        return arrayField(document, "relationships");
    }

    public static ObjectNode addRelationship(ObjectNode document, String from, String type, String to) {
        return relationships(document).addObject()
            .put("spdxElementId", from)
            .put("relationshipType", type)
            .put("relatedSpdxElementId", to);
    }

    public static ObjectNode addExtractedLicense(ObjectNode document, String licenseId) {
        return arrayField(document, "hasExtractedLicensingInfos").addObject()
            .put("licenseId", licenseId)
            .put("extractedText", "Custom license text for " + licenseId);
    }

    public static ArrayNode arrayField(ObjectNode document, String field) {
        if (document.get(field) instanceof ArrayNode array) {
            return array;
        }
        return document.putArray(field);
    }

    public static SpdxDocument bind(JsonNode document) {
        return new SpdxJsonBinder().bind(document);
    }

    public static RuleContext context(JsonNode document) {
        return new RuleContext(new ReferenceResolver().resolve("test.spdx.json", bind(document)));
    }
}
