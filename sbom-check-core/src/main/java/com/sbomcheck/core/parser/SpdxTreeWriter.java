package com.sbomcheck.core.parser;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sbomcheck.core.model.CreationInfo;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.model.SpdxFile;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.model.SpdxSnippet;

import java.util.Map;

/**
 * Turns a bound entity back into an SPDX JSON tree, so that configured field paths can be
 * looked up by their SPDX JSON names.
 *
 * <p>Absent fields are left out of the tree and unknown fields kept by the binder are merged
 * back in.
 */
public final class SpdxTreeWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private SpdxTreeWriter() {
    }

    /**
     * Serializes an entity.
     *
     * @param entity bound entity
     * @return JSON object named the way the SPDX JSON schema names the fields
     */
    public static JsonNode toTree(SpdxEntity entity) {
        JsonNode tree = MAPPER.valueToTree(entity);
        if (!(tree instanceof ObjectNode object)) {
            return tree;
        }
        if (entity instanceof SpdxDocument document) {
            mergeExtras(object, document.extraFields());
            CreationInfo creationInfo = document.creationInfo();
            if (creationInfo != null && object.get("creationInfo") instanceof ObjectNode creationNode) {
                mergeExtras(creationNode, creationInfo.extraFields());
            }
        } else if (entity instanceof SpdxPackage pkg) {
            mergeExtras(object, pkg.extraFields());
        } else if (entity instanceof SpdxFile file) {
            mergeExtras(object, file.extraFields());
        } else if (entity instanceof SpdxSnippet snippet) {
            mergeExtras(object, snippet.extraFields());
        }
        return object;
    }

    private static void mergeExtras(ObjectNode target, Map<String, JsonNode> extras) {
        extras.forEach((name, value) -> {
            if (!target.has(name)) {
                target.set(name, value);
            }
        });
    }
}
