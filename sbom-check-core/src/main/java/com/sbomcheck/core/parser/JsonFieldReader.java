package com.sbomcheck.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.model.StructuralIssue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Typed access to the fields of one JSON object.
 *
 * <p>Every accessor returns null (or an empty list) when the field is absent or JSON
 * {@code null}. A field of the wrong JSON type is recorded as a {@link StructuralIssue}
 * and also reads as absent. Fields read through this reader are remembered so that the
 * remaining ones can be collected as unknown extras.
 */
final class JsonFieldReader {

    private final JsonNode node;
    private final String entityId;
    private final String location;
    private final String pathPrefix;
    private final String localPrefix;
    private final List<StructuralIssue> issues;
    private final Set<String> readFields = new HashSet<>();

    private JsonFieldReader(JsonNode node, String entityId, String location, String pathPrefix,
                            String localPrefix, List<StructuralIssue> issues) {
        this.node = node;
        this.entityId = entityId;
        this.location = location;
        this.pathPrefix = pathPrefix;
        this.localPrefix = localPrefix;
        this.issues = issues;
    }

    /**
     * Creates the reader of a document's top-level object.
     *
     * @param root top-level JSON object
     * @param issues list collecting structural issues
     * @return reader located at the document
     */
    static JsonFieldReader root(JsonNode root, List<StructuralIssue> issues) {
        return new JsonFieldReader(root, null, StructuralIssue.DOCUMENT_LOCATION, "", "", issues);
    }

    /**
     * Re-roots this reader at an entity identified by the given field.
     *
     * <p>When the id is present, issues are reported against it with entity-relative paths.
     * Otherwise the positional prefix (e.g. {@code packages[2].}) is kept.
     *
     * @param idField name of the identifier field
     * @return reader scoped to the entity
     */
    JsonFieldReader asEntity(String idField) {
        JsonNode id = node.get(idField);
        if (id != null && id.isTextual()) {
            return new JsonFieldReader(node, id.asText(), location, "", localPrefix, issues);
        }
        return new JsonFieldReader(node, entityId, location, pathPrefix, localPrefix, issues);
    }

    String entityId() {
        return entityId;
    }

    String string(String field) {
        JsonNode value = field(field);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            reportType(field, "a string", value);
            return null;
        }
        return value.asText();
    }

    Boolean bool(String field) {
        JsonNode value = field(field);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            reportType(field, "a boolean", value);
            return null;
        }
        return value.asBoolean();
    }

    Integer integer(String field) {
        JsonNode value = field(field);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            reportType(field, "an integer", value);
            return null;
        }
        return value.asInt();
    }

    List<String> stringList(String field) {
        JsonNode value = field(field);
        if (value == null) {
            return List.of();
        }
        if (!value.isArray()) {
            reportType(field, "an array", value);
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            if (element.isTextual()) {
                result.add(element.asText());
            } else if (!element.isNull()) {
                reportType(field + "[" + i + "]", "a string", element);
            }
        }
        return result;
    }

    JsonFieldReader object(String field) {
        JsonNode value = field(field);
        if (value == null) {
            return null;
        }
        if (!value.isObject()) {
            reportType(field, "an object", value);
            return null;
        }
        return new JsonFieldReader(value, entityId, location, path(field) + ".", localPrefix + field + ".", issues);
    }

    /**
     * Reads an array of objects that belong to this reader's entity, such as checksums.
     *
     * @param field array field
     * @return one reader per object element
     */
    List<JsonFieldReader> objectList(String field) {
        return readObjects(field, false);
    }

    /**
     * Reads an array of entities, such as packages.
     *
     * <p>Each element reader is located at its position among the bound elements
     * ({@code packages[0]}, {@code packages[1]}, ...), which is also its index in the model
     * list, so issues of two entities sharing an SPDXID stay apart.
     *
     * @param field array field
     * @return one reader per object element
     */
    List<JsonFieldReader> entityList(String field) {
        return readObjects(field, true);
    }

    private List<JsonFieldReader> readObjects(String field, boolean entities) {
        JsonNode value = field(field);
        if (value == null) {
            return List.of();
        }
        if (!value.isArray()) {
            reportType(field, "an array", value);
            return List.of();
        }
        List<JsonFieldReader> result = new ArrayList<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            String elementField = field + "[" + i + "]";
            if (!element.isObject()) {
                reportType(elementField, "an object", element);
            } else if (entities) {
                String elementLocation = field + "[" + result.size() + "]";
                result.add(new JsonFieldReader(element, entityId, elementLocation, path(elementField) + ".", "", issues));
            } else {
                result.add(new JsonFieldReader(element, entityId, location, path(elementField) + ".",
                    localPrefix + elementField + ".", issues));
            }
        }
        return result;
    }

    /**
     * Returns the fields of this object that no accessor has read.
     *
     * @return unknown fields in document order
     */
    Map<String, JsonNode> extraFields() {
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!readFields.contains(entry.getKey())) {
                extras.put(entry.getKey(), entry.getValue());
            }
        }
        return extras;
    }

    private JsonNode field(String field) {
        readFields.add(field);
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value;
    }

    private void reportType(String field, String expected, JsonNode actual) {
        String actualType = actual.getNodeType().name().toLowerCase(Locale.ROOT);
        issues.add(new StructuralIssue(
            entityId,
            location,
            path(field),
            localPrefix + field,
            path(field) + " must be " + expected + " but was " + actualType
        ));
    }

    private String path(String field) {
        return pathPrefix + field;
    }
}
