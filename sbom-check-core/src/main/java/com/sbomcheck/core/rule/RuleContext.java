package com.sbomcheck.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.model.StructuralIssue;
import com.sbomcheck.core.parser.SpdxTreeWriter;
import com.sbomcheck.core.resolver.ReferenceIndex;
import com.sbomcheck.core.resolver.ResolvedDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of one resolved document, shared by every rule evaluated against it.
 *
 * <p>Besides the document and its {@link ReferenceIndex}, the context knows which fields
 * failed to bind, so that presence and format rules can skip them instead of reporting the
 * same problem twice.
 *
 * <p>A context belongs to one document evaluation and is not shared between threads.
 */
public final class RuleContext {

    private final ResolvedDocument resolved;
    private final Map<SpdxEntity, String> listPaths = new IdentityHashMap<>();
    private final Map<SpdxEntity, List<StructuralIssue>> issuesByEntity = new IdentityHashMap<>();
    private final Map<SpdxEntity, JsonNode> entityTrees = new IdentityHashMap<>();

    /**
     * Creates the context of a resolved document.
     *
     * @param resolved document and index
     */
    public RuleContext(ResolvedDocument resolved) {
        this.resolved = Objects.requireNonNull(resolved, "resolved must not be null");
        SpdxDocument document = resolved.document();
        indexListPaths("packages", document.packages());
        indexListPaths("files", document.files());
        indexListPaths("snippets", document.snippets());
        indexListPaths("relationships", document.relationships());
        indexListPaths("hasExtractedLicensingInfos", document.extractedLicensingInfos());
        assignIssues(document);
    }

    public String documentId() {
        return resolved.documentId();
    }

    public SpdxDocument document() {
        return resolved.document();
    }

    public ReferenceIndex index() {
        return resolved.index();
    }

    /**
     * Returns true if the field of the entity was present in the JSON but could not be bound.
     *
     * @param entity entity owning the field
     * @param fieldPath dotted field path relative to the entity
     * @return true if a structural issue already covers the field
     */
    public boolean isUnbound(SpdxEntity entity, String fieldPath) {
        SpdxDocument document = document();
        if (document.rejected()) {
            return true;
        }
        return document.hasStructuralIssue(locationOf(entity), fieldPath);
    }

    /**
     * Returns the structural issues reported at the position of the given entity.
     *
     * <p>Each issue is attributed to the entity bound at the issue's list position, or to
     * the document when the issue lies outside every entity list.
     *
     * @param entity entity to look up
     * @return issues attributed to the entity, empty if none
     */
    public List<StructuralIssue> structuralIssuesOf(SpdxEntity entity) {
        return issuesByEntity.getOrDefault(entity, List.of());
    }

    /**
     * Returns the entity as an SPDX JSON tree, serialized once per entity.
     *
     * @param entity entity to serialize
     * @return JSON object using SPDX field names
     */
    public JsonNode entityTree(SpdxEntity entity) {
        return entityTrees.computeIfAbsent(entity, SpdxTreeWriter::toTree);
    }

    private void indexListPaths(String field, List<? extends SpdxEntity> entities) {
        for (int i = 0; i < entities.size(); i++) {
            listPaths.put(entities.get(i), field + "[" + i + "]");
        }
    }

    private String locationOf(SpdxEntity entity) {
        return listPaths.getOrDefault(entity, StructuralIssue.DOCUMENT_LOCATION);
    }

    private void assignIssues(SpdxDocument document) {
        Map<String, SpdxEntity> entitiesByLocation = new HashMap<>();
        listPaths.forEach((entity, location) -> entitiesByLocation.put(location, entity));
        for (StructuralIssue issue : document.structuralIssues()) {
            SpdxEntity owner = issue.isRoot()
                ? document
                : entitiesByLocation.getOrDefault(issue.location(), document);
            issuesByEntity.computeIfAbsent(owner, key -> new ArrayList<>()).add(issue);
        }
    }
}
