package com.sbomcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the document model: a bound SPDX 2.3 JSON document.
 *
 * <p>The model is a plain data container. Fields the binder could not coerce to their
 * expected JSON type are absent here and listed in {@code structuralIssues} instead.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SpdxDocument document = new SpdxJsonBinder().bind(jsonNode);
 * for (SpdxEntity entity : document.entities()) {
 *     System.out.println(entity.entityType() + " " + entity.entityId());
 * }
 * }</pre>
 *
 * @param spdxVersion SPDX version, expected {@code SPDX-2.3}
 * @param dataLicense data license, expected {@code CC0-1.0}
 * @param spdxId SPDXID of the document, expected {@code SPDXRef-DOCUMENT}
 * @param name document name
 * @param documentNamespace unique document namespace URI
 * @param comment document comment
 * @param creationInfo creation information, null if missing
 * @param externalDocumentRefs references to other SPDX documents
 * @param documentDescribes legacy list of described element ids
 * @param packages packages in document order
 * @param files files in document order
 * @param snippets snippets in document order
 * @param relationships relationships in document order
 * @param extractedLicensingInfos custom licenses in document order
 * @param extraFields fields not known to SPDX 2.3, kept but not validated
 * @param structuralIssues fields that could not be bound
 */
public record SpdxDocument(
    String spdxVersion,
    String dataLicense,
    @JsonProperty("SPDXID") String spdxId,
    String name,
    String documentNamespace,
    String comment,
    CreationInfo creationInfo,
    List<ExternalDocumentRef> externalDocumentRefs,
    List<String> documentDescribes,
    List<SpdxPackage> packages,
    List<SpdxFile> files,
    List<SpdxSnippet> snippets,
    List<Relationship> relationships,
    @JsonProperty("hasExtractedLicensingInfos") List<ExtractedLicensingInfo> extractedLicensingInfos,
    @JsonIgnore Map<String, JsonNode> extraFields,
    @JsonIgnore List<StructuralIssue> structuralIssues
) implements SpdxElement {

    /**
     * Compact constructor with validation.
     */
    public SpdxDocument {
        externalDocumentRefs = externalDocumentRefs == null ? List.of() : List.copyOf(externalDocumentRefs);
        documentDescribes = documentDescribes == null ? List.of() : List.copyOf(documentDescribes);
        packages = packages == null ? List.of() : List.copyOf(packages);
        files = files == null ? List.of() : List.copyOf(files);
        snippets = snippets == null ? List.of() : List.copyOf(snippets);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        extractedLicensingInfos = extractedLicensingInfos == null ? List.of() : List.copyOf(extractedLicensingInfos);
        extraFields = extraFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
        structuralIssues = structuralIssues == null ? List.of() : List.copyOf(structuralIssues);
    }

    /**
     * Creates a document that could not be bound at all.
     *
     * @param issue root issue explaining why
     * @return empty document carrying the issue
     */
    public static SpdxDocument fromRootIssue(StructuralIssue issue) {
        return new SpdxDocument(
            null, null, null, null, null, null, null,
            List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
            Map.of(), List.of(issue)
        );
    }

    @Override
    public EntityType entityType() {
        return EntityType.DOCUMENT;
    }

    /**
     * Returns true if the top-level JSON value could not be bound as a document.
     *
     * @return true if a root structural issue exists
     */
    public boolean rejected() {
        return structuralIssues.stream().anyMatch(StructuralIssue::isRoot);
    }

    /**
     * Returns true if the given field failed to bind, so that presence rules skip it.
     *
     * @param location entity location, e.g. {@code packages[0]}, empty for the document
     * @param localPath dotted field path relative to that entity
     * @return true if a structural issue covers the field
     */
    public boolean hasStructuralIssue(String location, String localPath) {
        return structuralIssues.stream().anyMatch(issue -> issue.covers(location, localPath));
    }

    /**
     * Returns every entity of the document in appearance order: the document itself,
     * then packages, files, snippets, extracted licenses and relationships.
     *
     * @return entities in the order violations are reported
     */
    public List<SpdxEntity> entities() {
        List<SpdxEntity> entities = new ArrayList<>();
        entities.add(this);
        entities.addAll(packages);
        entities.addAll(files);
        entities.addAll(snippets);
        entities.addAll(extractedLicensingInfos);
        entities.addAll(relationships);
        return entities;
    }

    /**
     * Returns the elements that carry an SPDXID, in appearance order.
     *
     * @return document, packages, files and snippets
     */
    public List<SpdxElement> elements() {
        List<SpdxElement> elements = new ArrayList<>();
        elements.add(this);
        elements.addAll(packages);
        elements.addAll(files);
        elements.addAll(snippets);
        return elements;
    }
}
