package com.sbomcheck.core.resolver;

import com.sbomcheck.core.model.ExternalDocumentRef;
import com.sbomcheck.core.model.ExtractedLicensingInfo;
import com.sbomcheck.core.model.Relationship;
import com.sbomcheck.core.model.RelationshipType;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link ReferenceIndex} of a document.
 *
 * <p>Resolution is pure and always succeeds: duplicate identifiers are recorded rather
 * than rejected, and the first occurrence of each identifier stays canonical.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    static final String DEFAULT_DOCUMENT_ID = "SPDXRef-DOCUMENT";

    /**
     * Indexes a bound document.
     *
     * @param documentId identifier of the source the document came from
     * @param document bound document
     * @return the document paired with its index
     */
    public ResolvedDocument resolve(String documentId, SpdxDocument document) {
        List<DuplicateIdentifier> duplicates = new ArrayList<>();

        Map<String, SpdxElement> elementsById = new HashMap<>();
        for (SpdxElement element : document.elements()) {
            String id = element.spdxId();
            if (id == null) {
                continue;
            }
            SpdxElement existing = elementsById.putIfAbsent(id, element);
            if (existing != null) {
                duplicates.add(new DuplicateIdentifier(id, existing, element));
            }
        }

        Map<String, ExtractedLicensingInfo> licensesById = new HashMap<>();
        for (ExtractedLicensingInfo license : document.extractedLicensingInfos()) {
            String id = license.licenseId();
            if (id == null) {
                continue;
            }
            ExtractedLicensingInfo existing = licensesById.putIfAbsent(id, license);
            if (existing != null) {
                duplicates.add(new DuplicateIdentifier(id, existing, license));
            }
        }

        Set<String> externalDocumentIds = new HashSet<>();
        for (ExternalDocumentRef ref : document.externalDocumentRefs()) {
            if (ref.externalDocumentId() != null) {
                externalDocumentIds.add(ref.externalDocumentId());
            }
        }

        List<String> describedIds = collectDescribedIds(document);

        if (!duplicates.isEmpty()) {
            log.debug("Document {} declares {} duplicate identifier(s)", documentId, duplicates.size());
        }

        ReferenceIndex index = new ReferenceIndex(
            elementsById, licensesById, externalDocumentIds, duplicates, describedIds);
        return new ResolvedDocument(documentId, document, index);
    }

    private List<String> collectDescribedIds(SpdxDocument document) {
        String documentSpdxId = document.spdxId() != null ? document.spdxId() : DEFAULT_DOCUMENT_ID;
        Set<String> described = new LinkedHashSet<>(document.documentDescribes());
        for (Relationship relationship : document.relationships()) {
            if (relationship.hasType(RelationshipType.DESCRIBES)
                    && documentSpdxId.equals(relationship.spdxElementId())
                    && relationship.relatedSpdxElementId() != null) {
                described.add(relationship.relatedSpdxElementId());
            } else if (relationship.hasType(RelationshipType.DESCRIBED_BY)
                    && documentSpdxId.equals(relationship.relatedSpdxElementId())
                    && relationship.spdxElementId() != null) {
                described.add(relationship.spdxElementId());
            }
        }
        return new ArrayList<>(described);
    }
}
