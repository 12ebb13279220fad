package com.sbomcheck.core.resolver;

import com.sbomcheck.core.model.ExtractedLicensingInfo;
import com.sbomcheck.core.model.SpdxElement;
import com.sbomcheck.core.model.SpdxEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only identifier index over one SPDX document.
 *
 * <p>Built once per document by {@link ReferenceResolver} and shared by every rule set.
 * Lookups never fail: an unknown identifier resolves to {@link Optional#empty()} and it is
 * up to the rules to report it. When an identifier is declared more than once, the first
 * occurrence is canonical.
 */
public final class ReferenceIndex {

    private static final String DOCUMENT_REF_PREFIX = "DocumentRef-";

    private final Map<String, SpdxElement> elementsById;
    private final Map<String, ExtractedLicensingInfo> licensesById;
    private final Set<String> externalDocumentIds;
    private final List<DuplicateIdentifier> duplicateIds;
    private final List<String> describedIds;

    ReferenceIndex(
            Map<String, SpdxElement> elementsById,
            Map<String, ExtractedLicensingInfo> licensesById,
            Set<String> externalDocumentIds,
            List<DuplicateIdentifier> duplicateIds,
            List<String> describedIds) {
        this.elementsById = Map.copyOf(elementsById);
        this.licensesById = Map.copyOf(licensesById);
        this.externalDocumentIds = Set.copyOf(externalDocumentIds);
        this.duplicateIds = List.copyOf(duplicateIds);
        this.describedIds = List.copyOf(describedIds);
    }

    /**
     * Resolves an SPDXID to the element that declares it.
     *
     * @param spdxId identifier to look up
     * @return canonical element, or empty if no element declares the id
     */
    public Optional<SpdxElement> resolve(String spdxId) {
        if (spdxId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(elementsById.get(spdxId));
    }

    /**
     * Resolves a {@code LicenseRef-} identifier to its extracted licensing info.
     *
     * @param licenseRef identifier to look up
     * @return canonical licensing info, or empty if none declares the id
     */
    public Optional<ExtractedLicensingInfo> resolveLicenseRef(String licenseRef) {
        if (licenseRef == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(licensesById.get(licenseRef));
    }

    /**
     * Returns true if the id has the form {@code DocumentRef-x:rest} and
     * {@code DocumentRef-x} is declared in the document's external document references.
     *
     * @param id identifier to test
     * @return true for a well-formed reference into a declared external document
     */
    public boolean isExternalReference(String id) {
        if (id == null || !id.startsWith(DOCUMENT_REF_PREFIX)) {
            return false;
        }
        int colon = id.indexOf(':');
        if (colon < 0 || colon == id.length() - 1) {
            return false;
        }
        return externalDocumentIds.contains(id.substring(0, colon));
    }

    /**
     * Returns true if the id uses the {@code DocumentRef-x:} form, declared or not.
     *
     * @param id identifier to test
     * @return true if the id points into another document
     */
    public boolean looksExternal(String id) {
        return id != null && id.startsWith(DOCUMENT_REF_PREFIX) && id.indexOf(':') > 0;
    }

    /**
     * Returns true if the entity is the first declaration of its identifier.
     *
     * @param entity element or extracted licensing info
     * @return false if the entity is a later duplicate of an earlier declaration
     */
    public boolean isCanonical(SpdxEntity entity) {
        return duplicateIds.stream().noneMatch(duplicate -> duplicate.duplicate() == entity);
    }

    /**
     * Returns every duplicate declaration found, in appearance order.
     *
     * @return duplicates of SPDXIDs and LicenseRef ids
     */
    public List<DuplicateIdentifier> duplicateIds() {
        return duplicateIds;
    }

    /**
     * Returns the ids the document describes, from {@code DESCRIBES} and {@code DESCRIBED_BY}
     * relationships and the legacy {@code documentDescribes} list, without repeats.
     *
     * @return described ids in appearance order
     */
    public List<String> describedIds() {
        return describedIds;
    }
}
