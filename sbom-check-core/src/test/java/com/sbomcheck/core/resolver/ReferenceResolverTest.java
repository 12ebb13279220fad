package com.sbomcheck.core.resolver;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sbomcheck.core.SpdxFixtures;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxElement;
import org.junit.jupiter.api.Test;

import static com.sbomcheck.core.SpdxFixtures.FILE_ID;
import static com.sbomcheck.core.SpdxFixtures.PACKAGE_ID;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReferenceResolver}.
 */
class ReferenceResolverTest {

    private final ReferenceResolver resolver = new ReferenceResolver();

    private ReferenceIndex index(ObjectNode json) {
        return resolver.resolve("test.spdx.json", SpdxFixtures.bind(json)).index();
    }

    @Test
    void resolve_indexesEveryElement() {
        ReferenceIndex index = index(SpdxFixtures.valid());

        assertThat(index.resolve("SPDXRef-DOCUMENT")).isPresent();
        assertThat(index.resolve(PACKAGE_ID)).map(SpdxElement::spdxId).hasValue(PACKAGE_ID);
        assertThat(index.resolve(FILE_ID)).isPresent();
        assertThat(index.resolve("SPDXRef-missing")).isEmpty();
        assertThat(index.duplicateIds()).isEmpty();
    }

    @Test
    void resolve_duplicateId_keepsFirstOccurrence() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.arrayField(json, "packages").addObject()
            .put("SPDXID", PACKAGE_ID)
            .put("name", "shadow")
            .put("downloadLocation", "NOASSERTION");

        SpdxDocument document = SpdxFixtures.bind(json);
        ReferenceIndex index = resolver.resolve("test.spdx.json", document).index();

        assertThat(index.duplicateIds()).singleElement().satisfies(duplicate -> {
            assertThat(duplicate.identifier()).isEqualTo(PACKAGE_ID);
            assertThat(duplicate.canonical()).isSameAs(document.packages().get(0));
            assertThat(duplicate.duplicate()).isSameAs(document.packages().get(1));
        });
        assertThat(index.resolve(PACKAGE_ID)).containsSame(document.packages().get(0));
        assertThat(index.isCanonical(document.packages().get(0))).isTrue();
        assertThat(index.isCanonical(document.packages().get(1))).isFalse();
    }

    @Test
    void resolve_licenseRefs_areIndexed() {
        ObjectNode json = SpdxFixtures.valid();
        SpdxFixtures.addExtractedLicense(json, "LicenseRef-Custom");

        ReferenceIndex index = index(json);

        assertThat(index.resolveLicenseRef("LicenseRef-Custom")).isPresent();
        assertThat(index.resolveLicenseRef("LicenseRef-Other")).isEmpty();
    }

    @Test
    void resolve_describedIds_combineAllSources() {
        ObjectNode json = SpdxFixtures.valid();
        json.putArray("documentDescribes").add(PACKAGE_ID);
        SpdxFixtures.addRelationship(json, FILE_ID, "DESCRIBED_BY", "SPDXRef-DOCUMENT");

        ReferenceIndex index = index(json);

        assertThat(index.describedIds()).containsExactly(PACKAGE_ID, FILE_ID);
    }

    @Test
    void resolve_externalReferences_requireDeclaredDocumentRef() {
        ObjectNode json = SpdxFixtures.valid();
        json.putArray("externalDocumentRefs").addObject()
            .put("externalDocumentId", "DocumentRef-base")
            .put("spdxDocument", "https://example.com/base");

        ReferenceIndex index = index(json);

        assertThat(index.isExternalReference("DocumentRef-base:SPDXRef-lib")).isTrue();
        assertThat(index.isExternalReference("DocumentRef-other:SPDXRef-lib")).isFalse();
        assertThat(index.isExternalReference("DocumentRef-base:")).isFalse();
        assertThat(index.looksExternal("DocumentRef-other:SPDXRef-lib")).isTrue();
        assertThat(index.looksExternal(PACKAGE_ID)).isFalse();
    }
}
