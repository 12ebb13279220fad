package com.sbomcheck.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.sbomcheck.core.model.Checksum;
import com.sbomcheck.core.model.CreationInfo;
import com.sbomcheck.core.model.ExternalDocumentRef;
import com.sbomcheck.core.model.ExternalRef;
import com.sbomcheck.core.model.ExtractedLicensingInfo;
import com.sbomcheck.core.model.PackageVerificationCode;
import com.sbomcheck.core.model.RangePointer;
import com.sbomcheck.core.model.Relationship;
import com.sbomcheck.core.model.SnippetRange;
import com.sbomcheck.core.model.SpdxDocument;
import com.sbomcheck.core.model.SpdxFile;
import com.sbomcheck.core.model.SpdxPackage;
import com.sbomcheck.core.model.SpdxSnippet;
import com.sbomcheck.core.model.StructuralIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Binds a parsed SPDX 2.3 JSON tree into the {@link SpdxDocument} model.
 *
 * <p>Binding is total: it never throws for malformed input. Fields with the wrong JSON
 * type are left out of the model and reported as {@link StructuralIssue}s on the
 * resulting document; a top-level value that is not an object yields a document that
 * carries a single root issue. Unknown fields are kept in each entity's extras map.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * JsonNode tree = new ObjectMapper().readTree(json);
 * SpdxDocument document = new SpdxJsonBinder().bind(tree);
 * if (document.rejected()) {
 *     // nothing beyond the structural issue can be validated
 * }
 * }</pre>
 */
public class SpdxJsonBinder {

    private static final Logger log = LoggerFactory.getLogger(SpdxJsonBinder.class);

    /**
     * Binds a JSON tree into the document model.
     *
     * @param root parsed JSON value, may be null
     * @return bound document, never null
     */
    public SpdxDocument bind(JsonNode root) {
        if (root == null || !root.isObject()) {
            String actual = root == null ? "missing" : root.getNodeType().name().toLowerCase(Locale.ROOT);
            log.debug("Rejecting document with top-level JSON {}", actual);
            return SpdxDocument.fromRootIssue(
                StructuralIssue.root("top-level JSON value must be an object but was " + actual));
        }

        List<StructuralIssue> issues = new ArrayList<>();
        JsonFieldReader reader = JsonFieldReader.root(root, issues).asEntity("SPDXID");

        SpdxDocument document = new SpdxDocument(
            reader.string("spdxVersion"),
            reader.string("dataLicense"),
            reader.string("SPDXID"),
            reader.string("name"),
            reader.string("documentNamespace"),
            reader.string("comment"),
            bindCreationInfo(reader.object("creationInfo")),
            reader.objectList("externalDocumentRefs").stream().map(this::bindExternalDocumentRef).toList(),
            reader.stringList("documentDescribes"),
            reader.entityList("packages").stream().map(this::bindPackage).toList(),
            reader.entityList("files").stream().map(this::bindFile).toList(),
            reader.entityList("snippets").stream().map(this::bindSnippet).toList(),
            reader.entityList("relationships").stream().map(this::bindRelationship).toList(),
            reader.entityList("hasExtractedLicensingInfos").stream().map(this::bindExtractedLicensingInfo).toList(),
            reader.extraFields(),
            issues
        );

        log.debug("Bound document {}: {} packages, {} files, {} snippets, {} relationships, {} structural issues",
            document.spdxId(),
            document.packages().size(),
            document.files().size(),
            document.snippets().size(),
            document.relationships().size(),
            issues.size());
        return document;
    }

    private CreationInfo bindCreationInfo(JsonFieldReader reader) {
        if (reader == null) {
            return null;
        }
        return new CreationInfo(
            reader.stringList("creators"),
            reader.string("created"),
            reader.string("licenseListVersion"),
            reader.string("comment"),
            reader.extraFields()
        );
    }

    private ExternalDocumentRef bindExternalDocumentRef(JsonFieldReader reader) {
        return new ExternalDocumentRef(
            reader.string("externalDocumentId"),
            reader.string("spdxDocument"),
            bindChecksum(reader.object("checksum"))
        );
    }

    private SpdxPackage bindPackage(JsonFieldReader listReader) {
        JsonFieldReader reader = listReader.asEntity("SPDXID");
        return new SpdxPackage(
            reader.string("SPDXID"),
            reader.string("name"),
            reader.string("versionInfo"),
            reader.string("packageFileName"),
            reader.string("supplier"),
            reader.string("originator"),
            reader.string("downloadLocation"),
            reader.bool("filesAnalyzed"),
            bindVerificationCode(reader.object("packageVerificationCode")),
            bindChecksums(reader),
            reader.string("homepage"),
            reader.string("sourceInfo"),
            reader.string("licenseConcluded"),
            reader.stringList("licenseInfoFromFiles"),
            reader.string("licenseDeclared"),
            reader.string("licenseComments"),
            reader.string("copyrightText"),
            reader.string("summary"),
            reader.string("description"),
            reader.string("comment"),
            reader.objectList("externalRefs").stream().map(this::bindExternalRef).toList(),
            reader.stringList("attributionTexts"),
            reader.string("primaryPackagePurpose"),
            reader.string("releaseDate"),
            reader.string("builtDate"),
            reader.string("validUntilDate"),
            reader.stringList("hasFiles"),
            reader.extraFields()
        );
    }

    private PackageVerificationCode bindVerificationCode(JsonFieldReader reader) {
        if (reader == null) {
            return null;
        }
        return new PackageVerificationCode(
            reader.string("packageVerificationCodeValue"),
            reader.stringList("packageVerificationCodeExcludedFiles")
        );
    }

    private ExternalRef bindExternalRef(JsonFieldReader reader) {
        return new ExternalRef(
            reader.string("referenceCategory"),
            reader.string("referenceType"),
            reader.string("referenceLocator"),
            reader.string("comment")
        );
    }

    private SpdxFile bindFile(JsonFieldReader listReader) {
        JsonFieldReader reader = listReader.asEntity("SPDXID");
        return new SpdxFile(
            reader.string("SPDXID"),
            reader.string("fileName"),
            reader.stringList("fileTypes"),
            bindChecksums(reader),
            reader.string("licenseConcluded"),
            reader.stringList("licenseInfoInFiles"),
            reader.string("licenseComments"),
            reader.string("copyrightText"),
            reader.string("comment"),
            reader.string("noticeText"),
            reader.stringList("fileContributors"),
            reader.stringList("attributionTexts"),
            reader.extraFields()
        );
    }

    private SpdxSnippet bindSnippet(JsonFieldReader listReader) {
        JsonFieldReader reader = listReader.asEntity("SPDXID");
        return new SpdxSnippet(
            reader.string("SPDXID"),
            reader.string("name"),
            reader.string("snippetFromFile"),
            reader.objectList("ranges").stream().map(this::bindRange).toList(),
            reader.string("licenseConcluded"),
            reader.stringList("licenseInfoInSnippets"),
            reader.string("licenseComments"),
            reader.string("copyrightText"),
            reader.string("comment"),
            reader.stringList("attributionTexts"),
            reader.extraFields()
        );
    }

    private SnippetRange bindRange(JsonFieldReader reader) {
        return new SnippetRange(
            bindPointer(reader.object("startPointer")),
            bindPointer(reader.object("endPointer"))
        );
    }

    private RangePointer bindPointer(JsonFieldReader reader) {
        if (reader == null) {
            return null;
        }
        return new RangePointer(
            reader.string("reference"),
            reader.integer("offset"),
            reader.integer("lineNumber")
        );
    }

    // Several relationships share a source id, so issues stay keyed by list position.
    private Relationship bindRelationship(JsonFieldReader reader) {
        return new Relationship(
            reader.string("spdxElementId"),
            reader.string("relationshipType"),
            reader.string("relatedSpdxElementId"),
            reader.string("comment")
        );
    }

    private ExtractedLicensingInfo bindExtractedLicensingInfo(JsonFieldReader listReader) {
        JsonFieldReader reader = listReader.asEntity("licenseId");
        return new ExtractedLicensingInfo(
            reader.string("licenseId"),
            reader.string("extractedText"),
            reader.string("name"),
            reader.stringList("seeAlsos"),
            reader.string("comment")
        );
    }

    private List<Checksum> bindChecksums(JsonFieldReader reader) {
        return reader.objectList("checksums").stream()
            .map(this::bindChecksum)
            .toList();
    }

    private Checksum bindChecksum(JsonFieldReader reader) {
        if (reader == null) {
            return null;
        }
        return new Checksum(
            reader.string("algorithm"),
            reader.string("checksumValue")
        );
    }
}
