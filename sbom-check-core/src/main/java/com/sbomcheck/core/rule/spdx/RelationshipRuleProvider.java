package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.Relationship;
import com.sbomcheck.core.model.RelationshipType;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;

import java.util.List;

/**
 * SPDX 2.3 clause 11: relationships between elements.
 *
 * <p>{@code NONE} and {@code NOASSERTION} are accepted as the related element.
 */
public class RelationshipRuleProvider implements RuleProvider {

    private static final EntityType REL = EntityType.RELATIONSHIP;

    private final List<Rule> rules = List.of(
        new MandatoryFieldRule<>("SPDX-11.1", REL, Relationship.class, "spdxElementId", Relationship::spdxElementId),
        new MandatoryFieldRule<>("SPDX-11.1", REL, Relationship.class, "relationshipType",
            Relationship::relationshipType),
        ValueFormatRule.single("SPDX-11.1", REL, Relationship.class, "relationshipType",
            Relationship::relationshipType, value -> RelationshipType.fromSpdxName(value).isPresent(),
            "one of the SPDX 2.3 relationship types"),
        new MandatoryFieldRule<>("SPDX-11.1", REL, Relationship.class, "relatedSpdxElementId",
            Relationship::relatedSpdxElementId),
        new ReferenceRule<>(REL, Relationship.class, "spdxElementId",
            relationship -> single(relationship.spdxElementId()), null, false),
        new ReferenceRule<>(REL, Relationship.class, "relatedSpdxElementId",
            relationship -> single(relationship.relatedSpdxElementId()), null, true)
    );

    private static List<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public String getId() {
        return "spdx-relationship";
    }

    @Override
    public String getSpdxVersion() {
        return SpdxFormats.SPDX_VERSION;
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }
}
