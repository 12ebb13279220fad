package com.sbomcheck.core.rule;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;

import java.util.List;
import java.util.Set;

/**
 * A single check evaluated against the entities of a resolved SPDX document.
 *
 * <p>Rules are stateless and side-effect free: the same entity and context always yield the
 * same violations in the same order. Malformed input is never a reason to throw; a rule that
 * cannot make sense of a value reports it as a violation instead.
 *
 * <p>Specification rules are contributed by {@link RuleProvider} implementations; policy rules
 * are built from configuration. Both are evaluated by {@link RuleEngine}.
 *
 * @see RuleEngine
 * @see RuleContext
 */
public interface Rule {

    /**
     * Returns the stable code reported with every violation of this rule.
     *
     * <p>Specification rules use SPDX clause references (e.g. {@code SPDX-6.2}) or a
     * category code (e.g. {@code SPDX-REF-UNRESOLVED}); policy rules use
     * {@code POLICY:<Entity>.<fieldPath>:<check>}.
     *
     * @return rule code
     */
    String getCode();

    /**
     * Returns a one-line description for listings.
     *
     * @return description
     */
    String getDescription();

    /**
     * Returns the severity of violations raised by this rule.
     *
     * @return severity
     */
    Severity getSeverity();

    /**
     * Returns the entity types this rule inspects.
     *
     * @return target entity types
     */
    Set<EntityType> getTargets();

    /**
     * Returns true if this rule should be evaluated against the given entity.
     *
     * @param entity candidate entity
     * @return true if the entity type is one of the targets
     */
    default boolean appliesTo(SpdxEntity entity) {
        return getTargets().contains(entity.entityType());
    }

    /**
     * Returns true if this rule still runs when the document was rejected while binding.
     *
     * @return false for all rules except the structural one
     */
    default boolean evaluatesRejectedDocuments() {
        return false;
    }

    /**
     * Evaluates the rule against one entity.
     *
     * @param entity entity of one of the target types
     * @param context document-wide context
     * @return violations found, empty if the entity passes
     */
    List<Violation> evaluate(SpdxEntity entity, RuleContext context);
}
