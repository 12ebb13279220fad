package com.sbomcheck.core.rule;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract base class for rule implementations providing common functionality.
 *
 * <p>This class reduces code duplication across rules by providing:
 * <ul>
 *   <li>Logger initialization (one logger per rule class)</li>
 *   <li>Storage of code, description, severity and targets</li>
 *   <li>Type-safe dispatch to {@link #check(SpdxEntity, RuleContext, List)} for one entity class</li>
 *   <li>Violation creation helpers ({@link #violation(RuleContext, SpdxEntity, String, String)})</li>
 * </ul>
 *
 * @param <T> entity class the rule inspects
 */
public abstract class AbstractRule<T extends SpdxEntity> implements Rule {

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    private final String code;
    private final String description;
    private final Severity severity;
    private final Class<T> entityClass;
    private final Set<EntityType> targets;

    /**
     * Creates a rule targeting entities of one class.
     *
     * @param code rule code
     * @param description one-line description
     * @param severity severity of violations
     * @param entityClass entity class to inspect
     * @param target entity type matching {@code entityClass}
     * @param moreTargets additional entity types, when {@code entityClass} is an interface
     */
    protected AbstractRule(String code, String description, Severity severity,
                           Class<T> entityClass, EntityType target, EntityType... moreTargets) {
        this.log = LoggerFactory.getLogger(getClass());
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass must not be null");
        this.targets = Set.copyOf(EnumSet.of(target, moreTargets));
    }

    @Override
    public String getCode() {
        return code;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Severity getSeverity() {
        return severity;
    }

    @Override
    public Set<EntityType> getTargets() {
        return targets;
    }

    @Override
    public final List<Violation> evaluate(SpdxEntity entity, RuleContext context) {
        if (!appliesTo(entity) || !entityClass.isInstance(entity)) {
            return List.of();
        }
        List<Violation> violations = new ArrayList<>();
        check(entityClass.cast(entity), context, violations);
        return violations;
    }

    /**
     * Inspects one entity and appends any violations found.
     *
     * @param entity entity to inspect
     * @param context document-wide context
     * @param violations list to append to
     */
    protected abstract void check(T entity, RuleContext context, List<Violation> violations);

    // ==================== Violation Creation Helpers ====================

    /**
     * Creates a violation of this rule against the given entity.
     *
     * @param context rule context supplying the document id
     * @param entity offending entity
     * @param fieldPath offending field, empty for the whole entity
     * @param message description
     * @return violation with this rule's code and severity
     */
    protected Violation violation(RuleContext context, SpdxEntity entity, String fieldPath, String message) {
        return violation(code, context, entity, fieldPath, message);
    }

    /**
     * Creates a violation under a category code other than this rule's own code.
     *
     * @param ruleCode code to report
     * @param context rule context supplying the document id
     * @param entity offending entity
     * @param fieldPath offending field, empty for the whole entity
     * @param message description
     * @return violation with this rule's severity
     */
    protected Violation violation(String ruleCode, RuleContext context, SpdxEntity entity,
                                  String fieldPath, String message) {
        return new Violation(context.documentId(), ruleCode, severity, entity.entityId(), fieldPath, message);
    }

    @Override
    public String toString() {
        return code + " " + description;
    }
}
