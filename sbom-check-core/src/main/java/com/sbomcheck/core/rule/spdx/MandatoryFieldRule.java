package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Requires a field to be present. Empty strings and empty arrays count as missing.
 *
 * @param <T> entity class owning the field
 */
public class MandatoryFieldRule<T extends SpdxEntity> extends AbstractRule<T> {

    private final String fieldPath;
    private final Function<T, ?> accessor;
    private final Predicate<T> condition;

    /**
     * Creates a presence rule.
     *
     * @param code SPDX clause reference
     * @param target entity type
     * @param entityClass entity class
     * @param fieldPath field reported on violation
     * @param accessor reads the field value
     */
    public MandatoryFieldRule(String code, EntityType target, Class<T> entityClass,
                              String fieldPath, Function<T, ?> accessor) {
        this(code, target, entityClass, fieldPath, accessor, entity -> true);
    }

    /**
     * Creates a presence rule that only applies when a condition holds, typically that the
     * enclosing object exists.
     *
     * @param code SPDX clause reference
     * @param target entity type
     * @param entityClass entity class
     * @param fieldPath field reported on violation
     * @param accessor reads the field value
     * @param condition entities the rule applies to
     */
    public MandatoryFieldRule(String code, EntityType target, Class<T> entityClass,
                              String fieldPath, Function<T, ?> accessor, Predicate<T> condition) {
        super(code, target.label() + " " + fieldPath + " is present", Severity.ERROR, entityClass, target);
        this.fieldPath = fieldPath;
        this.accessor = accessor;
        this.condition = condition;
    }

    @Override
    protected void check(T entity, RuleContext context, List<Violation> violations) {
        if (!condition.test(entity) || context.isUnbound(entity, fieldPath)) {
            return;
        }
        if (isMissing(accessor.apply(entity))) {
            violations.add(violation(context, entity, fieldPath, fieldPath + " is mandatory"));
        }
    }

    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }
}
