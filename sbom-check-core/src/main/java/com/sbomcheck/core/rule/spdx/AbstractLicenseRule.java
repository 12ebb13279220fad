package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.license.LicenseExpression;
import com.sbomcheck.core.license.LicenseExpressionException;
import com.sbomcheck.core.license.LicenseExpressions;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Base for rules inspecting license fields. Handles field selection, skipping of unbound and
 * blank values, and parsing.
 *
 * @param <T> entity class owning the license field
 */
abstract class AbstractLicenseRule<T extends SpdxEntity> extends AbstractRule<T> {

    protected final String fieldPath;
    protected final boolean singleIdentifiers;
    private final Function<T, List<String>> values;

    protected AbstractLicenseRule(String code, String description, EntityType target, Class<T> entityClass,
                                  String fieldPath, Function<T, List<String>> values, boolean singleIdentifiers) {
        super(code, description, Severity.ERROR, entityClass, target);
        this.fieldPath = fieldPath;
        this.values = values;
        this.singleIdentifiers = singleIdentifiers;
    }

    @Override
    protected final void check(T entity, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(entity, fieldPath)) {
            return;
        }
        for (String value : values.apply(entity)) {
            if (value != null && !value.isBlank()) {
                checkValue(entity, value, context, violations);
            }
        }
    }

    protected abstract void checkValue(T entity, String value, RuleContext context, List<Violation> violations);

    /**
     * Parses a value, returning empty when it is not a valid expression.
     *
     * @param value license field value
     * @return parsed expression, or empty on a syntax error
     */
    protected Optional<LicenseExpression> tryParse(String value) {
        try {
            return Optional.of(LicenseExpressions.parse(value));
        } catch (LicenseExpressionException e) {
            return Optional.empty();
        }
    }

    static <T> Function<T, List<String>> singleValue(Function<T, String> accessor) {
        return entity -> {
            String value = accessor.apply(entity);
            return value == null ? List.of() : List.of(value);
        };
    }
}
