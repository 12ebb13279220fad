package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Checks every present value of a field against a predicate: a fixed value, a pattern or an
 * enumeration. Absent values pass; presence is {@link MandatoryFieldRule}'s concern.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValueFormatRule.single("SPDX-6.2", EntityType.DOCUMENT, SpdxDocument.class,
 *     "dataLicense", SpdxDocument::dataLicense, "CC0-1.0"::equals, "CC0-1.0");
 * }</pre>
 *
 * @param <T> entity class owning the field
 */
public class ValueFormatRule<T extends SpdxEntity> extends AbstractRule<T> {

    private final String fieldPath;
    private final Function<T, List<String>> values;
    private final Predicate<String> valid;
    private final String expectation;

    /**
     * Creates a format rule over a multi-valued field.
     *
     * @param code SPDX clause reference
     * @param target entity type
     * @param entityClass entity class
     * @param fieldPath field reported on violation
     * @param values reads the values, never null
     * @param valid accepts well-formed values
     * @param expectation phrase completing "must be ..."
     */
    public ValueFormatRule(String code, EntityType target, Class<T> entityClass, String fieldPath,
                           Function<T, List<String>> values, Predicate<String> valid, String expectation) {
        super(code, target.label() + " " + fieldPath + " is " + expectation, Severity.ERROR, entityClass, target);
        this.fieldPath = fieldPath;
        this.values = values;
        this.valid = valid;
        this.expectation = expectation;
    }

    /**
     * Creates a format rule over a single-valued field.
     *
     * @param code SPDX clause reference
     * @param target entity type
     * @param entityClass entity class
     * @param fieldPath field reported on violation
     * @param value reads the value, may return null
     * @param valid accepts well-formed values
     * @param expectation phrase completing "must be ..."
     * @param <T> entity class
     * @return the rule
     */
    public static <T extends SpdxEntity> ValueFormatRule<T> single(
            String code, EntityType target, Class<T> entityClass, String fieldPath,
            Function<T, String> value, Predicate<String> valid, String expectation) {
        return new ValueFormatRule<>(code, target, entityClass, fieldPath,
            entity -> {
                String v = value.apply(entity);
                return v == null ? List.of() : List.of(v);
            },
            valid, expectation);
    }

    @Override
    protected void check(T entity, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(entity, fieldPath)) {
            return;
        }
        for (String value : values.apply(entity)) {
            if (value != null && !value.isEmpty() && !valid.test(value)) {
                violations.add(violation(context, entity, fieldPath,
                    fieldPath + " must be " + expectation + " but was '" + value + "'"));
            }
        }
    }
}
