package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.license.LicenseExpression;
import com.sbomcheck.core.license.LicenseExpressionException;
import com.sbomcheck.core.license.LicenseExpressions;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;
import java.util.function.Function;

/**
 * License fields parse under the SPDX license expression grammar. License list fields
 * ({@code licenseInfoFromFiles} and friends) must hold single identifiers.
 *
 * @param <T> entity class owning the license field
 */
public class LicenseExpressionRule<T extends SpdxEntity> extends AbstractLicenseRule<T> {

    public static final String CODE = "SPDX-LICENSE-SYNTAX";

    private LicenseExpressionRule(EntityType target, Class<T> entityClass, String fieldPath,
                                  Function<T, List<String>> values, boolean singleIdentifiers) {
        super(CODE, target.label() + " " + fieldPath + (singleIdentifiers
                ? " entries are single license identifiers"
                : " is a valid license expression"),
            target, entityClass, fieldPath, values, singleIdentifiers);
    }

    public static <T extends SpdxEntity> LicenseExpressionRule<T> expression(
            EntityType target, Class<T> entityClass, String fieldPath, Function<T, String> value) {
        return new LicenseExpressionRule<>(target, entityClass, fieldPath, singleValue(value), false);
    }

    public static <T extends SpdxEntity> LicenseExpressionRule<T> identifierList(
            EntityType target, Class<T> entityClass, String fieldPath, Function<T, List<String>> values) {
        return new LicenseExpressionRule<>(target, entityClass, fieldPath, values, true);
    }

    @Override
    protected void checkValue(T entity, String value, RuleContext context, List<Violation> violations) {
        LicenseExpression expression;
        try {
            expression = LicenseExpressions.parse(value);
        } catch (LicenseExpressionException e) {
            log.debug("Unparseable license in {} {}: {}", entity.entityId(), fieldPath, e.getMessage());
            violations.add(violation(context, entity, fieldPath, e.getMessage()));
            return;
        }
        if (singleIdentifiers && !expression.isSingleIdentifier()) {
            violations.add(violation(context, entity, fieldPath,
                "'" + value + "' must be a single license identifier, not a compound expression"));
        }
    }
}
