package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.license.LicenseExpression;
import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.resolver.ReferenceIndex;
import com.sbomcheck.core.rule.RuleContext;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Every {@code LicenseRef-} id used in a license field is declared in
 * {@code hasExtractedLicensingInfos}; {@code DocumentRef-x:LicenseRef-y} ids name a declared
 * external document.
 *
 * <p>Values that do not parse are left to {@link LicenseExpressionRule}. A LicenseRef id used
 * twice in one value is reported once.
 *
 * @param <T> entity class owning the license field
 */
public class LicenseRefResolutionRule<T extends SpdxEntity> extends AbstractLicenseRule<T> {

    public static final String CODE = "SPDX-LICENSE-REF-UNRESOLVED";

    public LicenseRefResolutionRule(EntityType target, Class<T> entityClass, String fieldPath,
                                    Function<T, List<String>> values) {
        super(CODE, target.label() + " " + fieldPath + " LicenseRef ids are declared",
            target, entityClass, fieldPath, values, false);
    }

    public static <T extends SpdxEntity> LicenseRefResolutionRule<T> of(
            EntityType target, Class<T> entityClass, String fieldPath, Function<T, String> value) {
        return new LicenseRefResolutionRule<>(target, entityClass, fieldPath, singleValue(value));
    }

    @Override
    protected void checkValue(T entity, String value, RuleContext context, List<Violation> violations) {
        Optional<LicenseExpression> parsed = tryParse(value);
        if (parsed.isEmpty()) {
            return;
        }
        ReferenceIndex index = context.index();
        Set<String> licenseRefs = new LinkedHashSet<>(parsed.get().licenseRefs());
        for (String licenseRef : licenseRefs) {
            if (index.resolveLicenseRef(licenseRef).isEmpty()) {
                violations.add(violation(context, entity, fieldPath,
                    "'" + licenseRef + "' is not declared in hasExtractedLicensingInfos"));
            }
        }
        for (String externalRef : new LinkedHashSet<>(parsed.get().externalLicenseRefs())) {
            if (!index.isExternalReference(externalRef)) {
                violations.add(violation(context, entity, fieldPath,
                    "'" + externalRef + "' refers to an external document that is not declared in externalDocumentRefs"));
            }
        }
    }
}
