package com.sbomcheck.core.rule.spdx;

import com.sbomcheck.core.model.EntityType;
import com.sbomcheck.core.model.SpdxElement;
import com.sbomcheck.core.model.SpdxEntity;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.report.Violation;
import com.sbomcheck.core.resolver.ReferenceIndex;
import com.sbomcheck.core.rule.AbstractRule;
import com.sbomcheck.core.rule.RuleContext;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Requires SPDXID references to resolve to an element of this document, or to an element of
 * a declared external document ({@code DocumentRef-x:SPDXRef-y}).
 *
 * <p>Each unresolved identifier yields exactly one violation citing it.
 *
 * @param <T> entity class holding the references
 */
public class ReferenceRule<T extends SpdxEntity> extends AbstractRule<T> {

    public static final String CODE = "SPDX-REF-UNRESOLVED";

    private final String fieldPath;
    private final Function<T, List<String>> references;
    private final EntityType requiredTargetType;
    private final boolean placeholdersAllowed;

    /**
     * Creates a reference rule.
     *
     * @param target entity type holding the references
     * @param entityClass entity class
     * @param fieldPath field reported on violation
     * @param references reads the referenced ids, never null
     * @param requiredTargetType type the local target must have, or null for any element
     * @param placeholdersAllowed true if {@code NONE} and {@code NOASSERTION} are acceptable
     */
    public ReferenceRule(EntityType target, Class<T> entityClass, String fieldPath,
                         Function<T, List<String>> references, EntityType requiredTargetType,
                         boolean placeholdersAllowed) {
        super(CODE, target.label() + " " + fieldPath + " resolves to "
                + (requiredTargetType == null ? "an element" : "a " + requiredTargetType.label()),
            Severity.ERROR, entityClass, target);
        this.fieldPath = fieldPath;
        this.references = references;
        this.requiredTargetType = requiredTargetType;
        this.placeholdersAllowed = placeholdersAllowed;
    }

    @Override
    protected void check(T entity, RuleContext context, List<Violation> violations) {
        if (context.isUnbound(entity, fieldPath)) {
            return;
        }
        ReferenceIndex index = context.index();
        for (String reference : references.apply(entity)) {
            if (reference == null || reference.isBlank()) {
                continue;
            }
            if (placeholdersAllowed
                    && (SpdxFormats.NONE.equals(reference) || SpdxFormats.NOASSERTION.equals(reference))) {
                continue;
            }
            if (index.looksExternal(reference)) {
                if (!index.isExternalReference(reference)) {
                    violations.add(violation(context, entity, fieldPath,
                        "'" + reference + "' refers to an external document that is not declared in externalDocumentRefs"));
                }
                continue;
            }
            Optional<SpdxElement> resolved = index.resolve(reference);
            if (resolved.isEmpty()) {
                violations.add(violation(context, entity, fieldPath,
                    "'" + reference + "' does not match the SPDXID of any element in the document"));
            } else if (requiredTargetType != null && resolved.get().entityType() != requiredTargetType) {
                violations.add(violation(context, entity, fieldPath,
                    "'" + reference + "' must refer to a " + requiredTargetType.label()
                        + " but refers to a " + resolved.get().entityType().label()));
            }
        }
    }
}
