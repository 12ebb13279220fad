package com.sbomcheck.core.config;

import com.sbomcheck.core.model.EntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimum-required-value policy: checks grouped by the entity type they apply to.
 *
 * <p>Loaded by {@link PolicyConfigLoader} and passed into each validation run; there is no
 * process-wide policy state.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * Document:
 *   - fieldPath: creationInfo.licenseListVersion
 *     check: required
 * Package:
 *   - fieldPath: supplier
 *     check: nonPlaceholder
 *   - fieldPath: primaryPackagePurpose
 *     check: oneOf
 *     allowedValues: [APPLICATION, LIBRARY]
 * }</pre>
 *
 * @param checks checks per entity type, in configuration order
 */
public record PolicyConfig(
    Map<EntityType, List<PolicyCheck>> checks
) {
    /**
     * Compact constructor with validation.
     */
    public PolicyConfig {
        Map<EntityType, List<PolicyCheck>> copy = new LinkedHashMap<>();
        if (checks != null) {
            checks.forEach((type, list) -> {
                List<PolicyCheck> entries = list == null ? List.of() : List.copyOf(list);
                for (PolicyCheck check : entries) {
                    if (check.check() == CheckType.DESCRIBES_FIRST_PACKAGE && type != EntityType.DOCUMENT) {
                        throw new PolicyConfigurationException(
                            "describesFirstPackage applies to Document only, not " + type.label());
                    }
                }
                copy.put(type, entries);
            });
        }
        checks = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a policy without checks.
     *
     * @return empty policy
     */
    public static PolicyConfig empty() {
        return new PolicyConfig(Map.of());
    }

    /**
     * Returns the checks configured for an entity type.
     *
     * @param type entity type
     * @return checks in configuration order, empty if none
     */
    public List<PolicyCheck> checksFor(EntityType type) {
        return checks.getOrDefault(type, List.of());
    }

    /**
     * Returns true if no check is configured.
     *
     * @return true for an empty policy
     */
    public boolean isEmpty() {
        return checks.values().stream().allMatch(List::isEmpty);
    }
}
