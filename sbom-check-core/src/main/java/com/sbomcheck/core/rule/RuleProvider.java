package com.sbomcheck.core.rule;

import java.util.List;

/**
 * Contributes specification rules to {@link SpecificationRuleSet}.
 *
 * <p>Providers are discovered via Java Service Provider Interface (SPI) and their rules are
 * evaluated in provider priority order (lower numbers first), then in list order.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sbomcheck.core.rule.RuleProvider}
 */
public interface RuleProvider {

    /**
     * Returns unique identifier for this provider, in kebab-case (e.g. {@code spdx-package}).
     *
     * @return provider identifier
     */
    String getId();

    /**
     * Returns the SPDX version the rules encode.
     *
     * @return version string such as {@code SPDX-2.3}
     */
    String getSpdxVersion();

    /**
     * Returns execution priority. Lower values are evaluated first for each entity.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Returns the rules of this provider, in evaluation order.
     *
     * @return rules
     */
    List<Rule> getRules();
}
