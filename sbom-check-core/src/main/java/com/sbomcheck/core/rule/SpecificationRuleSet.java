package com.sbomcheck.core.rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * SPDX 2.3 conformance rules, assembled from every {@link RuleProvider} on the class path.
 *
 * <p>Instances are immutable and may be shared between concurrent runs.
 */
public final class SpecificationRuleSet implements RuleSet {

    private static final Logger log = LoggerFactory.getLogger(SpecificationRuleSet.class);

    public static final String NAME = "specification";

    private final List<RuleProvider> providers;
    private final List<Rule> rules;

    /**
     * Creates a rule set from explicit providers.
     *
     * @param providers providers in any order; they are sorted by priority
     */
    public SpecificationRuleSet(List<RuleProvider> providers) {
        List<RuleProvider> sorted = new ArrayList<>(providers);
        sorted.sort(Comparator.comparingInt(RuleProvider::getPriority).thenComparing(RuleProvider::getId));
        this.providers = List.copyOf(sorted);

        List<Rule> collected = new ArrayList<>();
        for (RuleProvider provider : this.providers) {
            collected.addAll(provider.getRules());
        }
        this.rules = List.copyOf(collected);
    }

    /**
     * Discovers rule providers via {@link ServiceLoader}.
     *
     * @return rule set with every registered provider
     */
    public static SpecificationRuleSet load() {
        log.debug("Discovering rule providers via ServiceLoader");
        List<RuleProvider> providers = new ArrayList<>();
        for (RuleProvider provider : ServiceLoader.load(RuleProvider.class)) {
            log.debug("Found rule provider: {} ({} rules)", provider.getId(), provider.getRules().size());
            providers.add(provider);
        }
        if (providers.isEmpty()) {
            log.warn("No rule providers found on the class path");
        }
        return new SpecificationRuleSet(providers);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Rule> getRules() {
        return rules;
    }

    public List<RuleProvider> getProviders() {
        return providers;
    }
}
