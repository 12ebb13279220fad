package com.sbomcheck.cli;

import com.sbomcheck.core.config.PolicyConfigLoader;
import com.sbomcheck.core.renderer.ReportRenderer;
import com.sbomcheck.core.renderer.ReportRenderers;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.RuleProvider;
import com.sbomcheck.core.rule.SpecificationRuleSet;
import com.sbomcheck.core.rule.policy.PolicyRuleSet;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available rules or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List specification rules by provider, then the bundled policy rules
 * sbom-check list rules
 *
 * # List all renderers
 * sbom-check list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available rules or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: rules or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "rules", "rule" -> listRules();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: rules or renderers", type);
                yield 1;
            }
        };
    }

    private int listRules() {
        System.out.println("Specification Rules:");

        for (RuleProvider provider : SpecificationRuleSet.load().getProviders()) {
            System.out.println();
            System.out.printf("  %s (%s, priority %d)%n",
                provider.getId(), provider.getSpdxVersion(), provider.getPriority());
            printRules(provider.getRules());
        }

        System.out.println();
        System.out.println("Policy Rules (bundled policy):");
        System.out.println();
        printRules(new PolicyRuleSet(PolicyConfigLoader.loadDefault()).getRules());

        return 0;
    }

    private static void printRules(List<Rule> rules) {
        for (Rule rule : rules) {
            System.out.printf("  • %s [%s] %s%n", rule.getCode(), rule.getSeverity().jsonName(), rule.getDescription());
        }
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<ReportRenderer> renderers = ReportRenderers.all();
        for (ReportRenderer renderer : renderers) {
            System.out.printf("  • %s - %s%n", renderer.getId(), renderer.getDescription());
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }

        return 0;
    }
}
