package com.sbomcheck.cli;

import com.sbomcheck.core.config.PolicyConfig;
import com.sbomcheck.core.config.PolicyConfigLoader;
import com.sbomcheck.core.config.PolicyConfigurationException;
import com.sbomcheck.core.loader.DocumentSource;
import com.sbomcheck.core.loader.SpdxFileDiscovery;
import com.sbomcheck.core.renderer.RenderContext;
import com.sbomcheck.core.renderer.ReportRenderer;
import com.sbomcheck.core.renderer.ReportRenderers;
import com.sbomcheck.core.renderer.impl.JsonReportRenderer;
import com.sbomcheck.core.report.RunSummary;
import com.sbomcheck.core.report.Severity;
import com.sbomcheck.core.validation.RuleSetSelection;
import com.sbomcheck.core.validation.ValidationOptions;
import com.sbomcheck.core.validation.ValidationOrchestrator;
import com.sbomcheck.core.validation.ValidationRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to validate SPDX JSON documents.
 *
 * <p><b>Exit codes:</b> {@code 0} every document passed, {@code 1} at least one document
 * failed or could not be read, {@code 2} invalid policy configuration or input path.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Validate a folder with the bundled policy, print results and write CSV exceptions
 * sbom-check validate ./sboms --print-console --csv
 *
 * # Custom policy, fail only on specification errors
 * sbom-check validate ./sboms --policy policy.yaml --fail-on error
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate SPDX 2.3 JSON documents",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_CONFIGURATION_ERROR = 2;

    @Parameters(index = "0", description = "Directory containing SPDX JSON file(s), or a single file")
    private Path inputPath;

    @Option(
        names = {"-p", "--policy"},
        description = "Policy configuration (YAML or JSON). Default: bundled minimum-values policy"
    )
    private Path policyPath;

    @Option(
        names = {"--rule-sets"},
        description = "Rule sets to evaluate: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "BOTH"
    )
    private RuleSetSelection ruleSets;

    @Option(
        names = {"--fail-on"},
        description = "Lowest severity that fails the run: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "WARNING"
    )
    private Severity failOn;

    @Option(
        names = {"--concurrency"},
        description = "Documents validated in parallel (default: available processors)"
    )
    private Integer concurrency;

    @Option(names = {"-r", "--recursive"}, description = "Descend into subdirectories")
    private boolean recursive;

    @Option(names = {"--print-console"}, description = "Output results to console")
    private boolean printConsole;

    @Option(
        names = {"--print-json"},
        arity = "0..1",
        paramLabel = "FILE",
        fallbackValue = JsonReportRenderer.DEFAULT_FILE_NAME,
        description = "Output results to a JSON file (default name: " + JsonReportRenderer.DEFAULT_FILE_NAME + ")"
    )
    private String jsonFile;

    @Option(names = {"--csv"}, description = "Write <document>_exceptions.csv for each non-compliant document")
    private boolean csv;

    @Option(names = {"--no-color"}, description = "Disable ANSI colors in console output")
    private boolean noColor;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory for JSON and CSV files (default: current directory)"
    )
    private Path outputDir = Paths.get(".");

    @Override
    public Integer call() {
        PolicyConfig policy;
        ValidationOptions options;
        List<DocumentSource> sources;
        try {
            policy = loadPolicy();
            options = buildOptions();
            sources = SpdxFileDiscovery.discover(inputPath, recursive);
        } catch (PolicyConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (IOException e) {
            log.error("Cannot read input: {}", e.getMessage());
            System.err.println("✗ Cannot read input: " + e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        try {
            RunSummary summary = new ValidationOrchestrator().runValidation(sources, policy, options);
            render(summary);
            return summary.exitCode(options.failureThreshold());
        } catch (ValidationRunException | IllegalStateException e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private PolicyConfig loadPolicy() {
        if (!ruleSets.includesPolicy()) {
            return PolicyConfig.empty();
        }
        if (policyPath == null) {
            log.debug("Using bundled policy {}", PolicyConfigLoader.DEFAULT_POLICY_RESOURCE);
            return PolicyConfigLoader.loadDefault();
        }
        log.info("Loading policy from: {}", policyPath);
        return PolicyConfigLoader.load(policyPath);
    }

    private ValidationOptions buildOptions() {
        ValidationOptions options = ValidationOptions.defaults()
            .withRuleSets(ruleSets)
            .withFailureThreshold(failOn);
        if (concurrency != null) {
            options = options.withConcurrency(concurrency);
        }
        return options;
    }

    private void render(RunSummary summary) {
        Map<String, String> settings = new HashMap<>();
        settings.put("console.colors", String.valueOf(!noColor));
        if (jsonFile != null) {
            settings.put("json.file", jsonFile);
        }
        RenderContext context = new RenderContext(outputDir.toString(), settings);

        if (printConsole) {
            renderer("console").render(summary, context);
        }
        if (jsonFile != null) {
            renderer("json").render(summary, context);
        }
        if (csv) {
            renderer("csv").render(summary, context);
        }
    }

    private static ReportRenderer renderer(String id) {
        return ReportRenderers.find(id)
            .orElseThrow(() -> new IllegalStateException("Renderer not found: " + id));
    }
}
