package com.sbomcheck.core.validation;

import com.sbomcheck.core.config.PolicyConfig;
import com.sbomcheck.core.loader.DocumentSource;
import com.sbomcheck.core.report.RunSummary;
import com.sbomcheck.core.report.ValidationReport;
import com.sbomcheck.core.rule.Rule;
import com.sbomcheck.core.rule.SpecificationRuleSet;
import com.sbomcheck.core.rule.policy.PolicyRuleSet;
import com.sbomcheck.core.rule.spdx.StructureRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs validation over a batch of documents.
 *
 * <p>Documents are independent: each one is loaded, resolved and evaluated by a worker of a
 * fixed pool, so at most {@link ValidationOptions#concurrency()} documents are in memory at
 * once. Reports are merged in submission order, not completion order, so output is
 * deterministic.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationOrchestrator orchestrator = new ValidationOrchestrator();
 * List<DocumentSource> sources = SpdxFileDiscovery.discover(Paths.get("sboms"), false);
 * RunSummary summary = orchestrator.runValidation(sources, PolicyConfigLoader.loadDefault(),
 *     ValidationOptions.defaults());
 * System.exit(summary.exitCode(Severity.WARNING));
 * }</pre>
 */
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    private final SpecificationRuleSet specificationRules;

    /**
     * Creates an orchestrator with the specification rules found on the class path.
     */
    public ValidationOrchestrator() {
        this(SpecificationRuleSet.load());
    }

    /**
     * Creates an orchestrator with explicit specification rules.
     *
     * @param specificationRules specification rule set
     */
    public ValidationOrchestrator(SpecificationRuleSet specificationRules) {
        this.specificationRules = Objects.requireNonNull(specificationRules, "specificationRules must not be null");
    }

    /**
     * Validates every document.
     *
     * @param sources documents in submission order
     * @param policyConfig policy to apply, ignored unless policy rules are selected
     * @param options run options
     * @return one report per source, in submission order
     * @throws ValidationRunException if the run is interrupted or a worker fails fatally
     */
    public RunSummary runValidation(List<DocumentSource> sources, PolicyConfig policyConfig,
                                    ValidationOptions options) {
        Objects.requireNonNull(sources, "sources must not be null");
        Objects.requireNonNull(policyConfig, "policyConfig must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<Rule> rules = selectRules(policyConfig, options.ruleSets());
        DocumentValidator validator = new DocumentValidator(rules);
        log.info("Validating {} document(s) with {} rules ({}), concurrency {}",
            sources.size(), rules.size(), options.ruleSets(), options.concurrency());

        if (sources.isEmpty()) {
            return RunSummary.of(List.of());
        }

        int workers = Math.min(options.concurrency(), sources.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<CompletableFuture<ValidationReport>> futures = new ArrayList<>(sources.size());
            for (DocumentSource source : sources) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    if (options.cancellation().isCancelled()) {
                        log.debug("Skipping {}: run cancelled", source.documentId());
                        return ValidationReport.skipped(source.documentId());
                    }
                    return validator.validate(source);
                }, executor));
            }

            List<ValidationReport> reports = new ArrayList<>(futures.size());
            for (CompletableFuture<ValidationReport> future : futures) {
                reports.add(future.get());
            }

            RunSummary summary = RunSummary.of(reports);
            log.info("Validation finished: {} ({} violation(s) in {} document(s))",
                summary.status(), summary.violationCount(), reports.size());
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            options.cancellation().cancel();
            throw new ValidationRunException("Validation run was interrupted", e);
        } catch (ExecutionException | CompletionException e) {
            log.error("Validation run failed", e.getCause());
            throw new ValidationRunException("Validation run failed: " + e.getCause(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Rule> selectRules(PolicyConfig policyConfig, RuleSetSelection selection) {
        List<Rule> rules = new ArrayList<>();
        if (selection.includesSpecification()) {
            rules.addAll(specificationRules.getRules());
        } else {
            // binding failures are reported whatever rule sets are selected
            rules.add(new StructureRule());
        }
        if (selection.includesPolicy()) {
            rules.addAll(new PolicyRuleSet(policyConfig).getRules());
        }
        return rules;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "sbom-check-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
