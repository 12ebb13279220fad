package com.sbomcheck.core.validation;

import com.sbomcheck.core.report.Severity;

import java.util.Objects;

/**
 * Options of one validation run.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationOptions options = ValidationOptions.defaults()
 *     .withRuleSets(RuleSetSelection.SPECIFICATION)
 *     .withConcurrency(4);
 * }</pre>
 *
 * @param ruleSets rule sets to evaluate
 * @param failureThreshold minimum severity that makes the exit code non-zero
 * @param concurrency maximum number of documents in memory and in evaluation at once
 * @param cancellation cancellation signal checked between documents
 */
public record ValidationOptions(
    RuleSetSelection ruleSets,
    Severity failureThreshold,
    int concurrency,
    CancellationToken cancellation
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationOptions {
        Objects.requireNonNull(ruleSets, "ruleSets must not be null");
        Objects.requireNonNull(failureThreshold, "failureThreshold must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1 but was " + concurrency);
        }
    }

    /**
     * Returns the default options: both rule sets, warnings fail, one worker per processor.
     *
     * @return default options
     */
    public static ValidationOptions defaults() {
        return new ValidationOptions(
            RuleSetSelection.BOTH,
            Severity.WARNING,
            Runtime.getRuntime().availableProcessors(),
            new CancellationToken()
        );
    }

    public ValidationOptions withRuleSets(RuleSetSelection value) {
        return new ValidationOptions(value, failureThreshold, concurrency, cancellation);
    }

    public ValidationOptions withFailureThreshold(Severity value) {
        return new ValidationOptions(ruleSets, value, concurrency, cancellation);
    }

    public ValidationOptions withConcurrency(int value) {
        return new ValidationOptions(ruleSets, failureThreshold, value, cancellation);
    }

    public ValidationOptions withCancellation(CancellationToken value) {
        return new ValidationOptions(ruleSets, failureThreshold, concurrency, value);
    }
}
