package com.sbomcheck.core.renderer;

import com.sbomcheck.core.report.RunSummary;

/**
 * Interface for renderers that present the result of a validation run.
 *
 * <p>Renderers write the {@link RunSummary} to a destination: the console, a JSON results
 * file, or one CSV exceptions file per failing document. Several renderers may run for the
 * same summary.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class JsonReportRenderer implements ReportRenderer {
 *     @Override
 *     public String getId() {
 *         return "json";
 *     }
 *
 *     @Override
 *     public void render(RunSummary summary, RenderContext context) {
 *         Path target = context.outputPath().resolve("results.json");
 *         MAPPER.writeValue(target.toFile(), summary);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sbomcheck.core.renderer.ReportRenderer}
 *
 * @see RenderContext
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Lowercase, e.g. "console", "json", "csv".
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns a one-line description shown by {@code list renderers}.
     *
     * @return description
     */
    String getDescription();

    /**
     * Renders the run summary to the target destination.
     *
     * <p>Implementations should validate required settings and throw
     * {@link IllegalStateException} if configuration is invalid or output cannot be written.
     *
     * @param summary result of a validation run
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if output cannot be produced
     */
    void render(RunSummary summary, RenderContext context);
}
