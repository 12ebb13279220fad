package com.sbomcheck.core.renderer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the renderers registered on the class path.
 */
public final class ReportRenderers {

    private ReportRenderers() {
    }

    /**
     * Returns every registered renderer, sorted by id.
     *
     * @return renderers
     */
    public static List<ReportRenderer> all() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        renderers.sort(Comparator.comparing(ReportRenderer::getId));
        return renderers;
    }

    /**
     * Finds a registered renderer by id.
     *
     * @param id renderer id
     * @return renderer, or empty if none is registered under that id
     */
    public static Optional<ReportRenderer> find(String id) {
        return all().stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst();
    }
}
