package com.sbomcheck.core.renderer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReportRenderers}.
 */
class ReportRenderersTest {

    @Test
    void all_discoversBundledRenderersSortedById() {
        assertThat(ReportRenderers.all())
            .extracting(ReportRenderer::getId)
            .containsExactly("console", "csv", "json");
    }

    @Test
    void find_unknownId_returnsEmpty() {
        assertThat(ReportRenderers.find("xml")).isEmpty();
        assertThat(ReportRenderers.find("json")).isPresent();
    }
}
