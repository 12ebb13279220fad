package com.sbomcheck.core.renderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Output settings handed to every renderer of a run.
 *
 * <p>Setting keys are prefixed with the renderer id, e.g. {@code console.colors} or
 * {@code json.file}. Unknown keys are ignored.
 *
 * @param outputDirectory directory that file renderers write into, relative to the working directory
 * @param settings renderer settings as strings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public Path outputPath() {
        return Paths.get(outputDirectory);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Reads a {@code true}/{@code false} setting.
     *
     * @param key setting key
     * @param defaultValue value used when the key is absent
     * @return parsed flag; anything but {@code true} (ignoring case) is false
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
