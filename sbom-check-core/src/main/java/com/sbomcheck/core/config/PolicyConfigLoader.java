package com.sbomcheck.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sbomcheck.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility for loading policy configuration from YAML (or JSON) files.
 *
 * <p>Uses Jackson to deserialize the file into {@link PolicyConfig} records. Unlike project
 * settings, a policy cannot fall back to defaults: a missing or malformed file means the run
 * cannot produce meaningful results, so every problem raises
 * {@link PolicyConfigurationException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PolicyConfig policy = PolicyConfigLoader.load(Paths.get("policy.yaml"));
 * PolicyConfig bundled = PolicyConfigLoader.loadDefault();
 * }</pre>
 */
public class PolicyConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, List<PolicyCheck>>> CHECKS_TYPE = new TypeReference<>() {};

    /** Class path location of the bundled completeness policy */
    public static final String DEFAULT_POLICY_RESOURCE = "/default-policy.yaml";

    private PolicyConfigLoader() {
    }

    /**
     * Loads a policy from a file.
     *
     * @param configPath path to a YAML or JSON policy file
     * @return loaded policy
     * @throws PolicyConfigurationException if the file is missing, unreadable or invalid
     */
    public static PolicyConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new PolicyConfigurationException("Policy file not found: " + configPath);
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new PolicyConfigurationException("Policy file is not readable: " + configPath);
        }

        log.debug("Loading policy from: {}", configPath);
        try (InputStream in = Files.newInputStream(configPath)) {
            PolicyConfig config = read(in, configPath.toString());
            log.info("Loaded policy from: {} ({} entity types)", configPath, config.checks().size());
            return config;
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the bundled policy reproducing the completeness checks of the original tool.
     *
     * @return default policy
     */
    public static PolicyConfig loadDefault() {
        try (InputStream in = PolicyConfigLoader.class.getResourceAsStream(DEFAULT_POLICY_RESOURCE)) {
            if (in == null) {
                throw new PolicyConfigurationException("Bundled policy not found: " + DEFAULT_POLICY_RESOURCE);
            }
            return read(in, DEFAULT_POLICY_RESOURCE);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read bundled policy: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a policy from text.
     *
     * @param content YAML or JSON text
     * @return parsed policy
     * @throws PolicyConfigurationException if the text is not a valid policy
     */
    public static PolicyConfig parse(String content) {
        try {
            return convert(YAML_MAPPER.readTree(content), "<inline>");
        } catch (IOException e) {
            throw invalid("<inline>", e);
        }
    }

    private static PolicyConfig read(InputStream in, String source) throws IOException {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw invalid(source, e);
        }
        return convert(root, source);
    }

    private static PolicyConfig convert(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.debug("Policy {} is empty", source);
            return PolicyConfig.empty();
        }
        if (!root.isObject()) {
            throw new PolicyConfigurationException(
                "Invalid policy " + source + ": expected a mapping of entity type to checks");
        }

        Map<String, List<PolicyCheck>> raw;
        try {
            raw = YAML_MAPPER.readerFor(CHECKS_TYPE).readValue(root);
        } catch (IOException e) {
            throw invalid(source, e);
        }

        Map<EntityType, List<PolicyCheck>> checks = new LinkedHashMap<>();
        for (Map.Entry<String, List<PolicyCheck>> entry : raw.entrySet()) {
            EntityType type = EntityType.fromLabel(entry.getKey())
                .orElseThrow(() -> new PolicyConfigurationException("Invalid policy " + source
                    + ": unknown entity type '" + entry.getKey() + "', expected one of "
                    + Arrays.stream(EntityType.values()).map(EntityType::label).collect(Collectors.joining(", "))));
            checks.put(type, entry.getValue());
        }
        try {
            return new PolicyConfig(checks);
        } catch (PolicyConfigurationException e) {
            throw new PolicyConfigurationException("Invalid policy " + source + ": " + e.getMessage(), e);
        }
    }

    private static PolicyConfigurationException invalid(String source, IOException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof PolicyConfigurationException) {
                String location = e instanceof JsonMappingException mapping ? " at " + mapping.getPathReference() : "";
                return new PolicyConfigurationException(
                    "Invalid policy " + source + location + ": " + cause.getMessage(), e);
            }
            cause = cause.getCause();
        }
        String detail = e instanceof JsonMappingException mapping ? mapping.getOriginalMessage() : e.getMessage();
        return new PolicyConfigurationException("Invalid policy " + source + ": " + detail, e);
    }
}
