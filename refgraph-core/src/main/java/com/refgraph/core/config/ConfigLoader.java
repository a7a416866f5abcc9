package com.refgraph.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for loading refgraph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code refgraph.yaml} into {@link ProjectConfig} records.
 * If the config file is missing or invalid, returns {@link ProjectConfig#defaults()}.
 *
 * <p>Before binding, every string value has its {@code ${name}} placeholders replaced from the
 * {@code variables} section, overridden by the caller's values. Unknown placeholders are kept
 * verbatim and logged.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Paths.get("refgraph.yaml"), Map.of("cabinet", "SHD_03_1"));
 * List<String> roots = config.roots();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.-]+)}");
    private static final String VARIABLES = "variables";

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code refgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        return load(configPath, Map.of());
    }

    /**
     * Loads configuration from a YAML file with variable overrides.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ProjectConfig#defaults()} carrying the overrides as variables.
     *
     * @param configPath path to {@code refgraph.yaml}
     * @param overrides variable values taking precedence over the file's
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath, Map<String, String> overrides) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return defaultsWith(overrides);
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return defaultsWith(overrides);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            JsonNode tree = YAML_MAPPER.readTree(configPath.toFile());
            if (!(tree instanceof ObjectNode root)) {
                log.warn("Configuration file is empty or not a mapping: {}. Using defaults.", configPath);
                return defaultsWith(overrides);
            }
            Map<String, String> variables = variables(root, overrides);
            root.set(VARIABLES, YAML_MAPPER.valueToTree(variables));
            ProjectConfig config = YAML_MAPPER.treeToValue(substitute(root, variables), ProjectConfig.class);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return defaultsWith(overrides);
        }
    }

    /**
     * Replaces {@code ${name}} placeholders in a string.
     *
     * @param value string with placeholders
     * @param variables placeholder values
     * @return resolved string; unknown placeholders are kept
     */
    public static String substitute(String value, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = variables.get(matcher.group(1));
            if (replacement == null) {
                log.warn("Unknown variable ${{}} in '{}'", matcher.group(1), value);
                replacement = matcher.group();
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static ProjectConfig defaultsWith(Map<String, String> overrides) {
        ProjectConfig defaults = ProjectConfig.defaults();
        return new ProjectConfig(defaults.documents(), defaults.roots(), defaults.candidates(), overrides,
            defaults.patterns(), defaults.closure(), defaults.prune(), defaults.guards());
    }

    private static Map<String, String> variables(ObjectNode root, Map<String, String> overrides) {
        Map<String, String> variables = new LinkedHashMap<>();
        JsonNode section = root.get(VARIABLES);
        if (section != null && section.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                variables.put(field.getKey(), field.getValue().asText());
            }
        }
        variables.putAll(overrides);
        return variables;
    }

    private static JsonNode substitute(JsonNode node, Map<String, String> variables) {
        if (node.isTextual()) {
            return TextNode.valueOf(substitute(node.textValue(), variables));
        }
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!VARIABLES.equals(field.getKey())) {
                    field.setValue(substitute(field.getValue(), variables));
                }
            }
            return object;
        }
        if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, substitute(array.get(i), variables));
            }
            return array;
        }
        return node;
    }
}
