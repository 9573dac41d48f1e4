package com.conduit.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the gateway configuration file.
 *
 * String values may reference environment variables as {@code ${NAME}}; unset variables
 * are replaced with an empty string. Problems with the file fail fast with
 * {@link ConfigLoadException}.
 */
public class ConfigService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Environment variable naming the configuration file.
     */
    public static final String CONFIG_ENV = "CONDUIT_CONFIG";

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final Function<String, String> environment;

    public ConfigService() {
        this(System::getenv);
    }

    /**
     * Creates a service resolving {@code ${NAME}} references through the given lookup.
     */
    public ConfigService(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Locates and loads the configuration: the first command-line argument if present,
     * else the file named by {@value #CONFIG_ENV}, else the defaults.
     *
     * @param args the gateway's command-line arguments
     * @return the configuration
     * @throws ConfigLoadException if an explicitly named file is missing or invalid
     */
    public GatewayConfig locateAndLoad(String[] args) throws ConfigLoadException {
        String location = args != null && args.length > 0 ? args[0] : environment.apply(CONFIG_ENV);
        if (location == null || location.isBlank()) {
            LOGGER.info("No configuration file given, using defaults");
            return GatewayConfig.defaults();
        }
        return load(Path.of(location));
    }

    /**
     * Loads a configuration file.
     *
     * @param configFile the file
     * @return the configuration
     * @throws ConfigLoadException if the file cannot be read or is invalid
     */
    public GatewayConfig load(Path configFile) throws ConfigLoadException {
        if (!Files.exists(configFile)) {
            throw new ConfigLoadException(String.format("Configuration file '%s' does not exist", configFile));
        }
        String content;
        try {
            content = Files.readString(configFile);
        } catch (IOException e) {
            throw new ConfigLoadException(String.format("Failed to read configuration from '%s'", configFile), e);
        }
        GatewayConfig config = parse(content);
        LOGGER.info("Loaded configuration from {} with {} extensions", configFile, config.extensions().size());
        return config;
    }

    /**
     * Parses configuration JSON.
     *
     * @throws ConfigLoadException if the JSON is malformed or has invalid values
     */
    public GatewayConfig parse(String content) throws ConfigLoadException {
        JsonNode root;
        try {
            root = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Configuration is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return GatewayConfig.defaults();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be an object");
        }

        JsonNode resolved = interpolate(root);
        JsonNode gateway = resolved.path("gateway");
        String host = gateway.path("host").asText(GatewayConfig.DEFAULT_HOST);
        int port = gateway.path("port").asInt(GatewayConfig.DEFAULT_PORT);
        if (port < 1 || port > 65535) {
            throw new ConfigLoadException(String.format("gateway.port must be between 1 and 65535, got %d", port));
        }

        Map<String, ExtensionConfig> extensions = new LinkedHashMap<>();
        JsonNode extensionsNode = resolved.path("extensions");
        if (!extensionsNode.isMissingNode() && !extensionsNode.isObject()) {
            throw new ConfigLoadException("'extensions' must be an object keyed by extension id");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = extensionsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            extensions.put(field.getKey(), readExtension(field.getKey(), field.getValue()));
        }

        return new GatewayConfig(host, port, extensions);
    }

    /**
     * Replaces {@code ${NAME}} references in a string.
     */
    public String interpolate(String value) {
        Matcher matcher = ENV_REFERENCE.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = environment.apply(name);
            if (replacement == null) {
                LOGGER.warn("Environment variable {} referenced in configuration is not set", name);
                replacement = "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private ExtensionConfig readExtension(String id, JsonNode node) throws ConfigLoadException {
        if (!node.isObject()) {
            throw new ConfigLoadException(String.format("Configuration of extension '%s' must be an object", id));
        }
        boolean enabled = node.path("enabled").asBoolean(true);
        String className = node.hasNonNull("className") ? node.get("className").asText() : null;
        if (enabled && (className == null || className.isBlank())) {
            throw new ConfigLoadException(String.format("Extension '%s' is enabled but has no className", id));
        }

        JsonNode configNode = node.path("config");
        if (!configNode.isMissingNode() && !configNode.isNull() && !configNode.isObject()) {
            throw new ConfigLoadException(String.format("'config' of extension '%s' must be an object", id));
        }
        JsonObject config = configNode.isObject()
            ? JsonParser.parseString(configNode.toString()).getAsJsonObject()
            : new JsonObject();

        return new ExtensionConfig(
            id,
            enabled,
            className,
            node.path("outOfProcess").asBoolean(false),
            readStrings(id, node, "command"),
            node.has("sourceRoutes") ? readStrings(id, node, "sourceRoutes") : null,
            config
        );
    }

    private static List<String> readStrings(String id, JsonNode node, String field) throws ConfigLoadException {
        JsonNode value = node.path(field);
        List<String> values = new ArrayList<>();
        if (value.isMissingNode() || value.isNull()) {
            return values;
        }
        if (!value.isArray()) {
            throw new ConfigLoadException(String.format("'%s' of extension '%s' must be an array", field, id));
        }
        for (JsonNode element : value) {
            values.add(element.asText());
        }
        return values;
    }

    private JsonNode interpolate(JsonNode node) {
        if (node.isTextual()) {
            return TextNode.valueOf(interpolate(node.asText()));
        }
        if (node.isObject()) {
            ObjectNode copy = MAPPER.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), interpolate(field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            for (JsonNode element : node) {
                copy.add(interpolate(element));
            }
            return copy;
        }
        return node;
    }
}
