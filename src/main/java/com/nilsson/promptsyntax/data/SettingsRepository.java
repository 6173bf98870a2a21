package com.nilsson.promptsyntax.data;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 Repository class responsible for resolving parser settings.
 * <p>Settings are a flat key-value object read from a JSON resource on the classpath
 ({@value #DEFAULT_RESOURCE} by default). Any key may be overridden through a property named
 {@code promptparser.<key>}, normally taken from the JVM system properties.</p>
 * <p>Key features include:
 <ul>
 <li><b>Default Value Handling:</b> Every lookup takes a fallback that is used when the key is
 absent or its value cannot be read as the requested type.</li>
 <li><b>Lenient JSON:</b> Comments are allowed in the settings resource.</li>
 <li><b>Read-only:</b> Values are resolved once at construction, so the repository can be shared
 between threads.</li>
 </ul>
 </p>
 */
public class SettingsRepository {

    public static final String DEFAULT_RESOURCE = "prompt-parser.json";
    public static final String OVERRIDE_PREFIX = "promptparser.";

    private static final Logger logger = LoggerFactory.getLogger(SettingsRepository.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true);

    private final JsonNode root;
    private final Properties overrides;

    @Inject
    public SettingsRepository() {
        this(DEFAULT_RESOURCE, System.getProperties());
    }

    public SettingsRepository(String resourceName, Properties overrides) {
        this.root = load(resourceName);
        this.overrides = overrides == null ? new Properties() : overrides;
    }

    // --- Lookups ---

    public String get(String key, String defaultValue) {
        String override = overrides.getProperty(OVERRIDE_PREFIX + key);
        if (override != null) return override;

        JsonNode value = root.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) return defaultValue;
        return value.asText();
    }

    public double getDouble(String key, double defaultValue) {
        String raw = get(key, null);
        if (raw == null) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Setting '{}' is not a number: {}", key, raw);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String raw = get(key, null);
        if (raw == null) return defaultValue;
        String normalized = raw.trim().toLowerCase();
        if (normalized.equals("true")) return true;
        if (normalized.equals("false")) return false;
        logger.warn("Setting '{}' is not a boolean: {}", key, raw);
        return defaultValue;
    }

    // --- Loading ---

    private JsonNode load(String resourceName) {
        try (InputStream in = SettingsRepository.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                logger.info("No settings resource '{}' on classpath, using defaults", resourceName);
                return mapper.createObjectNode();
            }
            JsonNode node = mapper.readTree(in);
            if (node == null || !node.isObject()) {
                logger.warn("Settings resource '{}' is not a JSON object, using defaults", resourceName);
                return mapper.createObjectNode();
            }
            return node;
        } catch (IOException e) {
            logger.error("Failed to read settings resource: {}", resourceName, e);
            return mapper.createObjectNode();
        }
    }
}
