package in.zonetrader.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads the engine configuration from JSON.
 *
 * The file is overlaid on the defaults field by field, so a file may set only what it changes.
 * Objects merge recursively; arrays and scalars replace. A missing file means all defaults,
 * a malformed one is an error.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ConfigLoader() {}

    /**
     * Load configuration from a file, or defaults if the file doesn't exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static EngineConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.info("No config file found, using defaults: {}", path);
            return EngineConfig.defaults();
        }
        EngineConfig config = parse(Files.readString(path));
        log.info("✅ Loaded config from: {} ({} instruments, {} events)",
            path, config.instruments().size(), config.events().size());
        return config;
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @throws IOException if the resource is missing or cannot be parsed
     */
    static EngineConfig loadResource(String resource) throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Config resource not found: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    /**
     * Parse a JSON document overlaid on the defaults.
     */
    public static EngineConfig parse(String json) throws IOException {
        JsonNode overrides = MAPPER.readTree(json);
        if (overrides == null || !overrides.isObject()) {
            throw new IOException("Config root must be a JSON object");
        }
        ObjectNode merged = MAPPER.valueToTree(EngineConfig.defaults());
        merge(merged, overrides);
        return MAPPER.treeToValue(merged, EngineConfig.class).withDefaults();
    }

    /**
     * Write configuration to a file (pretty-printed).
     */
    public static void save(EngineConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config));
        log.info("Configuration saved to: {}", path);
    }

    private static void merge(ObjectNode target, JsonNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode node && field.getValue().isObject()) {
                merge(node, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
