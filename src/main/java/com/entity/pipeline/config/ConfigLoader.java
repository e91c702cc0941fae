package com.entity.pipeline.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a {@link PipelineConfig} from JSON. The file only needs the values it changes:
 * it is laid over the defaults field by field, for example
 * <pre>
 * { "batchSize": 200, "integrity": { "hubName": "Example Hub" } }
 * </pre>
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Loads the configuration file, or returns the defaults when {@code path} is null.
     *
     * @throws IllegalArgumentException if the file is unreadable or holds invalid values
     */
    public static PipelineConfig load(Path path) {
        if (path == null) {
            return PipelineConfig.defaults();
        }
        if (!Files.isReadable(path)) {
            throw new IllegalArgumentException("Config file is not readable: " + path);
        }
        try {
            PipelineConfig config = overlay(PipelineConfig.defaults(), Files.readString(path));
            log.info("config.loaded source={}", path);
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Applies the JSON overrides to a base configuration.
     *
     * @throws IllegalArgumentException if the JSON is malformed, names an unknown setting or
     *                                  sets an invalid value
     */
    public static PipelineConfig overlay(PipelineConfig base, String json) {
        try {
            ObjectNode tree = MAPPER.valueToTree(base);
            JsonNode overrides = MAPPER.readTree(json);
            if (overrides != null && !overrides.isNull()) {
                if (!overrides.isObject()) {
                    throw new IllegalArgumentException("Config must be a JSON object");
                }
                merge(tree, (ObjectNode) overrides);
            }
            return MAPPER.treeToValue(tree, PipelineConfig.class);
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            // validation failures of the config records surface as the cause
            String message = cause instanceof IllegalArgumentException ? cause.getMessage() : e.getOriginalMessage();
            throw new IllegalArgumentException("Invalid config: " + message, e);
        }
    }

    private static void merge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode nested) {
                merge(existingObject, nested);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
