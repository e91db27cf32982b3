package com.airsentinel.service.config;

import com.airsentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

public final class ConfigLoader {
    static final String ENGINE_FILE = "engine.json";

    private ConfigLoader() {
    }

    public static EngineConfig loadEngine(Path configDir) {
        Path path = configDir.resolve(ENGINE_FILE);
        ObjectMapper mapper = JsonUtils.objectMapper();
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode overrides = mapper.readTree(in);
            if (overrides == null || !overrides.isObject()) {
                throw new IllegalStateException("Failed loading config from " + path + ": expected a JSON object");
            }
            ObjectNode merged = mapper.valueToTree(EngineConfig.defaults());
            merge(merged, (ObjectNode) overrides);
            EngineConfig config = mapper.treeToValue(merged, EngineConfig.class);
            config.validate();
            return config;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static void merge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode overrideObject) {
                merge(existingObject, overrideObject);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
