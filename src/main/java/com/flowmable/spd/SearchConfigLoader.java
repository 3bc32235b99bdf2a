package com.flowmable.spd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a {@link SearchConfig} from JSON.
 * <p>
 * The file may set any subset of the fields; everything else keeps its value from
 * {@link SearchConfig#DEFAULT}. Nested objects are merged field by field, arrays and
 * lists are replaced as a whole.
 */
public final class SearchConfigLoader {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private SearchConfigLoader() {}

    public static SearchConfig load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        }
    }

    public static SearchConfig load(InputStream in, String source) throws IOException {
        JsonNode overrides = MAPPER.readTree(in);
        if (overrides == null || !overrides.isObject()) {
            throw new ConfigurationException("Configuration " + source + " must be a JSON object");
        }

        ObjectNode merged = MAPPER.valueToTree(SearchConfig.DEFAULT);
        merge(merged, (ObjectNode) overrides);

        SearchConfig config;
        try {
            config = MAPPER.treeToValue(merged, SearchConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    public static String toJson(SearchConfig config) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }

    private static void merge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode && field.getValue() instanceof ObjectNode) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
