package com.outreach.scoring.engine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.outreach.scoring.engine.Fingerprints;
import com.outreach.scoring.exception.SchemaException;
import com.outreach.scoring.model.config.RuleConfiguration;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Reads and writes rule-configuration documents. Output is canonical (sorted keys),
 * so equal configurations always serialize to the same bytes and fingerprint.
 */
@Component
public class ConfigurationCodec {

    private final ObjectMapper mapper;

    public ConfigurationCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Parses a raw document into a tree.
     *
     * @throws SchemaException at path {@code $} when the text is not well-formed JSON
     */
    public JsonNode parse(String document) {
        if (document == null || document.isBlank()) {
            throw new SchemaException("$", "configuration document is empty");
        }
        try {
            return mapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new SchemaException("$", "malformed JSON: " + e.getOriginalMessage());
        }
    }

    public JsonNode toTree(RuleConfiguration config) {
        return mapper.valueToTree(config);
    }

    public String toJson(RuleConfiguration config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration", e);
        }
    }

    public String fingerprint(RuleConfiguration config) {
        try {
            return Fingerprints.sha256(mapper.writeValueAsBytes(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration", e);
        }
    }

    /**
     * Deep-merges {@code override} onto a copy of {@code base}. Objects merge recursively;
     * arrays and scalars in the override replace the base value; an explicit null removes the key.
     * Neither input is modified.
     */
    public static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isMissingNode()) {
            return base == null ? null : base.deepCopy();
        }
        if (base == null || !base.isObject() || !override.isObject()) {
            return override.deepCopy();
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = override.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull()) {
                merged.remove(field.getKey());
            } else {
                merged.set(field.getKey(), deepMerge(merged.get(field.getKey()), field.getValue()));
            }
        }
        return merged;
    }
}
