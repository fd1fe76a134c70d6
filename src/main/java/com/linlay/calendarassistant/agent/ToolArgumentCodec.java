package com.linlay.calendarassistant.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes tool-call argument payloads and encodes tool outputs. Never throws: anything that
 * does not decode to a JSON object becomes an empty argument map.
 */
@Component
public class ToolArgumentCodec {

    private static final Logger log = LoggerFactory.getLogger(ToolArgumentCodec.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ToolArgumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> parse(String rawArguments) {
        if (!StringUtils.hasText(rawArguments)) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(rawArguments);
            if (node == null || !node.isObject()) {
                return Map.of();
            }
            return objectMapper.convertValue(node, MAP_TYPE);
        } catch (Exception ex) {
            log.debug("Discarding malformed tool arguments: {}", ex.getMessage());
            return Map.of();
        }
    }

    public String serialize(Object value) {
        if (value == null) {
            return "{}";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception ex) {
            log.warn("Failed to serialize tool payload of type {}", value.getClass().getName(), ex);
            return "{}";
        }
    }

    public String data(Object data) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("data", data == null ? objectMapper.nullNode() : objectMapper.valueToTree(data));
        return serialize(root);
    }

    public String error(String message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("error", StringUtils.hasText(message) ? message : "Tool execution failed");
        return serialize(root);
    }
}
