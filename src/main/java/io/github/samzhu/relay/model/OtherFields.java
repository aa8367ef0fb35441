package io.github.samzhu.relay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 未建模欄位的防禦性複本，保留上游的欄位順序與 JSON null
 */
final class OtherFields {

    private OtherFields() {
    }

    static Map<String, JsonNode> copyOf(Map<String, JsonNode> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
