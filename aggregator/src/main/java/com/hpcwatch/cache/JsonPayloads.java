package com.hpcwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

final class JsonPayloads {

    private JsonPayloads() {
    }

    static JsonNode toTree(ObjectMapper objectMapper, String key, Object payload) {
        if (payload instanceof JsonNode) {
            return ((JsonNode) payload).deepCopy();
        }
        try {
            return objectMapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new CacheWriteException(key, e);
        }
    }
}
