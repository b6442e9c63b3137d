package com.hpcwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record CacheEntry(String key, Instant timestamp, JsonNode data) {
}
