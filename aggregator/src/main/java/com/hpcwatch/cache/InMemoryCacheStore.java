package com.hpcwatch.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryCacheStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public CacheEntry write(String key, Object payload) {
        CacheKeys.requireValid(key);
        CacheEntry entry = new CacheEntry(key, clock.instant(), JsonPayloads.toTree(objectMapper, key, payload));
        entries.put(key, entry);
        log.debug("Cache updated: {}", key);
        return entry;
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        CacheKeys.requireValid(key);
        return Optional.ofNullable(entries.get(key))
                .map(e -> new CacheEntry(e.key(), e.timestamp(), e.data().deepCopy()));
    }

    @Override
    public SortedSet<String> keys() {
        return new TreeSet<>(entries.keySet());
    }
}
