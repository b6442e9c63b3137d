package com.hpcwatch.history;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

public class LastKnownUptime {

    private final Map<String, Long> uptimes = new ConcurrentHashMap<>();

    public void observe(String entityId, long seconds) {
        if (seconds > 0) {
            uptimes.put(entityId, seconds);
        }
    }

    public OptionalLong get(String entityId) {
        Long seconds = uptimes.get(entityId);
        return seconds == null ? OptionalLong.empty() : OptionalLong.of(seconds);
    }
}
