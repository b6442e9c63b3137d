package com.hpcwatch.cache;

import java.util.Optional;
import java.util.SortedSet;

public interface CacheStore {

    CacheEntry write(String key, Object payload);

    Optional<CacheEntry> read(String key);

    SortedSet<String> keys();
}
