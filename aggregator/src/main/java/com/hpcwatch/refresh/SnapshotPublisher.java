package com.hpcwatch.refresh;

import com.hpcwatch.cache.CacheStore;
import com.hpcwatch.cache.CacheWriteException;
import com.hpcwatch.scheduler.RefreshReport.KeyOutcome;
import com.hpcwatch.source.FetchFailedException;
import com.hpcwatch.source.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Builds and writes one cache key in isolation. Whatever goes wrong while building or writing a
 * key is logged and reported for that key only; the entry already in the store is left as it is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotPublisher {

    private final CacheStore cacheStore;

    public KeyOutcome publish(String key, Supplier<? extends FetchResult<?>> build) {
        FetchResult<?> result;
        try {
            result = build.get();
        } catch (FetchFailedException e) {
            log.warn("Skipping {}: {}", key, e.getError());
            return KeyOutcome.failed(key, e.getError().toString());
        } catch (RuntimeException e) {
            log.error("Unexpected failure building {}", key, e);
            return KeyOutcome.failed(key, e.toString());
        }

        if (result.isFailure()) {
            log.warn("Skipping {}: {}", key, result.getError());
            return KeyOutcome.failed(key, result.getError().toString());
        }
        return write(key, result.getValue());
    }

    public KeyOutcome write(String key, Object payload) {
        try {
            cacheStore.write(key, payload);
            return KeyOutcome.written(key);
        } catch (CacheWriteException e) {
            log.error("Cache write failed for {}", key, e);
            return KeyOutcome.failed(key, e.getMessage());
        }
    }

    static <T> T required(CompletableFuture<FetchResult<T>> pending) {
        return pending.join().orElseThrow();
    }

    static <T> List<T> optional(String what, CompletableFuture<FetchResult<List<T>>> pending) {
        FetchResult<List<T>> result = pending.join();
        if (result.isFailure()) {
            log.warn("{} unavailable, using an empty list: {}", what, result.getError());
            return List.of();
        }
        return result.getValue();
    }
}
