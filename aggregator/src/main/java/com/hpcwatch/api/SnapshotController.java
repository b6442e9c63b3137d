package com.hpcwatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.hpcwatch.cache.CacheEntry;
import com.hpcwatch.cache.CacheKeys;
import com.hpcwatch.cache.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Read-only access to the cached documents. Reads never trigger a refresh; a key that has not
 * been written yet answers 503 so clients can tell "not ready" from "empty".
 */
@Slf4j
@RestController
@RequestMapping("/api/snapshots")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SnapshotController {

    private final CacheStore cacheStore;

    @GetMapping
    public ResponseEntity<SortedSet<String>> listSnapshots() {
        return ResponseEntity.ok(cacheStore.keys());
    }

    @GetMapping("/{key}")
    public ResponseEntity<?> getSnapshot(@PathVariable String key) {
        if (!CacheKeys.isValid(key)) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "invalid key", "key", key));
        }

        Optional<CacheEntry> entry = cacheStore.read(key);
        if (entry.isEmpty()) {
            log.debug("Snapshot {} requested before first write", key);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "not ready", "key", key));
        }

        CacheEntry e = entry.get();
        return ResponseEntity.ok(new SnapshotResponse(e.key(), e.timestamp(), e.data()));
    }

    public record SnapshotResponse(String key, Instant timestamp, JsonNode data) {}
}
