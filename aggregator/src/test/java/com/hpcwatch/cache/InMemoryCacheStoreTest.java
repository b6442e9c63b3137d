package com.hpcwatch.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCacheStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InMemoryCacheStore store =
            new InMemoryCacheStore(objectMapper, Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void storedEntryDoesNotAliasCallerObjects() {
        List<Integer> payload = new ArrayList<>(List.of(1, 2));
        store.write("job-stats-1d", payload);
        payload.add(3);

        ArrayNode read = (ArrayNode) store.read("job-stats-1d").orElseThrow().data();
        read.add(99);

        assertEquals(2, store.read("job-stats-1d").orElseThrow().data().size());
    }

    @Test
    void readsAbsentUntilWritten() {
        assertTrue(store.read("cluster-stats").isEmpty());

        store.write("cluster-stats", Map.of("totalNodes", 46));

        assertEquals(Set.of("cluster-stats"), store.keys());
    }

    @Test
    void concurrentReadersSeeOnlyCompleteEntries() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean torn = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(3);
        store.write("power-status", Map.of("a", 0, "b", 0));

        pool.execute(() -> {
            for (int i = 1; i <= 2_000; i++) {
                store.write("power-status", Map.of("a", i, "b", i));
            }
            done.countDown();
        });
        for (int r = 0; r < 2; r++) {
            pool.execute(() -> {
                for (int i = 0; i < 2_000; i++) {
                    var data = store.read("power-status").orElseThrow().data();
                    if (data.get("a").asInt() != data.get("b").asInt()) {
                        torn.set(true);
                    }
                }
                done.countDown();
            });
        }

        assertTrue(done.await(30, TimeUnit.SECONDS));
        pool.shutdownNow();
        assertFalse(torn.get());
    }

    @Test
    void emptyPayloadIsPresentUnlikeMissingKey() {
        store.write("jobs-summary", List.of());

        assertEquals(objectMapper.createArrayNode(), store.read("jobs-summary").orElseThrow().data());
        assertFalse(store.read("cluster-stats").isPresent());
    }
}
