package com.hpcwatch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * One {@code <key>.json} document per key, shaped {@code {"timestamp": ..., "data": ...}}.
 * <p>
 * Writes go to a temporary sibling file that is then moved over the target, so a reader sees
 * either the complete old file or the complete new one. Entries written by an earlier process
 * are readable after a restart.
 */
@Slf4j
public class FileCacheStore implements CacheStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileCacheStore(Path directory, ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + directory, e);
        }
        log.info("FileCacheStore initialized at {}", directory.toAbsolutePath());
    }

    @Override
    public CacheEntry write(String key, Object payload) {
        CacheKeys.requireValid(key);
        CacheEntry entry = new CacheEntry(key, clock.instant(), JsonPayloads.toTree(objectMapper, key, payload));

        ObjectNode document = objectMapper.createObjectNode();
        document.put("timestamp", entry.timestamp().toString());
        document.set("data", entry.data());

        Path target = pathOf(key);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, key + "-", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            move(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CacheWriteException(key, e);
        }

        log.debug("Cache updated: {}", key);
        return entry;
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        CacheKeys.requireValid(key);
        Path path = pathOf(key);
        JsonNode document;
        try {
            document = objectMapper.readTree(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable cache entry {}: {}", path, e.getMessage());
            return Optional.empty();
        }

        if (document == null || !document.has("timestamp") || !document.has("data")) {
            log.warn("Cache entry {} is missing timestamp or data", path);
            return Optional.empty();
        }
        try {
            Instant timestamp = Instant.parse(document.get("timestamp").asText());
            return Optional.of(new CacheEntry(key, timestamp, document.get("data")));
        } catch (DateTimeParseException e) {
            log.warn("Cache entry {} has an invalid timestamp: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public SortedSet<String> keys() {
        SortedSet<String> keys = new TreeSet<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(f -> f.endsWith(SUFFIX))
                    .map(f -> f.substring(0, f.length() - SUFFIX.length()))
                    .filter(CacheKeys::isValid)
                    .forEach(keys::add);
        } catch (IOException e) {
            log.warn("Cannot list cache directory {}: {}", directory, e.getMessage());
        }
        return keys;
    }

    private Path pathOf(String key) {
        return directory.resolve(key + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary cache file {}: {}", path, e.getMessage());
        }
    }
}
