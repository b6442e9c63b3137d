package com.hpcwatch.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch.cache")
    public CacheProperties cacheProperties() {
        return new CacheProperties();
    }

    @Bean
    @ConditionalOnProperty(prefix = "hpcwatch.cache", name = "store", havingValue = "file", matchIfMissing = true)
    public CacheStore fileCacheStore(CacheProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new FileCacheStore(Path.of(properties.getDirectory()), objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hpcwatch.cache", name = "store", havingValue = "memory")
    public CacheStore inMemoryCacheStore(ObjectMapper objectMapper, Clock clock) {
        return new InMemoryCacheStore(objectMapper, clock);
    }

    @Data
    public static class CacheProperties {
        private String store = "file";
        private String directory = "cache";
    }
}
