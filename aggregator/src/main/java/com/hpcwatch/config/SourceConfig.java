package com.hpcwatch.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class SourceConfig {

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch.metrics")
    public MetricsProperties metricsProperties() {
        return new MetricsProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch.warehouse")
    public WarehouseProperties warehouseProperties() {
        return new WarehouseProperties();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(@Value("${hpcwatch.fetch.threads:8}") int threads) {
        log.info("Fetch executor initialized with {} threads", threads);
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Data
    public static class MetricsProperties {
        private String baseUrl = "http://localhost:9090";
        private Duration requestTimeout = Duration.ofSeconds(10);
        private String token;
        private String username;
        private String password;
    }

    @Data
    public static class WarehouseProperties {
        private String schema = "modw";
        private String jobTable = "job_tasks";
        private String preferredWaitColumn = "waitduration";
        private int topUsers = 7;
        private List<Integer> dayRanges = new ArrayList<>(List.of(1, 7, 30));
        private Map<String, List<String>> queueGroups = new LinkedHashMap<>(Map.of(
                "aisg", List.of("AISG_large", "AISG_debug", "AISG_guest"),
                "nusit", List.of("small", "interactive", "medium", "special", "large")));
    }
}
