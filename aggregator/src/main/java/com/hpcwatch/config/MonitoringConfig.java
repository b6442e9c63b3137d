package com.hpcwatch.config;

import com.hpcwatch.model.EntityUniverse;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
public class MonitoringConfig {

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch.entities")
    public EntityProperties entityProperties() {
        return new EntityProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch.history")
    public HistoryProperties historyProperties() {
        return new HistoryProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch.analytics")
    public AnalyticsProperties analyticsProperties() {
        return new AnalyticsProperties();
    }

    @Bean
    public EntityUniverse entityUniverse(EntityProperties properties) {
        EntityUniverse universe;
        if (properties.getNames() != null && !properties.getNames().isEmpty()) {
            universe = new EntityUniverse(properties.getNames());
        } else {
            universe = EntityUniverse.generate(properties.getPrefix(), properties.getCount(), properties.getPadWidth());
        }
        log.info("Monitoring {} entities: {} .. {}", universe.size(),
                universe.ids().get(0), universe.ids().get(universe.size() - 1));
        return universe;
    }

    @Data
    public static class EntityProperties {
        private String prefix = "hopper-";
        private int count = 46;
        private int padWidth = 2;
        private List<String> names = new ArrayList<>();
    }

    @Data
    public static class HistoryProperties {
        private int statusDepth = 5;
        private int powerDepth = 3;
    }

    @Data
    public static class AnalyticsProperties {
        private ZoneId zone = ZoneId.systemDefault();
        private List<String> ranges = new ArrayList<>(List.of("1h", "24h", "7d", "30d"));
        private List<String> occupationRanges = new ArrayList<>(List.of("24h", "7d", "30d"));
        private List<String> powerRanges = new ArrayList<>(List.of("yesterday", "1d", "7d", "30d"));
        private Map<String, String> gpuGroups = new LinkedHashMap<>(Map.of("overall", "node!~\"hopper-0[1-6]\""));
    }
}
