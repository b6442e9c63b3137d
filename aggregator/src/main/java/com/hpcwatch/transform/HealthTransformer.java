package com.hpcwatch.transform;

import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.HealthSample;
import com.hpcwatch.model.HealthStatus;
import com.hpcwatch.source.MetricPoint;
import com.hpcwatch.source.MetricSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns the {@code globalSystemStatus} and {@code systemPowerUpTime} instant results into one
 * {@link HealthSample} per entity of the universe. Entities without a readable status get the
 * "No Data" placeholder.
 */
@Slf4j
@Component
public class HealthTransformer {

    public Map<String, HealthSample> transform(List<MetricSeries> statusRows,
                                               List<MetricSeries> uptimeRows,
                                               EntityUniverse universe,
                                               Instant observedAt) {
        Map<String, Long> uptimes = uptimes(uptimeRows, universe);
        Map<String, HealthSample> statuses = new HashMap<>();

        for (MetricSeries series : statusRows) {
            Optional<String> key = EntityKeys.forHealth(series).filter(universe::contains);
            if (key.isEmpty()) {
                log.debug("Ignoring status series outside the universe: {}", series.labels());
                continue;
            }
            String entity = key.get();
            long uptime = uptimes.getOrDefault(entity, 0L);
            OptionalDouble code = series.latest().map(MetricPoint::rawValue)
                    .map(MetricValues::parseDouble)
                    .orElse(OptionalDouble.empty());

            if (code.isEmpty()) {
                log.debug("Unreadable status value for {}: {}", entity, series.points());
                statuses.put(entity, HealthSample.noData(entity, observedAt, uptime));
                continue;
            }

            double raw = code.getAsDouble();
            if (raw != Math.rint(raw) || raw < Integer.MIN_VALUE || raw > Integer.MAX_VALUE) {
                log.debug("Status value for {} is not a status code: {}", entity, raw);
                statuses.put(entity, HealthSample.of(entity, observedAt, HealthStatus.UNKNOWN, uptime));
                continue;
            }

            int statusCode = (int) raw;
            HealthStatus status = HealthStatus.fromCode(statusCode);
            statuses.put(entity, HealthSample.builder()
                    .entityId(entity)
                    .observedAt(observedAt)
                    .status(status)
                    .statusLabel(status.label())
                    .statusValue(statusCode)
                    .uptimeSeconds(uptime)
                    .build());
        }

        Map<String, HealthSample> samples = new LinkedHashMap<>();
        for (String entity : universe.ids()) {
            HealthSample sample = statuses.get(entity);
            samples.put(entity, sample != null
                    ? sample
                    : HealthSample.noData(entity, observedAt, uptimes.getOrDefault(entity, 0L)));
        }
        return samples;
    }

    private Map<String, Long> uptimes(List<MetricSeries> uptimeRows, EntityUniverse universe) {
        Map<String, Long> uptimes = new HashMap<>();
        for (MetricSeries series : uptimeRows) {
            Optional<String> key = EntityKeys.forHealth(series).filter(universe::contains);
            if (key.isEmpty()) {
                continue;
            }
            long seconds = MetricValues.latestLong(series).orElse(0L);
            uptimes.put(key.get(), Math.max(0L, seconds));
        }
        return uptimes;
    }
}
