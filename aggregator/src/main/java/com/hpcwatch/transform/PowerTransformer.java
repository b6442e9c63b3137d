package com.hpcwatch.transform;

import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.PowerSample;
import com.hpcwatch.source.MetricSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class PowerTransformer {

    public Map<String, PowerSample> transform(List<MetricSeries> rows, EntityUniverse universe, Instant observedAt) {
        Map<String, Long> watts = new HashMap<>();
        for (MetricSeries series : rows) {
            Optional<String> key = EntityKeys.forPower(series).filter(universe::contains);
            if (key.isEmpty()) {
                log.debug("Ignoring power series outside the universe: {}", series.labels());
                continue;
            }
            watts.put(key.get(), Math.max(0L, MetricValues.latestLong(series).orElse(0L)));
        }

        Map<String, PowerSample> samples = new LinkedHashMap<>();
        for (String entity : universe.ids()) {
            samples.put(entity, new PowerSample(entity, observedAt, watts.getOrDefault(entity, 0L)));
        }
        return samples;
    }
}
