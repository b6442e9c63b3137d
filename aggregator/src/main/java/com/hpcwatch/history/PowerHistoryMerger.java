package com.hpcwatch.history;

import com.hpcwatch.config.MonitoringConfig.HistoryProperties;
import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.NodePower;
import com.hpcwatch.model.PowerSample;
import com.hpcwatch.model.PowerStatusSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class PowerHistoryMerger {

    private final EntityUniverse universe;
    private final int depth;
    private final MergeRule<PowerSample, Long> rule = new RecentNonZeroMergeRule();
    private final Map<String, HistoryWindow<PowerSample, Long>> windows = new ConcurrentHashMap<>();

    private volatile Instant lastObservedAt;

    public PowerHistoryMerger(EntityUniverse universe, HistoryProperties properties) {
        this.universe = universe;
        this.depth = properties.getPowerDepth();
        log.info("PowerHistoryMerger initialized: {} entities, depth {}", universe.size(), depth);
    }

    public void ingest(Map<String, PowerSample> samples, Instant observedAt) {
        for (PowerSample sample : samples.values()) {
            if (universe.contains(sample.entityId())) {
                windows.computeIfAbsent(sample.entityId(), id -> new HistoryWindow<>(depth, rule)).push(sample);
            }
        }
        lastObservedAt = observedAt;
    }

    public PowerStatusSnapshot merged() {
        List<NodePower> nodes = new ArrayList<>(universe.size());
        for (String entity : universe.ids()) {
            HistoryWindow<PowerSample, Long> window = windows.get(entity);
            nodes.add(new NodePower(entity, window == null ? 0L : window.merge()));
        }
        return PowerStatusSnapshot.of(nodes, lastObservedAt);
    }
}
