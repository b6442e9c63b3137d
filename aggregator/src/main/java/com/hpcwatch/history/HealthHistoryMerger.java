package com.hpcwatch.history;

import com.hpcwatch.config.MonitoringConfig.HistoryProperties;
import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.HardwareStatusSnapshot;
import com.hpcwatch.model.HealthSample;
import com.hpcwatch.model.HealthStatus;
import com.hpcwatch.model.NodeHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the last few health samples per node and produces the damped hardware-status document.
 * <p>
 * The displayed uptime is always the last positive uptime seen for the node, independent of
 * which sample the severity rule selected.
 */
@Slf4j
@Component
public class HealthHistoryMerger {

    private final EntityUniverse universe;
    private final int depth;
    private final MergeRule<HealthSample, Optional<HealthSample>> rule = new SeverityMergeRule();
    private final Map<String, HistoryWindow<HealthSample, Optional<HealthSample>>> windows = new ConcurrentHashMap<>();
    private final LastKnownUptime lastKnownUptime = new LastKnownUptime();

    public HealthHistoryMerger(EntityUniverse universe, HistoryProperties properties) {
        this.universe = universe;
        this.depth = properties.getStatusDepth();
        log.info("HealthHistoryMerger initialized: {} entities, depth {}", universe.size(), depth);
    }

    public void ingest(Map<String, HealthSample> samples) {
        for (HealthSample sample : samples.values()) {
            if (!universe.contains(sample.getEntityId())) {
                continue;
            }
            lastKnownUptime.observe(sample.getEntityId(), sample.getUptimeSeconds());
            window(sample.getEntityId()).push(sample);
        }
    }

    public HardwareStatusSnapshot merged() {
        List<NodeHealth> nodes = new ArrayList<>(universe.size());
        for (String entity : universe.ids()) {
            HistoryWindow<HealthSample, Optional<HealthSample>> window = windows.get(entity);
            Optional<HealthSample> selected = window == null ? Optional.empty() : window.merge();
            long uptime = lastKnownUptime.get(entity).orElse(0L);

            NodeHealth.NodeHealthBuilder node = NodeHealth.builder()
                    .node(entity)
                    .uptimeSeconds(uptime)
                    .uptimeFormatted(UptimeFormatter.format(uptime));
            if (selected.isPresent()) {
                node.status(selected.get().getStatus())
                        .statusLabel(selected.get().getStatusLabel())
                        .statusValue(selected.get().getStatusValue());
            } else {
                node.status(HealthStatus.UNKNOWN)
                        .statusLabel(HealthStatus.NO_DATA_LABEL)
                        .statusValue(HealthStatus.NO_DATA_CODE);
            }
            nodes.add(node.build());
        }
        return HardwareStatusSnapshot.of(nodes);
    }

    List<HealthSample> history(String entityId) {
        HistoryWindow<HealthSample, Optional<HealthSample>> window = windows.get(entityId);
        return window == null ? List.of() : window.samples();
    }

    private HistoryWindow<HealthSample, Optional<HealthSample>> window(String entityId) {
        return windows.computeIfAbsent(entityId, id -> new HistoryWindow<>(depth, rule));
    }
}
