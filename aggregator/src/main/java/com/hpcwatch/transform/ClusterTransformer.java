package com.hpcwatch.transform;

import com.hpcwatch.model.ClusterStats;
import com.hpcwatch.model.JobsSummary;
import com.hpcwatch.model.JobsSummary.QueueJobCount;
import com.hpcwatch.model.JobsSummary.UserJobCount;
import com.hpcwatch.model.NodeDetail;
import com.hpcwatch.model.NodeState;
import com.hpcwatch.source.MetricSeries;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

@Component
public class ClusterTransformer {

    private static final int TOP_USERS = 5;
    private static final String NODE_LABEL = "node";
    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    public JobsSummary.Totals jobTotals(List<MetricSeries> running, List<MetricSeries> queued, List<MetricSeries> held) {
        long r = MetricValues.scalar(running);
        long q = MetricValues.scalar(queued);
        long h = MetricValues.scalar(held);
        return new JobsSummary.Totals(r + q + h, r, q, h);
    }

    public ClusterStats clusterStats(JobsSummary.Totals jobs, NodeCounts nodes, long totalGpus, long usedGpus) {
        return ClusterStats.builder()
                .totalNodes(nodes.free() + nodes.busy() + nodes.offline() + nodes.down())
                .busyNodes(nodes.busy())
                .freeNodes(nodes.free())
                .downNodes(nodes.down() + nodes.offline())
                .totalJobs(jobs.total())
                .runningJobs(jobs.running())
                .queuedJobs(jobs.queued())
                .totalGpus(totalGpus)
                .usedGpus(usedGpus)
                .gpuUtilization(totalGpus > 0 ? (usedGpus * 100.0) / totalGpus : 0.0)
                .build();
    }

    public List<UserJobCount> jobsByUser(List<MetricSeries> runningByUser) {
        return runningByUser.stream()
                .map(s -> s.label("user")
                        .map(user -> new UserJobCount(user, MetricValues.latestLong(s).orElse(0L))))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingLong(UserJobCount::count).reversed())
                .limit(TOP_USERS)
                .toList();
    }

    public List<QueueJobCount> jobsByQueue(List<MetricSeries> runningByQueue, List<MetricSeries> queuedByQueue) {
        Map<String, long[]> counts = new LinkedHashMap<>();
        for (MetricSeries series : runningByQueue) {
            series.label("queue").ifPresent(queue ->
                    counts.computeIfAbsent(queue, q -> new long[2])[0] = MetricValues.latestLong(series).orElse(0L));
        }
        for (MetricSeries series : queuedByQueue) {
            series.label("queue").ifPresent(queue ->
                    counts.computeIfAbsent(queue, q -> new long[2])[1] = MetricValues.latestLong(series).orElse(0L));
        }
        return counts.entrySet().stream()
                .map(e -> new QueueJobCount(e.getKey(), e.getValue()[0] + e.getValue()[1], e.getValue()[0], e.getValue()[1]))
                .sorted(Comparator.comparingLong(QueueJobCount::count).reversed())
                .toList();
    }

    public List<NodeDetail> nodeDetails(List<MetricSeries> states,
                                        List<MetricSeries> gpusTotal,
                                        List<MetricSeries> gpusUsed,
                                        List<MetricSeries> memTotal,
                                        List<MetricSeries> memUsed,
                                        List<MetricSeries> jobs) {
        Map<String, Long> totalGpus = byNode(gpusTotal);
        Map<String, Long> usedGpus = byNode(gpusUsed);
        Map<String, Long> totalMemory = byNode(memTotal);
        Map<String, Long> usedMemory = byNode(memUsed);
        Map<String, Long> jobCounts = byNode(jobs);

        Map<String, NodeDetail> nodes = new LinkedHashMap<>();
        for (MetricSeries series : states) {
            Optional<String> node = series.label(NODE_LABEL).filter(n -> !n.isBlank());
            if (node.isEmpty()) {
                continue;
            }
            String name = node.get();
            OptionalLong code = MetricValues.latestLong(series);
            nodes.put(name, new NodeDetail(
                    name,
                    name,
                    code.isPresent() ? NodeState.fromCode(code.getAsLong()) : NodeState.UNKNOWN,
                    totalGpus.getOrDefault(name, 0L),
                    usedGpus.getOrDefault(name, 0L),
                    formatBytes(totalMemory.getOrDefault(name, 0L)),
                    formatBytes(usedMemory.getOrDefault(name, 0L)),
                    jobCounts.getOrDefault(name, 0L)));
        }
        return new ArrayList<>(nodes.values());
    }

    static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0B";
        }
        int unit = 0;
        double scaled = bytes;
        while (scaled >= 1024 && unit < BYTE_UNITS.length - 1) {
            scaled /= 1024;
            unit++;
        }
        double rounded = Math.round(scaled * 100) / 100.0;
        return BigDecimal.valueOf(rounded).stripTrailingZeros().toPlainString() + BYTE_UNITS[unit];
    }

    private static Map<String, Long> byNode(List<MetricSeries> result) {
        Map<String, Long> values = new HashMap<>();
        for (MetricSeries series : result) {
            series.label(NODE_LABEL).ifPresent(node ->
                    MetricValues.latestLong(series).ifPresent(value -> values.put(node, value)));
        }
        return values;
    }

    public record NodeCounts(long free, long busy, long offline, long down) {

        public static NodeCounts of(List<MetricSeries> free, List<MetricSeries> busy,
                                    List<MetricSeries> offline, List<MetricSeries> down) {
            return new NodeCounts(MetricValues.scalar(free), MetricValues.scalar(busy),
                    MetricValues.scalar(offline), MetricValues.scalar(down));
        }
    }
}
