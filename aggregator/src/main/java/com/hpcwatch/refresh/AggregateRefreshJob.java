package com.hpcwatch.refresh;

import com.hpcwatch.config.MonitoringConfig.AnalyticsProperties;
import com.hpcwatch.config.SourceConfig.WarehouseProperties;
import com.hpcwatch.scheduler.RefreshJob;
import com.hpcwatch.scheduler.RefreshReport;
import com.hpcwatch.scheduler.RefreshReport.KeyOutcome;
import com.hpcwatch.source.FetchResult;
import com.hpcwatch.source.MetricSeries;
import com.hpcwatch.source.MetricsSourceAdapter;
import com.hpcwatch.source.TimeRanges;
import com.hpcwatch.source.TimeRanges.QueryWindow;
import com.hpcwatch.source.WarehouseSourceAdapter;
import com.hpcwatch.transform.RangeLabels;
import com.hpcwatch.transform.RangeSeriesMerger;
import com.hpcwatch.transform.RangeSeriesMerger.Column;
import com.hpcwatch.transform.WarehouseTransformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * The hourly refresh of everything that does not need damping: warehouse job statistics and
 * wait-time tables, monthly GPU hours, and the range charts from the metrics backend.
 * <p>
 * Each key is an independent sub-job. All source calls are issued before any key is built, so the
 * cycle takes roughly as long as its slowest query, and a failing key never stops its siblings.
 */
@Slf4j
@Component
public class AggregateRefreshJob implements RefreshJob {

    private final MetricsSourceAdapter metrics;
    private final WarehouseSourceAdapter warehouse;
    private final WarehouseTransformer warehouseTransformer;
    private final SnapshotPublisher publisher;
    private final WarehouseProperties warehouseProperties;
    private final AnalyticsProperties analyticsProperties;
    private final Clock clock;

    public AggregateRefreshJob(MetricsSourceAdapter metrics,
                               WarehouseSourceAdapter warehouse,
                               WarehouseTransformer warehouseTransformer,
                               SnapshotPublisher publisher,
                               WarehouseProperties warehouseProperties,
                               AnalyticsProperties analyticsProperties,
                               Clock clock) {
        this.metrics = metrics;
        this.warehouse = warehouse;
        this.warehouseTransformer = warehouseTransformer;
        this.publisher = publisher;
        this.warehouseProperties = warehouseProperties;
        this.analyticsProperties = analyticsProperties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "aggregate";
    }

    @Override
    public Duration defaultInterval() {
        return Duration.ofHours(1);
    }

    @Override
    public RefreshReport refresh() {
        Map<String, Supplier<FetchResult<?>>> subJobs = new LinkedHashMap<>();
        warehouseSubJobs(subJobs);
        analyticsSubJobs(subJobs, clock.instant());

        List<KeyOutcome> outcomes = new ArrayList<>(subJobs.size());
        subJobs.forEach((key, build) -> outcomes.add(publisher.publish(key, build)));
        return RefreshReport.of(outcomes);
    }

    private void warehouseSubJobs(Map<String, Supplier<FetchResult<?>>> subJobs) {
        String schema = warehouseProperties.getSchema();
        String table = warehouseProperties.getJobTable();
        FetchResult<String> waitColumn = warehouse.waitTimeColumn();
        if (waitColumn.isFailure()) {
            log.warn("Wait-time tables will be skipped this cycle: {}", waitColumn.getError());
        }

        for (int days : warehouseProperties.getDayRanges()) {
            var usage = warehouse.query("gpu-usage-by-user-" + days + "d",
                    WarehouseQueries.gpuUsageByUser(schema, table), days, warehouseProperties.getTopUsers());
            subJobs.put("gpu-usage-by-user-" + days + "d",
                    () -> usage.join().map(warehouseTransformer::gpuUsageByUser));

            var stats = warehouse.query("job-stats-" + days + "d",
                    WarehouseQueries.dailyJobStats(schema, table), days);
            subJobs.put("job-stats-" + days + "d",
                    () -> stats.join().map(warehouseTransformer::dailyJobStats));

            warehouseProperties.getQueueGroups().forEach((group, queues) -> {
                String key = group + "-wait-time-" + days + "d";
                if (waitColumn.isFailure()) {
                    subJobs.put(key, () -> waitColumn);
                    return;
                }
                List<Object> args = new ArrayList<>(queues.size() + 1);
                args.add(days);
                args.addAll(queues);
                var waits = warehouse.query(key,
                        WarehouseQueries.queueWaitTime(schema, table, waitColumn.getValue(), queues.size()),
                        args.toArray());
                subJobs.put(key, () -> waits.join().map(warehouseTransformer::queueWaitTimes));
            });
        }

        var monthly = warehouse.query("monthly-gpu-hours", WarehouseQueries.monthlyGpuHours(schema, table));
        subJobs.put("monthly-gpu-hours", () -> monthly.join().map(warehouseTransformer::monthlyGpuHours));
    }

    private void analyticsSubJobs(Map<String, Supplier<FetchResult<?>>> subJobs, Instant now) {
        for (String range : analyticsProperties.getRanges()) {
            LongFunction<String> labels = RangeLabels.general(range, analyticsProperties.getZone());
            QueryWindow window = TimeRanges.general(range).resolve(now);

            var running = metrics.range(MetricQueries.RUNNING_JOBS, window);
            var queued = metrics.range(MetricQueries.QUEUED_JOBS, window);
            subJobs.put("job-analytics-" + range, () -> FetchResult.success(withTotalJobs(RangeSeriesMerger.merge(List.of(
                    new Column("runningJobs", SnapshotPublisher.required(running), RangeSeriesMerger::whole),
                    new Column("queuedJobs", SnapshotPublisher.required(queued), RangeSeriesMerger::whole)), labels))));

            var gpu = metrics.range(MetricQueries.GPU_UTILIZATION, window);
            var memory = metrics.range(MetricQueries.MEMORY_UTILIZATION, window);
            var nodes = metrics.range(MetricQueries.NODE_UTILIZATION, window);
            subJobs.put("resource-analytics-" + range, () -> FetchResult.success(RangeSeriesMerger.merge(List.of(
                    new Column("gpuUtilization", SnapshotPublisher.required(gpu), RangeSeriesMerger::oneDecimal),
                    new Column("memoryUtilization", SnapshotPublisher.required(memory), RangeSeriesMerger::oneDecimal),
                    new Column("nodeUtilization", SnapshotPublisher.required(nodes), RangeSeriesMerger::oneDecimal)),
                    labels)));
        }

        for (String range : analyticsProperties.getOccupationRanges()) {
            LongFunction<String> labels = RangeLabels.general(range, analyticsProperties.getZone());
            QueryWindow window = TimeRanges.general(range).resolve(now);

            Map<String, CompletableFuture<FetchResult<List<MetricSeries>>>> groups = new LinkedHashMap<>();
            analyticsProperties.getGpuGroups().forEach((group, selector) ->
                    groups.put(group, metrics.range(MetricQueries.gpuOccupation(selector), window)));
            subJobs.put("gpu-occupation-" + range, () -> {
                List<Column> columns = new ArrayList<>(groups.size());
                groups.forEach((group, pending) ->
                        columns.add(new Column(group, SnapshotPublisher.required(pending), RangeSeriesMerger::oneDecimal)));
                return FetchResult.success(RangeSeriesMerger.merge(columns, labels));
            });
        }

        for (String range : analyticsProperties.getPowerRanges()) {
            LongFunction<String> labels = RangeLabels.power(range, analyticsProperties.getZone());
            var total = metrics.range(MetricQueries.TOTAL_POWER_WATTS, TimeRanges.power(range).resolve(now));
            subJobs.put("power-history-" + range, () -> FetchResult.success(RangeSeriesMerger.merge(List.of(
                    new Column("total", SnapshotPublisher.required(total), RangeSeriesMerger::rounded)), labels)));
        }
    }

    private static List<Map<String, Object>> withTotalJobs(List<Map<String, Object>> rows) {
        for (Map<String, Object> row : rows) {
            long running = ((Number) row.get("runningJobs")).longValue();
            long queued = ((Number) row.get("queuedJobs")).longValue();
            row.put("totalJobs", running + queued);
        }
        return rows;
    }
}
