package com.hpcwatch.refresh;

import com.hpcwatch.model.JobsSummary;
import com.hpcwatch.scheduler.RefreshJob;
import com.hpcwatch.scheduler.RefreshReport;
import com.hpcwatch.source.FetchResult;
import com.hpcwatch.source.MetricSeries;
import com.hpcwatch.source.MetricsSourceAdapter;
import com.hpcwatch.transform.ClusterTransformer;
import com.hpcwatch.transform.ClusterTransformer.NodeCounts;
import com.hpcwatch.transform.MetricValues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class ClusterOverviewJob implements RefreshJob {

    static final String STATS_KEY = "cluster-stats";
    static final String SUMMARY_KEY = "jobs-summary";
    static final String NODES_KEY = "nodes";

    private final MetricsSourceAdapter metrics;
    private final ClusterTransformer transformer;
    private final SnapshotPublisher publisher;

    @Override
    public String name() {
        return "cluster-overview";
    }

    @Override
    public Duration defaultInterval() {
        return Duration.ofMinutes(1);
    }

    @Override
    public RefreshReport refresh() {
        CompletableFuture<FetchResult<List<MetricSeries>>> running = metrics.instant(MetricQueries.RUNNING_JOBS);
        CompletableFuture<FetchResult<List<MetricSeries>>> queued = metrics.instant(MetricQueries.QUEUED_JOBS);
        CompletableFuture<FetchResult<List<MetricSeries>>> held = metrics.instant(MetricQueries.HELD_JOBS);
        CompletableFuture<FetchResult<List<MetricSeries>>> free = metrics.instant(MetricQueries.NODES_FREE);
        CompletableFuture<FetchResult<List<MetricSeries>>> busy = metrics.instant(MetricQueries.NODES_BUSY);
        CompletableFuture<FetchResult<List<MetricSeries>>> offline = metrics.instant(MetricQueries.NODES_OFFLINE);
        CompletableFuture<FetchResult<List<MetricSeries>>> down = metrics.instant(MetricQueries.NODES_DOWN);
        CompletableFuture<FetchResult<List<MetricSeries>>> gpusTotal = metrics.instant(MetricQueries.GPUS_TOTAL);
        CompletableFuture<FetchResult<List<MetricSeries>>> gpusUsed = metrics.instant(MetricQueries.GPUS_USED);
        CompletableFuture<FetchResult<List<MetricSeries>>> byUser = metrics.instant(MetricQueries.RUNNING_JOBS_BY_USER);
        CompletableFuture<FetchResult<List<MetricSeries>>> runningByQueue = metrics.instant(MetricQueries.RUNNING_JOBS_BY_QUEUE);
        CompletableFuture<FetchResult<List<MetricSeries>>> queuedByQueue = metrics.instant(MetricQueries.QUEUED_JOBS_BY_QUEUE);
        CompletableFuture<FetchResult<List<MetricSeries>>> nodeStates = metrics.instant(MetricQueries.NODE_STATE);
        CompletableFuture<FetchResult<List<MetricSeries>>> nodeGpusTotal = metrics.instant(MetricQueries.NODE_GPUS_TOTAL);
        CompletableFuture<FetchResult<List<MetricSeries>>> nodeGpusUsed = metrics.instant(MetricQueries.NODE_GPUS_USED);
        CompletableFuture<FetchResult<List<MetricSeries>>> nodeMemTotal = metrics.instant(MetricQueries.NODE_MEM_TOTAL);
        CompletableFuture<FetchResult<List<MetricSeries>>> nodeMemUsed = metrics.instant(MetricQueries.NODE_MEM_USED);
        CompletableFuture<FetchResult<List<MetricSeries>>> nodeJobs = metrics.instant(MetricQueries.NODE_JOBS);

        var stats = publisher.publish(STATS_KEY, () -> {
            JobsSummary.Totals totals = totals(running, queued, held);
            NodeCounts nodes = NodeCounts.of(
                    SnapshotPublisher.required(free),
                    SnapshotPublisher.required(busy),
                    SnapshotPublisher.required(offline),
                    SnapshotPublisher.required(down));
            long totalGpus = MetricValues.scalar(SnapshotPublisher.required(gpusTotal));
            long usedGpus = MetricValues.scalar(SnapshotPublisher.required(gpusUsed));
            return FetchResult.success(transformer.clusterStats(totals, nodes, totalGpus, usedGpus));
        });

        var summary = publisher.publish(SUMMARY_KEY, () -> FetchResult.success(JobsSummary.builder()
                .summary(totals(running, queued, held))
                .byUser(transformer.jobsByUser(SnapshotPublisher.optional("Jobs by user", byUser)))
                .byQueue(transformer.jobsByQueue(
                        SnapshotPublisher.optional("Running jobs by queue", runningByQueue),
                        SnapshotPublisher.optional("Queued jobs by queue", queuedByQueue)))
                .build()));

        var nodeTable = publisher.publish(NODES_KEY, () -> FetchResult.success(transformer.nodeDetails(
                SnapshotPublisher.required(nodeStates),
                SnapshotPublisher.required(nodeGpusTotal),
                SnapshotPublisher.required(nodeGpusUsed),
                SnapshotPublisher.required(nodeMemTotal),
                SnapshotPublisher.required(nodeMemUsed),
                SnapshotPublisher.optional("Jobs per node", nodeJobs))));

        return RefreshReport.of(List.of(stats, summary, nodeTable));
    }

    private JobsSummary.Totals totals(CompletableFuture<FetchResult<List<MetricSeries>>> running,
                                      CompletableFuture<FetchResult<List<MetricSeries>>> queued,
                                      CompletableFuture<FetchResult<List<MetricSeries>>> held) {
        return transformer.jobTotals(
                SnapshotPublisher.required(running),
                SnapshotPublisher.required(queued),
                SnapshotPublisher.required(held));
    }
}
