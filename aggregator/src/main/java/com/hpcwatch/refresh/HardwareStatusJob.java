package com.hpcwatch.refresh;

import com.hpcwatch.history.HealthHistoryMerger;
import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.HealthSample;
import com.hpcwatch.scheduler.RefreshJob;
import com.hpcwatch.scheduler.RefreshReport;
import com.hpcwatch.source.FetchResult;
import com.hpcwatch.source.MetricSeries;
import com.hpcwatch.source.MetricsSourceAdapter;
import com.hpcwatch.transform.HealthTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Health status and uptime per node, damped over the last few cycles.
 * <p>
 * A failed status query abandons the cycle without touching the history. A failed uptime query
 * only means no fresh uptime this cycle; the last known values keep being shown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HardwareStatusJob implements RefreshJob {

    static final String KEY = "hardware-status";

    private final MetricsSourceAdapter metrics;
    private final HealthTransformer transformer;
    private final HealthHistoryMerger merger;
    private final SnapshotPublisher publisher;
    private final EntityUniverse universe;
    private final Clock clock;

    @Override
    public String name() {
        return "hardware-status";
    }

    @Override
    public Duration defaultInterval() {
        return Duration.ofMinutes(3);
    }

    @Override
    public RefreshReport refresh() {
        CompletableFuture<FetchResult<List<MetricSeries>>> status = metrics.instant(MetricQueries.SYSTEM_STATUS);
        CompletableFuture<FetchResult<List<MetricSeries>>> uptime = metrics.instant(MetricQueries.POWER_UPTIME);

        List<MetricSeries> statusRows = SnapshotPublisher.required(status);
        List<MetricSeries> uptimeRows = SnapshotPublisher.optional("Uptime", uptime);

        Instant observedAt = clock.instant();
        Map<String, HealthSample> samples = transformer.transform(statusRows, uptimeRows, universe, observedAt);
        merger.ingest(samples);
        log.debug("Ingested {} health samples ({} status series, {} uptime series)",
                samples.size(), statusRows.size(), uptimeRows.size());

        return RefreshReport.of(List.of(publisher.write(KEY, merger.merged())));
    }
}
