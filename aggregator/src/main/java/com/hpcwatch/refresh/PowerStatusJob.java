package com.hpcwatch.refresh;

import com.hpcwatch.history.PowerHistoryMerger;
import com.hpcwatch.model.EntityUniverse;
import com.hpcwatch.model.PowerSample;
import com.hpcwatch.scheduler.RefreshJob;
import com.hpcwatch.scheduler.RefreshReport;
import com.hpcwatch.source.MetricSeries;
import com.hpcwatch.source.MetricsSourceAdapter;
import com.hpcwatch.transform.PowerTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class PowerStatusJob implements RefreshJob {

    static final String KEY = "power-status";

    private final MetricsSourceAdapter metrics;
    private final PowerTransformer transformer;
    private final PowerHistoryMerger merger;
    private final SnapshotPublisher publisher;
    private final EntityUniverse universe;
    private final Clock clock;

    @Override
    public String name() {
        return "power-status";
    }

    @Override
    public Duration defaultInterval() {
        return Duration.ofMinutes(3);
    }

    @Override
    public RefreshReport refresh() {
        List<MetricSeries> rows = SnapshotPublisher.required(metrics.instant(MetricQueries.POWER_WATTS));

        Instant observedAt = clock.instant();
        Map<String, PowerSample> samples = transformer.transform(rows, universe, observedAt);
        merger.ingest(samples, observedAt);
        log.debug("Ingested {} power samples from {} series", samples.size(), rows.size());

        return RefreshReport.of(List.of(publisher.write(KEY, merger.merged())));
    }
}
