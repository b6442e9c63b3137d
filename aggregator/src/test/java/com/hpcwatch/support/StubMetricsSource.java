package com.hpcwatch.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hpcwatch.config.SourceConfig.MetricsProperties;
import com.hpcwatch.source.FetchError;
import com.hpcwatch.source.FetchResult;
import com.hpcwatch.source.MetricSeries;
import com.hpcwatch.source.MetricsSourceAdapter;
import com.hpcwatch.source.TimeRanges.QueryWindow;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory metrics source. Unknown queries answer with an empty result.
 */
public class StubMetricsSource extends MetricsSourceAdapter {

    private final Map<String, List<MetricSeries>> instantResults = new ConcurrentHashMap<>();
    private final Map<String, List<MetricSeries>> rangeResults = new ConcurrentHashMap<>();
    private final Map<String, FetchError> failures = new ConcurrentHashMap<>();
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final List<QueryWindow> windows = new CopyOnWriteArrayList<>();

    public StubMetricsSource() {
        super(new MetricsProperties(), new ObjectMapper());
    }

    public StubMetricsSource givenInstant(String query, MetricSeries... series) {
        instantResults.put(query, List.of(series));
        return this;
    }

    public StubMetricsSource givenRange(String query, MetricSeries... series) {
        rangeResults.put(query, List.of(series));
        return this;
    }

    public StubMetricsSource failing(String query) {
        failures.put(query, FetchError.rejected(query, "HTTP 503"));
        return this;
    }

    public StubMetricsSource recover(String query) {
        failures.remove(query);
        return this;
    }

    public List<String> queries() {
        return queries;
    }

    public List<QueryWindow> windows() {
        return windows;
    }

    @Override
    public CompletableFuture<FetchResult<List<MetricSeries>>> instant(String query) {
        queries.add(query);
        return CompletableFuture.completedFuture(answer(query, instantResults));
    }

    @Override
    public CompletableFuture<FetchResult<List<MetricSeries>>> range(String query, QueryWindow window) {
        queries.add(query);
        windows.add(window);
        return CompletableFuture.completedFuture(answer(query, rangeResults));
    }

    private FetchResult<List<MetricSeries>> answer(String query, Map<String, List<MetricSeries>> results) {
        FetchError error = failures.get(query);
        if (error != null) {
            return FetchResult.failure(error);
        }
        return FetchResult.success(results.getOrDefault(query, List.of()));
    }
}
