package com.hpcwatch.source;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record MetricSeries(Map<String, String> labels, List<MetricPoint> points) {

    public MetricSeries {
        labels = Map.copyOf(labels);
        points = List.copyOf(points);
    }

    public Optional<String> label(String name) {
        return Optional.ofNullable(labels.get(name));
    }

    public Optional<MetricPoint> latest() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
    }
}
