package com.hpcwatch.transform;

import com.hpcwatch.source.MetricPoint;
import com.hpcwatch.source.MetricSeries;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

public final class MetricValues {

    private MetricValues() {
    }

    public static OptionalDouble parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static OptionalLong parseLong(String raw) {
        OptionalDouble value = parseDouble(raw);
        return value.isPresent() ? OptionalLong.of((long) value.getAsDouble()) : OptionalLong.empty();
    }

    public static OptionalLong latestLong(MetricSeries series) {
        return series.latest().map(MetricPoint::rawValue).map(MetricValues::parseLong).orElse(OptionalLong.empty());
    }

    public static long scalar(List<MetricSeries> result) {
        return firstSeries(result).map(MetricValues::latestLong).orElse(OptionalLong.empty()).orElse(0L);
    }

    private static Optional<MetricSeries> firstSeries(List<MetricSeries> result) {
        return result.isEmpty() ? Optional.empty() : Optional.of(result.get(0));
    }
}
