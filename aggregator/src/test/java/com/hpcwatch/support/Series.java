package com.hpcwatch.support;

import com.hpcwatch.source.MetricPoint;
import com.hpcwatch.source.MetricSeries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for metric series in tests.
 */
public final class Series {

    private Series() {
    }

    public static MetricSeries instant(String label, String labelValue, String value) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(label, labelValue);
        return new MetricSeries(labels, List.of(new MetricPoint(1_700_000_000L, value)));
    }

    public static MetricSeries scalar(String value) {
        return new MetricSeries(Map.of(), List.of(new MetricPoint(1_700_000_000L, value)));
    }

    /** One unlabelled series with a point every {@code stepSeconds} starting at {@code start}. */
    public static MetricSeries range(long start, long stepSeconds, String... values) {
        List<MetricPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(start + i * stepSeconds, values[i]));
        }
        return new MetricSeries(Map.of(), points);
    }
}
