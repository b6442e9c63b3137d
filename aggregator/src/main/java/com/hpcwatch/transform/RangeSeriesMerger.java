package com.hpcwatch.transform;

import com.hpcwatch.source.MetricPoint;
import com.hpcwatch.source.MetricSeries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.DoubleFunction;
import java.util.function.LongFunction;

/**
 * Joins several single-series range results into chart rows keyed by timestamp label.
 * <p>
 * The first column drives the row set; later columns only fill rows the first one produced and
 * default to zero elsewhere. Points whose labels collide collapse into one row, the later point
 * winning.
 */
public final class RangeSeriesMerger {

    private RangeSeriesMerger() {
    }

    public static List<Map<String, Object>> merge(List<Column> columns, LongFunction<String> label) {
        if (columns.isEmpty()) {
            return List.of();
        }

        Map<String, Map<String, Object>> rows = new LinkedHashMap<>();
        Column driver = columns.get(0);
        for (MetricPoint point : points(driver.result())) {
            String time = label.apply(point.epochSecond());
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", time);
            row.put(driver.name(), driver.convert(point));
            for (Column other : columns.subList(1, columns.size())) {
                row.put(other.name(), other.convert(0));
            }
            rows.put(time, row);
        }

        for (Column column : columns.subList(1, columns.size())) {
            for (MetricPoint point : points(column.result())) {
                Map<String, Object> row = rows.get(label.apply(point.epochSecond()));
                if (row != null) {
                    row.put(column.name(), column.convert(point));
                }
            }
        }
        return new ArrayList<>(rows.values());
    }

    private static List<MetricPoint> points(List<MetricSeries> result) {
        return result.isEmpty() ? List.of() : result.get(0).points();
    }

    public record Column(String name, List<MetricSeries> result, DoubleFunction<Object> converter) {

        Object convert(MetricPoint point) {
            OptionalDouble value = MetricValues.parseDouble(point.rawValue());
            return convert(value.orElse(0));
        }

        Object convert(double value) {
            return converter.apply(value);
        }
    }

    public static Object whole(double value) {
        return (long) value;
    }

    public static Object rounded(double value) {
        return Math.round(value);
    }

    public static Object oneDecimal(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
