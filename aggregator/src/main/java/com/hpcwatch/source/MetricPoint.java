package com.hpcwatch.source;

public record MetricPoint(long epochSecond, String rawValue) {
}
