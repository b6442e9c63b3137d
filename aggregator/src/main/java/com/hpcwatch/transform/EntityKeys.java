package com.hpcwatch.transform;

import com.hpcwatch.source.MetricSeries;

import java.util.Optional;

public final class EntityKeys {

    private static final String[] HEALTH_LABELS = {"instance", "node", "host"};
    private static final String POWER_LABEL = "source";

    private EntityKeys() {
    }

    public static Optional<String> forHealth(MetricSeries series) {
        for (String label : HEALTH_LABELS) {
            Optional<String> value = series.label(label).filter(v -> !v.isBlank());
            if (value.isPresent()) {
                return value.map(EntityKeys::hostName).filter(v -> !v.isEmpty());
            }
        }
        return Optional.empty();
    }

    public static Optional<String> forPower(MetricSeries series) {
        return series.label(POWER_LABEL).filter(v -> !v.isBlank());
    }

    static String hostName(String target) {
        String host = target;
        int port = host.indexOf(':');
        if (port >= 0) {
            host = host.substring(0, port);
        }
        int domain = host.indexOf('.');
        if (domain >= 0) {
            host = host.substring(0, domain);
        }
        return host;
    }
}
