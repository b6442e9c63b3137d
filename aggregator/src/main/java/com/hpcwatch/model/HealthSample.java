package com.hpcwatch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HealthSample {

    String entityId;
    Instant observedAt;
    HealthStatus status;
    String statusLabel;
    int statusValue;
    long uptimeSeconds;

    public static HealthSample of(String entityId, Instant observedAt, HealthStatus status, long uptimeSeconds) {
        return HealthSample.builder()
                .entityId(entityId)
                .observedAt(observedAt)
                .status(status)
                .statusLabel(status.label())
                .statusValue(status.code())
                .uptimeSeconds(uptimeSeconds)
                .build();
    }

    public static HealthSample noData(String entityId, Instant observedAt, long uptimeSeconds) {
        return HealthSample.builder()
                .entityId(entityId)
                .observedAt(observedAt)
                .status(HealthStatus.UNKNOWN)
                .statusLabel(HealthStatus.NO_DATA_LABEL)
                .statusValue(HealthStatus.NO_DATA_CODE)
                .uptimeSeconds(uptimeSeconds)
                .build();
    }

    public boolean isKnown() {
        return status.isKnown();
    }
}
