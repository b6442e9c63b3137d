package com.hpcwatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StatusSummary {

    int ok;
    int warning;
    int critical;
    int nonRecoverable;
    int other;
    int unknown;
    int total;

    public static StatusSummary of(List<NodeHealth> nodes) {
        return StatusSummary.builder()
                .ok(count(nodes, HealthStatus.OK))
                .warning(count(nodes, HealthStatus.WARNING))
                .critical(count(nodes, HealthStatus.CRITICAL))
                .nonRecoverable(count(nodes, HealthStatus.NON_RECOVERABLE))
                .other(count(nodes, HealthStatus.OTHER))
                .unknown(count(nodes, HealthStatus.UNKNOWN))
                .total(nodes.size())
                .build();
    }

    private static int count(List<NodeHealth> nodes, HealthStatus status) {
        return (int) nodes.stream().filter(n -> n.getStatus() == status).count();
    }
}
