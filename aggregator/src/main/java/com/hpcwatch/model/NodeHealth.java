package com.hpcwatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NodeHealth {

    String node;
    HealthStatus status;
    String statusLabel;
    int statusValue;
    long uptimeSeconds;
    String uptimeFormatted;
}
