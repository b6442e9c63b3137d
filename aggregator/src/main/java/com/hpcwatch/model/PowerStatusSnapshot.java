package com.hpcwatch.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class PowerStatusSnapshot {

    List<NodePower> nodes;
    long total;
    Instant timestamp;

    public static PowerStatusSnapshot of(List<NodePower> nodes, Instant timestamp) {
        long total = nodes.stream().mapToLong(NodePower::watts).sum();
        return new PowerStatusSnapshot(List.copyOf(nodes), total, timestamp);
    }
}
