package com.hpcwatch.model;

import lombok.Value;

import java.util.List;

@Value
public class HardwareStatusSnapshot {

    List<NodeHealth> nodes;
    StatusSummary summary;

    public static HardwareStatusSnapshot of(List<NodeHealth> nodes) {
        return new HardwareStatusSnapshot(List.copyOf(nodes), StatusSummary.of(nodes));
    }
}
