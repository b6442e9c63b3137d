package com.hpcwatch.model;

public record NodeDetail(
        String id,
        String name,
        NodeState state,
        long totalGpus,
        long usedGpus,
        String totalMemory,
        String usedMemory,
        long jobCount
) {}
