package com.hpcwatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ClusterStats {

    long totalNodes;
    long busyNodes;
    long freeNodes;
    long downNodes;
    long totalJobs;
    long runningJobs;
    long queuedJobs;
    long totalGpus;
    long usedGpus;
    double gpuUtilization;
}
