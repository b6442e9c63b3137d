package com.hpcwatch.model;

public record QueueWaitTime(
        String date,
        String queueName,
        long numJobs,
        double totalGpuHours,
        double avgGpuHoursPerJob,
        double avgWaitMinutes
) {}
