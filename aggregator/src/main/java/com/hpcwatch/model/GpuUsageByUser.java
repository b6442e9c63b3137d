package com.hpcwatch.model;

import java.math.BigDecimal;

public record GpuUsageByUser(
        String username,
        long numJobs,
        long totalGpusUsed,
        BigDecimal avgGpusPerJob,
        BigDecimal totalGpuHours,
        BigDecimal avgGpuHoursPerJob
) {}
