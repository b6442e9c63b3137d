package com.hpcwatch.model;

import java.math.BigDecimal;

public record DailyJobStats(String jobDate, long numJobs, BigDecimal totalGpuHours) {}
