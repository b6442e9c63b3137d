package com.hpcwatch.model;

import java.math.BigDecimal;

public record MonthlyGpuHours(String month, BigDecimal gpuHours) {}
