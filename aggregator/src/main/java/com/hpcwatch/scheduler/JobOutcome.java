package com.hpcwatch.scheduler;

public enum JobOutcome {
    SUCCEEDED,
    PARTIAL,
    FAILED
}
