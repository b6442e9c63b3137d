package com.hpcwatch.scheduler;

public enum JobState {
    IDLE,
    RUNNING
}
