package com.hpcwatch.scheduler;

import java.time.Instant;

public record JobStatus(
        String name,
        String interval,
        JobState state,
        Instant lastStarted,
        Instant lastFinished,
        JobOutcome lastOutcome,
        long runs,
        long failures,
        long missedIntervals
) {}
