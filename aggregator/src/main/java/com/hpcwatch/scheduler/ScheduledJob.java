package com.hpcwatch.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduling state of one {@link RefreshJob}. The only way into {@link JobState#RUNNING} is
 * {@link #tryStart(Instant, boolean)}, which succeeds for at most one caller until {@link #finish} runs.
 */
public class ScheduledJob {

    private final RefreshJob job;
    private final Duration interval;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
    private final AtomicLong runs = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong missedIntervals = new AtomicLong();

    private volatile Instant lastStarted;
    private volatile Instant lastFinished;
    private volatile JobOutcome lastOutcome;
    private volatile Instant lastMissCounted;

    public ScheduledJob(RefreshJob job, Duration interval) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Negative interval for job " + job.name() + ": " + interval);
        }
        this.job = job;
        this.interval = interval;
    }

    public String name() {
        return job.name();
    }

    public RefreshJob job() {
        return job;
    }

    public Duration interval() {
        return interval;
    }

    public JobState state() {
        return state.get();
    }

    public boolean isDue(Instant now) {
        Instant started = lastStarted;
        return started == null || !now.isBefore(started.plus(interval));
    }

    boolean tryStart(Instant now, boolean scheduled) {
        if (!state.compareAndSet(JobState.IDLE, JobState.RUNNING)) {
            if (scheduled) {
                recordMiss(now);
            }
            return false;
        }
        lastStarted = now;
        lastMissCounted = null;
        runs.incrementAndGet();
        return true;
    }

    private synchronized void recordMiss(Instant now) {
        Instant last = lastMissCounted;
        if (last == null || !now.isBefore(last.plus(interval))) {
            lastMissCounted = now;
            missedIntervals.incrementAndGet();
        }
    }

    void finish(Instant now, JobOutcome outcome) {
        lastFinished = now;
        lastOutcome = outcome;
        if (outcome == JobOutcome.FAILED) {
            failures.incrementAndGet();
        }
        state.set(JobState.IDLE);
    }

    public JobStatus status() {
        return new JobStatus(job.name(), interval.toString(), state.get(), lastStarted, lastFinished,
                lastOutcome, runs.get(), failures.get(), missedIntervals.get());
    }
}
