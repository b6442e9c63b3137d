package com.hpcwatch.scheduler;

import com.hpcwatch.scheduler.SchedulerConfig.JobProperties;
import com.hpcwatch.scheduler.SchedulerConfig.JobSettings;
import com.hpcwatch.source.FetchFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives every registered {@link RefreshJob} on its own interval.
 * <p>
 * A fixed-delay tick checks which jobs are due and hands them to the job executor. A job that is
 * still running when it becomes due again is skipped for that tick rather than started twice.
 * Exceptions never leave a job run; the job returns to idle and is retried on its next interval.
 */
@Slf4j
@Component
public class RefreshScheduler {

    private final List<ScheduledJob> jobs;
    private final ExecutorService jobExecutor;
    private final Clock clock;

    public RefreshScheduler(List<RefreshJob> refreshJobs,
                            JobProperties properties,
                            @Qualifier("jobExecutor") ExecutorService jobExecutor,
                            Clock clock) {
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.jobs = new ArrayList<>();

        for (RefreshJob job : refreshJobs) {
            JobSettings settings = properties.getJobs().get(job.name());
            if (settings != null && !settings.isEnabled()) {
                log.info("Job {} is disabled", job.name());
                continue;
            }
            Duration interval = Optional.ofNullable(settings)
                    .map(JobSettings::getInterval)
                    .orElse(job.defaultInterval());
            jobs.add(new ScheduledJob(job, interval));
            log.info("Registered job {} every {}", job.name(), interval);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        log.info("Warm-up: running {} jobs once before the first tick", jobs.size());
        triggerAll();
    }

    @Scheduled(initialDelayString = "${hpcwatch.scheduler.tick-millis:1000}",
            fixedDelayString = "${hpcwatch.scheduler.tick-millis:1000}")
    public void tick() {
        Instant now = clock.instant();
        for (ScheduledJob job : jobs) {
            if (job.isDue(now)) {
                start(job, now, true);
            }
        }
    }

    public List<String> triggerAll() {
        Instant now = clock.instant();
        List<String> started = new ArrayList<>();
        for (ScheduledJob job : jobs) {
            if (start(job, now, false)) {
                started.add(job.name());
            }
        }
        return started;
    }

    public List<JobStatus> statuses() {
        return jobs.stream().map(ScheduledJob::status).toList();
    }

    private boolean start(ScheduledJob job, Instant now, boolean scheduled) {
        if (!job.tryStart(now, scheduled)) {
            log.debug("Job {} still running, not starting it again", job.name());
            return false;
        }
        try {
            jobExecutor.execute(() -> run(job));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Job {} rejected by executor: {}", job.name(), e.getMessage());
            job.finish(clock.instant(), JobOutcome.FAILED);
            return false;
        }
    }

    private void run(ScheduledJob job) {
        JobOutcome outcome = JobOutcome.FAILED;
        long startNanos = System.nanoTime();
        try {
            RefreshReport report = job.job().refresh();
            outcome = report.outcome();
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            if (outcome == JobOutcome.SUCCEEDED) {
                log.info("Job {} finished in {}ms: {} keys written", job.name(), elapsedMs, report.written().size());
            } else {
                log.warn("Job {} finished in {}ms with {}: written={}, failed={}",
                        job.name(), elapsedMs, outcome, report.written(), report.failed());
            }
        } catch (FetchFailedException e) {
            log.warn("Job {} aborted: {}", job.name(), e.getError());
        } catch (Exception e) {
            log.error("Job {} failed", job.name(), e);
        } finally {
            job.finish(clock.instant(), outcome);
        }
    }
}
