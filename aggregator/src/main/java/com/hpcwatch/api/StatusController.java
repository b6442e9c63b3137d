package com.hpcwatch.api;

import com.hpcwatch.scheduler.JobStatus;
import com.hpcwatch.scheduler.RefreshScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class StatusController {

    private final RefreshScheduler scheduler;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", clock.instant()));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<JobStatus>> jobs() {
        return ResponseEntity.ok(scheduler.statuses());
    }

    @PostMapping("/jobs/refresh")
    public ResponseEntity<RefreshResponse> refresh() {
        List<String> dispatched = scheduler.triggerAll();
        log.info("Manual refresh dispatched {}", dispatched);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RefreshResponse(dispatched));
    }

    public record HealthResponse(String status, Instant timestamp) {}

    public record RefreshResponse(List<String> dispatched) {}
}
