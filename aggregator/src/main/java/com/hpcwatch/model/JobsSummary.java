package com.hpcwatch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class JobsSummary {

    Totals summary;
    List<UserJobCount> byUser;
    List<QueueJobCount> byQueue;

    public record Totals(long total, long running, long queued, long hold) {}

    public record UserJobCount(String user, long count) {}

    public record QueueJobCount(String queue, long count, long running, long queued) {}
}
