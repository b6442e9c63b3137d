package com.hpcwatch.scheduler;

import java.time.Duration;

public interface RefreshJob {

    String name();

    Duration defaultInterval();

    RefreshReport refresh() throws Exception;
}
