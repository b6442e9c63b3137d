package com.hpcwatch.scheduler;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    @ConfigurationProperties(prefix = "hpcwatch")
    public JobProperties jobProperties() {
        return new JobProperties();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor(@Value("${hpcwatch.scheduler.threads:4}") int threads) {
        log.info("Job executor initialized with {} threads", threads);
        return Executors.newFixedThreadPool(threads, namedThreads("refresh-"));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Data
    public static class JobProperties {
        private Map<String, JobSettings> jobs = new LinkedHashMap<>();
    }

    @Data
    public static class JobSettings {
        private Duration interval;
        private boolean enabled = true;
    }
}
