package com.chainfeed.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Named thread pools: snapshot-executor runs one backfill worker per topic, live-executor runs the live
 * loop and heartbeat probes of each subscriber, heartbeat-scheduler fires heartbeat watchdogs.
 */
@Configuration
public class AsyncConfig {

    public static final String SNAPSHOT_EXECUTOR = "snapshot-executor";
    public static final String LIVE_EXECUTOR = "live-executor";
    public static final String HEARTBEAT_SCHEDULER = "heartbeat-scheduler";

    @Bean(name = SNAPSHOT_EXECUTOR)
    public Executor snapshotExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setThreadNamePrefix("snapshot-");
        e.initialize();
        return e;
    }

    /** Two long-running tasks per live subscriber, so core size bounds concurrent subscribers. */
    @Bean(name = LIVE_EXECUTOR)
    public Executor liveExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("live-");
        e.initialize();
        return e;
    }

    @Bean(name = HEARTBEAT_SCHEDULER, destroyMethod = "shutdownNow")
    public ScheduledExecutorService heartbeatScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("heartbeat-"));
    }
}
