package com.volovo.tracksync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for syncing devices side by side when
 * {@code tracksync.sync.parallelism} is above 1.
 *
 * - Core = max: one thread per concurrently synced device
 * - Queue: unbounded by device count, a run never has more tasks than devices
 * - CallerRunsPolicy: if the pool is shut down mid-run, the caller syncs the device itself
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "syncTaskExecutor";

    @Bean(SYNC_EXECUTOR)
    public Executor syncTaskExecutor(TrackSyncProperties properties) {
        int threads = Math.max(1, properties.getSync().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("track-sync-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
