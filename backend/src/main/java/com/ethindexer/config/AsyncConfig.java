package com.ethindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. The sync engine is the only writer of ethtxs, so its pool has exactly one thread.
 */
@Configuration
public class AsyncConfig {

    public static final String SYNC_EXECUTOR = "sync-executor";

    /** Shutdown interrupts the running loop; the engine exits between blocks or out of its sleep. */
    @Bean(name = SYNC_EXECUTOR)
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("sync-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
