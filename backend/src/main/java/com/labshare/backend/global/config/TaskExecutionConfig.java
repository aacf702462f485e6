package com.labshare.backend.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Background housekeeping runs off the request thread on a small bounded pool.
 */
@Configuration
@EnableScheduling
public class TaskExecutionConfig {

    public static final String AUTH_CLEANUP_EXECUTOR = "authCleanupExecutor";

    @Bean(name = AUTH_CLEANUP_EXECUTOR)
    public ThreadPoolTaskExecutor authCleanupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        // one pending run is enough; extra triggers are dropped by the throttle anyway
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("auth-cleanup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
