package com.lifecycle.core.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for asynchronous archival and cron-triggered lifecycle runs.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    // ==================== Executor Beans ====================

    /**
     * Executor for archive jobs submitted asynchronously.
     */
    @Bean(name = "lifecycleExecutor")
    public ThreadPoolTaskExecutor lifecycleExecutor() {
        log.info("Initializing lifecycle executor with platform thread pool");
        return createPlatformThreadPool("lifecycle-", 1, 2, 50);
    }

    /**
     * Scheduler backing the archive and cleanup cron registrations.
     */
    @Bean(name = "lifecycleTaskScheduler")
    public ThreadPoolTaskScheduler lifecycleTaskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("lifecycle-cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        log.info("Initializing lifecycle task scheduler");
        return scheduler;
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                            int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
