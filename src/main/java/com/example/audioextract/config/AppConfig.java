package com.example.audioextract.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Application configuration.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Configures the pool that runs engine calls, one thread per scheduler slot.
     *
     * @param maxConcurrentJobs Concurrency bound of the scheduler
     * @param queueCapacity Executor queue capacity
     * @return Executor for conversions
     */
    @Bean(name = "conversionExecutor")
    public ThreadPoolTaskExecutor conversionExecutor(
            @Value("${conversion.max-concurrent-jobs:3}") int maxConcurrentJobs,
            @Value("${conversion.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrentJobs);
        executor.setMaxPoolSize(maxConcurrentJobs);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ConversionTask-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Configures the scheduler that arms per-job timeout watchdogs.
     *
     * @return Scheduler for watchdogs
     */
    @Bean(name = "watchdogScheduler")
    public ThreadPoolTaskScheduler watchdogScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setThreadNamePrefix("ConversionWatchdog-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Configures the scheduler for delayed file cleanups.
     *
     * @return Scheduler for cleanups
     */
    @Bean(name = "cleanupScheduler")
    public ThreadPoolTaskScheduler cleanupScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setThreadNamePrefix("FileCleanup-");
        scheduler.initialize();
        return scheduler;
    }
}
