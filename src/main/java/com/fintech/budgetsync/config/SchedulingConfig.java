package com.fintech.budgetsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Task scheduler that runs sync cycles.
 * <p>
 * A single thread: the cron trigger re-arms only after the previous cycle has
 * returned, so cycles run strictly one after another. Budgets share one
 * stateful ledger session and must never be synced concurrently.
 */
@Configuration
@Slf4j
public class SchedulingConfig {

    @Bean(name = "syncTaskScheduler")
    public ThreadPoolTaskScheduler syncTaskScheduler(BudgetSyncProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("budget-sync-");

        // Last line of defence: log and keep the scheduler alive
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled sync task", t));

        // Let a running cycle finish and close its session on shutdown
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(properties.getScheduler().getShutdownAwaitSeconds());

        log.info("Initialized syncTaskScheduler - poolSize=1, shutdownAwait={}s",
                properties.getScheduler().getShutdownAwaitSeconds());
        return scheduler;
    }
}
