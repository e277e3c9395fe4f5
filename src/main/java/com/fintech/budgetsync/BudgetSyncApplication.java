package com.fintech.budgetsync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Budget Sync Service
 * <p>
 * Keeps remote-hosted budgets up to date with the bank: on a cron schedule it
 * downloads each configured budget, runs bank sync, re-applies account
 * balances so they are pushed, and syncs the result back to the server.
 * <p>
 * Key Features:
 * - Cron scheduling with timezone support and optional run on start
 * - Per-budget isolation with session reset and cache eviction between attempts
 * - Encrypted budgets via positional encryption passwords
 * - Metrics and structured logging
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class BudgetSyncApplication {

    public static void main(String[] args) {
        // Errors escaping any thread are logged, never fatal
        Thread.setDefaultUncaughtExceptionHandler((thread, e) ->
                log.error("Uncaught exception in thread {}", thread.getName(), e));

        SpringApplication.run(BudgetSyncApplication.class, args);
    }
}
