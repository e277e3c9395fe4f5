package com.fintech.budgetsync.scheduler;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import com.fintech.budgetsync.config.BudgetSyncProperties;
import com.fintech.budgetsync.dto.CycleReport;
import com.fintech.budgetsync.exception.CycleAlreadyRunningException;
import com.fintech.budgetsync.service.BudgetSyncOrchestrator;
import com.fintech.budgetsync.service.SessionManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs a sync cycle on the configured cron schedule.
 * <p>
 * The schedule accepts the classic five-field form (minute resolution) as
 * well as Spring's six-field form. A failed cycle never stops the schedule:
 * the error is logged, the ledger API is shut down, and the next run happens
 * at the next fire time.
 * <p>
 * Default: 01:00 every day, UTC
 */
@Component
@Slf4j
public class SyncScheduler {

    private static final String MDC_CYCLE_ID = "cycleId";

    private static final CronParser CRON_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
    private static final CronDescriptor CRON_DESCRIPTOR = CronDescriptor.instance(Locale.UK);

    private final BudgetSyncOrchestrator orchestrator;
    private final SessionManager sessionManager;
    private final TaskScheduler taskScheduler;
    private final BudgetSyncProperties properties;

    private SyncCronJob cronJob;

    public SyncScheduler(BudgetSyncOrchestrator orchestrator,
                         SessionManager sessionManager,
                         @Qualifier("syncTaskScheduler") TaskScheduler taskScheduler,
                         BudgetSyncProperties properties) {
        this.orchestrator = orchestrator;
        this.sessionManager = sessionManager;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    /**
     * Starts the cron job once the application is ready. An unusable data
     * directory is fatal here, before anything is scheduled.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Scheduler is disabled, no sync cycles will run");
            return;
        }

        sessionManager.prepareDataDirectory(properties.dataDirectory());

        cronJob = createCronJob();
        cronJob.start();
    }

    SyncCronJob createCronJob() {
        String cron = toSpringCron(properties.getCronSchedule());
        ZoneId zone = ZoneId.of(properties.getTimezone());
        log.info("Scheduling sync for {} budgets to run {} ({})",
                orchestrator.getTargets().size(), describeSchedule(cron), zone);
        return new SyncCronJob(cron, zone, taskScheduler, this::onTick, properties.isRunOnStart());
    }

    /**
     * One scheduled run. Never throws.
     */
    public void onTick() {
        MDC.put(MDC_CYCLE_ID, "CYCLE-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            CycleReport report = orchestrator.runCycle();
            log.info("Sync cycle finished: {} budgets synced in {}ms",
                    report.getSucceededTargets(), report.getDurationMs());
        } catch (CycleAlreadyRunningException e) {
            log.warn("Sync cycle skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Sync cycle failed", e);
            sessionManager.emergencyShutdown();
            log.info("Emergency shutdown complete");
        } finally {
            if (cronJob != null) {
                cronJob.nextFireTime().ifPresent(next -> log.info("Next run is {}", next));
            }
            MDC.remove(MDC_CYCLE_ID);
        }
    }

    /**
     * Converts a cron expression to Spring's six-field form. Five fields get a
     * leading seconds field of {@code 0}; six fields and {@code @} macros are
     * returned unchanged.
     *
     * @throws IllegalArgumentException for any other number of fields
     */
    public static String toSpringCron(String expression) {
        String trimmed = expression == null ? "" : expression.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            return String.join(" ", fields);
        }
        throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: '" + expression + "'");
    }

    /**
     * Human-readable form of a six-field cron expression, for logging.
     * Falls back to the expression itself when it cannot be described.
     */
    public static String describeSchedule(String springCron) {
        try {
            return CRON_DESCRIPTOR.describe(CRON_PARSER.parse(springCron));
        } catch (RuntimeException e) {
            log.debug("Unable to describe cron expression '{}': {}", springCron, e.getMessage());
            return springCron;
        }
    }

    SyncCronJob getCronJob() {
        return cronJob;
    }

    @PreDestroy
    public void stop() {
        if (cronJob != null) {
            cronJob.stop();
        }
    }
}
