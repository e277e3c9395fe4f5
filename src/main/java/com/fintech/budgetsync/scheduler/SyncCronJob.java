package com.fintech.budgetsync.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * A cron-triggered job bound to a {@link TaskScheduler}.
 * <p>
 * The trigger computes the next fire time from the completion of the previous
 * run, so on a single-threaded scheduler runs never overlap. Fire times that
 * passed while a run was still going are skipped, not queued.
 */
@Slf4j
public class SyncCronJob {

    private final String cronExpression;
    private final ZoneId zone;
    private final TaskScheduler taskScheduler;
    private final Runnable tick;
    private final boolean runOnStart;

    private ScheduledFuture<?> scheduledFuture;

    /**
     * @param cronExpression six-field Spring cron expression or a macro such as {@code @daily}
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    public SyncCronJob(String cronExpression, ZoneId zone, TaskScheduler taskScheduler,
                       Runnable tick, boolean runOnStart) {
        if (!CronExpression.isValidExpression(cronExpression)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression);
        }
        this.cronExpression = cronExpression;
        this.zone = zone;
        this.taskScheduler = taskScheduler;
        this.tick = tick;
        this.runOnStart = runOnStart;
    }

    public synchronized void start() {
        if (scheduledFuture != null) {
            throw new IllegalStateException("Cron job already started");
        }

        if (runOnStart) {
            log.info("Running sync immediately on start");
            taskScheduler.schedule(tick, Instant.now());
        }

        scheduledFuture = taskScheduler.schedule(tick, new CronTrigger(cronExpression, zone));
        nextFireTime().ifPresent(next -> log.info("Cron job scheduled ({} {}), first run at {}",
                cronExpression, zone, next));
    }

    public synchronized void stop() {
        if (scheduledFuture != null) {
            scheduledFuture.cancel(false);
            scheduledFuture = null;
            log.info("Cron job stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduledFuture != null;
    }

    /**
     * Next time the cron expression matches, counted from now in the job's zone.
     */
    public Optional<ZonedDateTime> nextFireTime() {
        return Optional.ofNullable(CronExpression.parse(cronExpression).next(ZonedDateTime.now(zone)));
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public ZoneId getZone() {
        return zone;
    }
}
