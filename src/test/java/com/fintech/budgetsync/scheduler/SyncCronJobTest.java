package com.fintech.budgetsync.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs cron jobs on a real single-threaded scheduler.
 */
class SyncCronJobTest {

    private ThreadPoolTaskScheduler taskScheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("cron-test-");
        taskScheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("Should never start a run before the previous one has finished")
    void shouldNotOverlapRuns() throws InterruptedException {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch twoRuns = new CountDownLatch(2);

        Runnable slowTick = () -> {
            int now = running.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(1500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
                twoRuns.countDown();
            }
        };

        // Fires every second, each run takes longer than that
        SyncCronJob job = new SyncCronJob("* * * * * *", ZoneId.of("Etc/UTC"), taskScheduler, slowTick, true);
        job.start();
        try {
            assertThat(twoRuns.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            job.stop();
        }

        assertThat(maxConcurrent.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should run immediately on start when configured")
    void shouldRunOnStart() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        // Far-future schedule, only the immediate run can fire
        SyncCronJob job = new SyncCronJob("0 0 0 1 1 *", ZoneId.of("Etc/UTC"), taskScheduler, ran::countDown, true);
        job.start();
        try {
            assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            job.stop();
        }
    }

    @Test
    @DisplayName("Should compute the next fire time in the configured zone")
    void shouldComputeNextFireTime() {
        ZoneId zone = ZoneId.of("Europe/Berlin");
        SyncCronJob job = new SyncCronJob("0 0 1 * * *", zone, taskScheduler, () -> { }, false);

        ZonedDateTime next = job.nextFireTime().orElseThrow();

        assertThat(next.getZone()).isEqualTo(zone);
        assertThat(next.getHour()).isEqualTo(1);
        assertThat(next.getMinute()).isZero();
        assertThat(next).isAfter(ZonedDateTime.now(zone));
    }

    @Test
    @DisplayName("Should reject a second start and invalid expressions")
    void shouldRejectMisuse() {
        SyncCronJob job = new SyncCronJob("0 0 1 * * *", ZoneId.of("Etc/UTC"), taskScheduler, () -> { }, false);
        job.start();
        try {
            assertThat(job.isRunning()).isTrue();
            assertThatThrownBy(job::start).isInstanceOf(IllegalStateException.class);
        } finally {
            job.stop();
        }
        assertThat(job.isRunning()).isFalse();

        assertThatThrownBy(() -> new SyncCronJob("not a cron", ZoneId.of("Etc/UTC"), taskScheduler, () -> { }, false))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
