package com.fintech.budgetsync.service;

import com.fintech.budgetsync.config.BudgetSyncProperties;
import com.fintech.budgetsync.dto.CycleReport;
import com.fintech.budgetsync.dto.SyncAttemptOutcome;
import com.fintech.budgetsync.dto.SyncTarget;
import com.fintech.budgetsync.exception.BudgetCacheException;
import com.fintech.budgetsync.exception.CycleAlreadyRunningException;
import com.fintech.budgetsync.exception.DataDirectoryException;
import com.fintech.budgetsync.exception.LedgerConnectionException;
import com.fintech.budgetsync.exception.SyncCycleException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives every configured budget through one sync cycle.
 * <p>
 * Per budget: download (or load the cached copy), bank sync, balance
 * reconciliation, push. A failed attempt resets the ledger session, evicts the
 * budget's local cache and tries again, up to {@code budget-sync.max-attempts}.
 * <p>
 * Key Design Decisions:
 * 1. Sequential: budgets share one stateful ledger session, so they are
 *    processed one at a time, end to end
 * 2. Isolation: a budget that exhausts its attempts is recorded and the cycle
 *    moves on; the failure is raised once, after every budget was tried
 * 3. Cleanup: the session opened for the cycle is always closed
 */
@Service
@Slf4j
public class BudgetSyncOrchestrator {

    private static final String MDC_SYNC_ID = "syncId";

    private final SessionManager sessionManager;
    private final BudgetCacheIndex cacheIndex;
    private final BalanceReconciler balanceReconciler;
    private final BudgetSyncProperties properties;
    private final MeterRegistry meterRegistry;
    private final List<SyncTarget> targets;

    // Metrics
    private Counter cycleCounter;
    private Counter budgetSuccessCounter;
    private Counter budgetFailureCounter;
    private Counter retryCounter;
    private Timer cycleTimer;

    // Prevents concurrent cycles
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public BudgetSyncOrchestrator(SessionManager sessionManager,
                                  BudgetCacheIndex cacheIndex,
                                  BalanceReconciler balanceReconciler,
                                  BudgetSyncProperties properties,
                                  MeterRegistry meterRegistry) {
        this.sessionManager = sessionManager;
        this.cacheIndex = cacheIndex;
        this.balanceReconciler = balanceReconciler;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.targets = properties.toSyncTargets();
    }

    @PostConstruct
    public void initMetrics() {
        cycleCounter = Counter.builder("budget.sync.cycles.total")
                .description("Sync cycles started")
                .register(meterRegistry);

        budgetSuccessCounter = Counter.builder("budget.sync.budgets.success")
                .description("Budgets synced successfully")
                .register(meterRegistry);

        budgetFailureCounter = Counter.builder("budget.sync.budgets.failure")
                .description("Budgets that exhausted every attempt")
                .register(meterRegistry);

        retryCounter = Counter.builder("budget.sync.retries")
                .description("Budget sync attempts retried after a session reset")
                .register(meterRegistry);

        cycleTimer = Timer.builder("budget.sync.cycle.duration")
                .description("Time taken to complete a sync cycle")
                .register(meterRegistry);
    }

    /**
     * Runs one cycle over all configured budgets.
     *
     * @return the report of a cycle in which every budget succeeded
     * @throws SyncCycleException           if one or more budgets exhausted their attempts
     * @throws CycleAlreadyRunningException if another cycle is still running
     */
    public CycleReport runCycle() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Sync cycle already in progress, skipping this run");
            throw new CycleAlreadyRunningException();
        }

        try {
            cycleCounter.increment();
            return cycleTimer.record(this::executeCycle);
        } finally {
            isRunning.set(false);
        }
    }

    public boolean isCycleRunning() {
        return isRunning.get();
    }

    public List<SyncTarget> getTargets() {
        return targets;
    }

    private CycleReport executeCycle() {
        CycleReport report = CycleReport.builder()
                .startedAt(LocalDateTime.now())
                .build();
        Path dataDir = properties.dataDirectory();

        log.info("Starting sync cycle for {} budgets", targets.size());

        CycleContext cycle = new CycleContext(openCycleSession(dataDir));
        try {
            refreshCacheIndex(dataDir);

            for (SyncTarget target : targets) {
                syncTarget(cycle, target, dataDir, report);
            }
        } finally {
            sessionManager.close(cycle.session);
            report.setCompletedAt(LocalDateTime.now());
        }

        log.info("Sync cycle completed in {}ms. Budgets: {}, Succeeded: {}, Failed: {}, Attempts: {}",
                report.getDurationMs(),
                targets.size(),
                report.getSucceededTargets(),
                report.getFailedSyncIds().size(),
                report.getTotalAttempts());

        if (report.hasFailures()) {
            throw new SyncCycleException(report);
        }
        return report;
    }

    /**
     * Opens the session for the cycle. A data directory problem ends the
     * cycle here; a connection problem is left to each budget's attempts.
     */
    private LedgerSession openCycleSession(Path dataDir) {
        try {
            return sessionManager.open(dataDir, properties.getServerUrl(), properties.getServerPassword());
        } catch (LedgerConnectionException e) {
            log.warn("Unable to open ledger session, each budget will retry: {}", e.getMessage());
            return null;
        }
    }

    private void refreshCacheIndex(Path dataDir) {
        try {
            cacheIndex.resolve(dataDir);
        } catch (BudgetCacheException e) {
            log.warn("Unable to index cached budgets, every budget will be downloaded: {}", e.getMessage());
        }
    }

    private void syncTarget(CycleContext cycle, SyncTarget target, Path dataDir, CycleReport report) {
        MDC.put(MDC_SYNC_ID, target.getSyncId());
        try {
            TargetSyncState state = TargetSyncState.idle(properties.getMaxAttempts()).begin();

            while (state.isAttempting()) {
                int attempt = state.getAttempt();
                try {
                    if (state.isRetry()) {
                        prepareRetry(cycle, target, dataDir);
                    }
                    runAttempt(cycle, target, dataDir);

                    state = state.succeed();
                    report.recordOutcome(SyncAttemptOutcome.success(target.getSyncId(), attempt));
                } catch (DataDirectoryException e) {
                    // No budget can succeed without the data directory
                    log.error("Data directory became unusable while syncing budget {}", target.getSyncId());
                    throw e;
                } catch (RuntimeException e) {
                    report.recordOutcome(SyncAttemptOutcome.failure(target.getSyncId(), attempt, e));
                    state = state.fail();

                    if (state.isAttempting()) {
                        log.warn("Attempt {}/{} for budget {} failed, resetting session and retrying: {}",
                                attempt, state.getMaxAttempts(), target.getSyncId(), e.getMessage());
                    } else {
                        log.error("Budget {} failed after {} attempts", target.getSyncId(), attempt, e);
                    }
                }
            }

            if (state.getPhase() == TargetSyncState.Phase.SUCCEEDED) {
                report.incrementSucceededTargets();
                budgetSuccessCounter.increment();
                log.info("Budget {} synced on attempt {}", target.getSyncId(), state.getAttempt());
            } else {
                report.addFailedSyncId(target.getSyncId());
                budgetFailureCounter.increment();
            }
        } finally {
            MDC.remove(MDC_SYNC_ID);
        }
    }

    /**
     * Fresh session, and no local copy of the budget, before trying again.
     */
    private void prepareRetry(CycleContext cycle, SyncTarget target, Path dataDir) {
        retryCounter.increment();

        if (cycle.session == null) {
            cycle.session = openSession(dataDir);
        } else {
            cycle.session = sessionManager.reset(cycle.session, dataDir);
        }

        boolean evicted = cacheIndex.invalidate(dataDir, target.getSyncId());
        log.debug("Cache for budget {} evicted before retry: {}", target.getSyncId(), evicted);
    }

    private void runAttempt(CycleContext cycle, SyncTarget target, Path dataDir) {
        if (cycle.session == null || !cycle.session.isOpen()) {
            cycle.session = openSession(dataDir);
        }
        LedgerSession session = cycle.session;

        Optional<String> cachedBudgetId = cacheIndex.findLocalBudgetId(dataDir, target.getSyncId());
        if (cachedBudgetId.isPresent()) {
            log.debug("Budget {} is cached locally as {}", target.getSyncId(), cachedBudgetId.get());
            session.loadBudget(cachedBudgetId.get());
        } else {
            session.downloadBudget(target);
        }

        session.runBankSync();

        if (!balanceReconciler.reconcile(session)) {
            log.warn("Balance reconciliation for budget {} finished with errors, pushing anyway",
                    target.getSyncId());
        }

        session.pushChanges();
    }

    private LedgerSession openSession(Path dataDir) {
        return sessionManager.open(dataDir, properties.getServerUrl(), properties.getServerPassword());
    }

    /**
     * Session slot for one cycle; replaced when a retry resets the session.
     */
    private static final class CycleContext {
        private LedgerSession session;

        private CycleContext(LedgerSession session) {
            this.session = session;
        }
    }
}
